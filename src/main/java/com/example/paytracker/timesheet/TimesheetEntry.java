package com.example.paytracker.timesheet;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.EnumMap;
import java.util.Map;

@Entity
@Table(name = "timesheet_entries",
        uniqueConstraints = @UniqueConstraint(columnNames = {"period_ending", "work_date"}))
public class TimesheetEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "period_ending", nullable = false)
    private LocalDate periodEnding;

    @Column(name = "work_date", nullable = false)
    private LocalDate workDate;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "leave_designation", length = 16)
    private LeaveDesignation leaveDesignation = LeaveDesignation.NONE;

    @Column(name = "ojti_hours", precision = 8, scale = 4)
    private BigDecimal ojtiHours = BigDecimal.ZERO;

    @Column(name = "cic_hours", precision = 8, scale = 4)
    private BigDecimal cicHours = BigDecimal.ZERO;

    protected TimesheetEntry() {}

    public TimesheetEntry(LocalDate periodEnding, LocalDate workDate) {
        this.periodEnding = periodEnding;
        this.workDate = workDate;
    }

    public ShiftEntry toShiftEntry() {
        Map<SupplementalCategory, BigDecimal> supplemental = new EnumMap<>(SupplementalCategory.class);
        supplemental.put(SupplementalCategory.OJTI, ojtiHours == null ? BigDecimal.ZERO : ojtiHours);
        supplemental.put(SupplementalCategory.CIC, cicHours == null ? BigDecimal.ZERO : cicHours);
        return new ShiftEntry(workDate, startTime, endTime, leaveDesignation, supplemental);
    }

    public Long getId() { return id; }
    public LocalDate getPeriodEnding() { return periodEnding; }
    public LocalDate getWorkDate() { return workDate; }
    public LocalTime getStartTime() { return startTime; }
    public void setStartTime(LocalTime startTime) { this.startTime = startTime; }
    public LocalTime getEndTime() { return endTime; }
    public void setEndTime(LocalTime endTime) { this.endTime = endTime; }
    public LeaveDesignation getLeaveDesignation() { return leaveDesignation; }
    public void setLeaveDesignation(LeaveDesignation leaveDesignation) { this.leaveDesignation = LeaveDesignation.orNone(leaveDesignation); }
    public BigDecimal getOjtiHours() { return ojtiHours; }
    public void setOjtiHours(BigDecimal ojtiHours) { this.ojtiHours = ojtiHours == null ? BigDecimal.ZERO : ojtiHours; }
    public BigDecimal getCicHours() { return cicHours; }
    public void setCicHours(BigDecimal cicHours) { this.cicHours = cicHours == null ? BigDecimal.ZERO : cicHours; }
}
