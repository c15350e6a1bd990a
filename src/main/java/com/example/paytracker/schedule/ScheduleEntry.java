package com.example.paytracker.schedule;

import jakarta.persistence.*;

import java.time.DayOfWeek;
import java.time.LocalTime;

@Entity
@Table(name = "schedule_entries",
        uniqueConstraints = @UniqueConstraint(columnNames = {"schedule_year", "day_of_week"}))
public class ScheduleEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "schedule_year", nullable = false)
    private Integer scheduleYear;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 16)
    private DayOfWeek dayOfWeek;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    @Column(name = "workday", nullable = false)
    private Boolean workday = Boolean.FALSE;

    protected ScheduleEntry() {}

    public ScheduleEntry(Integer scheduleYear, DayOfWeek dayOfWeek) {
        this.scheduleYear = scheduleYear;
        this.dayOfWeek = dayOfWeek;
    }

    /** A day with a start time is a workday; clearing the start time turns it into an RDO. */
    public void applyTimes(LocalTime startTime, LocalTime endTime) {
        this.startTime = startTime;
        this.endTime = startTime == null ? null : endTime;
        this.workday = startTime != null;
    }

    public ScheduleDay toScheduleDay() {
        return new ScheduleDay(dayOfWeek, Boolean.TRUE.equals(workday), startTime, endTime);
    }

    public Long getId() { return id; }
    public Integer getScheduleYear() { return scheduleYear; }
    public DayOfWeek getDayOfWeek() { return dayOfWeek; }
    public LocalTime getStartTime() { return startTime; }
    public LocalTime getEndTime() { return endTime; }
    public Boolean getWorkday() { return workday; }
}
