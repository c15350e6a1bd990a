package com.example.paytracker.holiday;

import jakarta.persistence.*;
import java.time.LocalDate;

@Entity
@Table(name = "holidays")
public class Holiday {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "holiday_date", unique = true, nullable = false)
    private LocalDate date;

    @Column(name = "holiday_year", nullable = false)
    private Integer holidayYear;

    @Column(name = "name", nullable = false, length = 64)
    private String name;

    protected Holiday() {}

    public Holiday(LocalDate date, String name) {
        setDate(date);
        this.name = normalizeName(name);
    }

    public Long getId() { return id; }
    public LocalDate getDate() { return date; }
    public Integer getHolidayYear() { return holidayYear; }
    public String getName() { return name; }
    public void setName(String name) { this.name = normalizeName(name); }

    public void setDate(LocalDate date) {
        this.date = date;
        this.holidayYear = date == null ? null : date.getYear();
    }

    public CalendarHoliday toCalendarHoliday() {
        return new CalendarHoliday(holidayYear, name, date);
    }

    @PrePersist
    @PreUpdate
    void ensureName() {
        this.name = normalizeName(this.name);
    }

    private String normalizeName(String value) {
        if (value == null || value.isBlank()) {
            return "Holiday";
        }
        return value.trim();
    }
}
