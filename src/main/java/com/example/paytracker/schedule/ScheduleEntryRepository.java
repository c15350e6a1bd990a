package com.example.paytracker.schedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScheduleEntryRepository extends JpaRepository<ScheduleEntry, Long> {
    List<ScheduleEntry> findByScheduleYear(Integer scheduleYear);

    Optional<ScheduleEntry> findByScheduleYearAndDayOfWeek(Integer scheduleYear, DayOfWeek dayOfWeek);

    List<ScheduleEntry> findAllByOrderByScheduleYearAsc();
}
