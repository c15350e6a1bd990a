package com.example.paytracker.timesheet;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface TimesheetEntryRepository extends JpaRepository<TimesheetEntry, Long> {
    List<TimesheetEntry> findByPeriodEndingOrderByWorkDateAsc(LocalDate periodEnding);

    Optional<TimesheetEntry> findByPeriodEndingAndWorkDate(LocalDate periodEnding, LocalDate workDate);

    boolean existsByPeriodEnding(LocalDate periodEnding);
}
