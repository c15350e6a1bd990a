package com.example.paytracker.holiday;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface HolidayRepository extends JpaRepository<Holiday, Long> {
    boolean existsByDate(LocalDate date);

    Optional<Holiday> findByDate(LocalDate date);

    List<Holiday> findByHolidayYearOrderByDateAsc(Integer holidayYear);

    List<Holiday> findAllByOrderByDateAsc();
}
