package com.example.paytracker.paycheck;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface PaycheckRepository extends JpaRepository<Paycheck, Long> {

    Optional<Paycheck> findByPayDate(LocalDate payDate);

    boolean existsByPayDate(LocalDate payDate);

    List<Paycheck> findAllByOrderByPayDateAsc();

    List<Paycheck> findAllByOrderByPayDateDesc();
}
