package com.example.paytracker.paycheck;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PaycheckDeductionRepository extends JpaRepository<PaycheckDeduction, Long> {

    List<PaycheckDeduction> findByPaycheckIdOrderByIdAsc(Long paycheckId);
}
