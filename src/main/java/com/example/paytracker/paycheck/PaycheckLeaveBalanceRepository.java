package com.example.paytracker.paycheck;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PaycheckLeaveBalanceRepository extends JpaRepository<PaycheckLeaveBalance, Long> {

    List<PaycheckLeaveBalance> findByPaycheckIdOrderByIdAsc(Long paycheckId);
}
