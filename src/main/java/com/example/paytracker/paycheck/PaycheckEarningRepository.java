package com.example.paytracker.paycheck;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PaycheckEarningRepository extends JpaRepository<PaycheckEarning, Long> {

    List<PaycheckEarning> findByPaycheckIdOrderByIdAsc(Long paycheckId);
}
