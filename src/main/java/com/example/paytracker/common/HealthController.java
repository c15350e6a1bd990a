package com.example.paytracker.common;

import com.example.paytracker.paycheck.PaycheckRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final PaycheckRepository paycheckRepository;

    public HealthController(PaycheckRepository paycheckRepository) {
        this.paycheckRepository = paycheckRepository;
    }

    @GetMapping("/api/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        return ResponseEntity.ok(ApiResponse.success("OK", Map.of(
                "status", "UP",
                "paychecks", paycheckRepository.count())));
    }
}
