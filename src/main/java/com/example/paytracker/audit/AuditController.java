package com.example.paytracker.audit;

import com.example.paytracker.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/paychecks")
public class AuditController {

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    @GetMapping("/audit")
    public ResponseEntity<ApiResponse<List<AuditService.AuditSummary>>> auditAll() {
        List<AuditService.AuditSummary> summaries = auditService.auditAll();
        long flagged = summaries.stream().filter(s -> !s.clean()).count();
        return ResponseEntity.ok(ApiResponse.success("Audited " + summaries.size() + " paycheck(s)",
                summaries, Map.of("flagged", flagged)));
    }

    @GetMapping("/{id}/audit")
    public ResponseEntity<ApiResponse<AuditFlags>> audit(@PathVariable Long id) {
        AuditFlags flags = auditService.audit(id);
        return ResponseEntity.ok(ApiResponse.success(flags.isClean() ? "No findings" : "Findings", flags));
    }

    @GetMapping("/audit/history")
    public ResponseEntity<ApiResponse<List<CodeChangeReport>>> history() {
        return ResponseEntity.ok(ApiResponse.success("Code change history", auditService.codeHistory()));
    }

    @GetMapping("/{id}/tax-rate")
    public ResponseEntity<ApiResponse<EffectiveTaxRateCalculator.TaxRate>> taxRate(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Effective tax rate", auditService.taxRate(id)));
    }
}
