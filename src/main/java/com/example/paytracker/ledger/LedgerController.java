package com.example.paytracker.ledger;

import com.example.paytracker.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

    private final LedgerService ledgerService;

    public LedgerController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<LedgerRow>>> ledger() {
        List<LedgerRow> rows = ledgerService.ledger();
        return ResponseEntity.ok(ApiResponse.success("Ledger", rows,
                Map.of("balance", LedgerService.finalBalance(rows))));
    }
}
