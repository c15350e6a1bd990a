package com.example.paytracker.paycheck;

import com.example.paytracker.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/paychecks")
public class PaycheckController {

    private final PaycheckService paycheckService;
    private final ExpectedPaycheckService expectedPaycheckService;

    public PaycheckController(PaycheckService paycheckService, ExpectedPaycheckService expectedPaycheckService) {
        this.paycheckService = paycheckService;
        this.expectedPaycheckService = expectedPaycheckService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<DeclaredPaycheck>> register(@Valid @RequestBody PaycheckRequest request) {
        DeclaredPaycheck saved = paycheckService.register(request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Paycheck registered", saved));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<PaycheckSummaryDto>>> list() {
        List<PaycheckSummaryDto> paychecks = paycheckService.listNewestFirst().stream()
                .map(PaycheckSummaryDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Paychecks", paychecks));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<DeclaredPaycheck>> get(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(paycheckService.declared(id)));
    }

    @GetMapping("/{id}/expected")
    public ResponseEntity<ApiResponse<ExpectedPaycheckService.ExpectedPaycheck>> expected(@PathVariable Long id) {
        ExpectedPaycheckService.ExpectedPaycheck expected = expectedPaycheckService.expectedFor(id);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("reliable", expected.breakdown().reliable());
        meta.put("timesheetSaved", expected.timesheetSaved());
        if (expected.referencePaycheckId() != null) {
            meta.put("referencePaycheckId", expected.referencePaycheckId());
        }
        return ResponseEntity.ok(ApiResponse.success("Expected paycheck", expected, meta));
    }

    public record PaycheckRequest(@NotNull(message = "payDate is required") LocalDate payDate,
                                  @NotNull(message = "periodEnding is required") LocalDate periodEnding,
                                  String agency,
                                  @NotNull(message = "grossPay is required") BigDecimal grossPay,
                                  BigDecimal totalDeductions,
                                  BigDecimal netPay,
                                  String remarks,
                                  List<@Valid EarningRequest> earnings,
                                  List<@Valid DeductionRequest> deductions,
                                  List<@Valid LeaveRequest> leave) {

        PaycheckService.PaycheckDraft toDraft() {
            return new PaycheckService.PaycheckDraft(payDate,
                    periodEnding,
                    agency,
                    grossPay,
                    totalDeductions,
                    netPay,
                    remarks,
                    earnings == null ? List.of() : earnings.stream().map(EarningRequest::toLine).toList(),
                    deductions == null ? List.of() : deductions.stream().map(DeductionRequest::toLine).toList(),
                    leave == null ? List.of() : leave.stream().map(LeaveRequest::toLine).toList());
        }
    }

    public record EarningRequest(@NotBlank(message = "earning type is required") String type,
                                 BigDecimal rate,
                                 BigDecimal hours,
                                 BigDecimal amountCurrent,
                                 BigDecimal amountAdjusted,
                                 BigDecimal amountYtd) {
        EarningsLine toLine() {
            return new EarningsLine(type, rate, hours, amountCurrent, amountAdjusted, amountYtd);
        }
    }

    public record DeductionRequest(@NotBlank(message = "deduction type is required") String type,
                                   BigDecimal amountCurrent,
                                   BigDecimal amountAdjusted,
                                   BigDecimal amountYtd) {
        DeductionLine toLine() {
            return new DeductionLine(type, amountCurrent, amountAdjusted, amountYtd);
        }
    }

    public record LeaveRequest(@NotBlank(message = "leave type is required") String type,
                               BigDecimal balanceStart,
                               BigDecimal earnedCurrent,
                               BigDecimal usedCurrent,
                               BigDecimal balanceEnd) {
        LeaveLine toLine() {
            return new LeaveLine(type, balanceStart, earnedCurrent, usedCurrent, balanceEnd);
        }
    }

    public record PaycheckSummaryDto(Long id, LocalDate payDate, LocalDate periodEnding, String agency,
                                     BigDecimal grossPay, BigDecimal totalDeductions, BigDecimal netPay) {
        static PaycheckSummaryDto from(Paycheck paycheck) {
            return new PaycheckSummaryDto(paycheck.getId(),
                    paycheck.getPayDate(),
                    paycheck.getPeriodEnding(),
                    paycheck.getAgency(),
                    paycheck.getGrossPay(),
                    paycheck.getTotalDeductions(),
                    paycheck.getNetPay());
        }
    }
}
