package com.example.paytracker.paycheck;

import com.example.paytracker.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Stores pay statements as issued and reads them back as {@link DeclaredPaycheck}s.
 */
@Service
@Transactional
public class PaycheckService {

    private static final Logger logger = LoggerFactory.getLogger(PaycheckService.class);

    private final PaycheckRepository paycheckRepository;
    private final PaycheckEarningRepository earningRepository;
    private final PaycheckDeductionRepository deductionRepository;
    private final PaycheckLeaveBalanceRepository leaveRepository;

    public PaycheckService(PaycheckRepository paycheckRepository,
                           PaycheckEarningRepository earningRepository,
                           PaycheckDeductionRepository deductionRepository,
                           PaycheckLeaveBalanceRepository leaveRepository) {
        this.paycheckRepository = paycheckRepository;
        this.earningRepository = earningRepository;
        this.deductionRepository = deductionRepository;
        this.leaveRepository = leaveRepository;
    }

    public DeclaredPaycheck register(PaycheckDraft draft) {
        if (paycheckRepository.existsByPayDate(draft.payDate())) {
            throw new BusinessException("PAYCHECK_EXISTS",
                    "A paycheck paid on " + draft.payDate() + " is already registered", draft.payDate());
        }
        Paycheck paycheck = new Paycheck(draft.payDate(), draft.periodEnding(), draft.agency());
        paycheck.setGrossPay(draft.grossPay());
        paycheck.setTotalDeductions(draft.totalDeductions());
        paycheck.setNetPay(draft.netPay());
        paycheck.setRemarks(draft.remarks());
        Paycheck saved = paycheckRepository.save(paycheck);

        for (EarningsLine line : draft.earnings()) {
            PaycheckEarning earning = new PaycheckEarning(saved, line.type());
            earning.setRate(line.rate());
            earning.setHoursCurrent(line.hours());
            earning.setAmountCurrent(line.currentAmount());
            earning.setAmountAdjusted(line.adjustedAmount());
            earning.setAmountYtd(line.ytdAmount());
            earningRepository.save(earning);
        }
        for (DeductionLine line : draft.deductions()) {
            PaycheckDeduction deduction = new PaycheckDeduction(saved, line.type());
            deduction.setAmountCurrent(line.currentAmount());
            deduction.setAmountAdjusted(line.adjustedAmount());
            deduction.setAmountYtd(line.ytdAmount());
            deductionRepository.save(deduction);
        }
        for (LeaveLine line : draft.leave()) {
            PaycheckLeaveBalance balance = new PaycheckLeaveBalance(saved, line.type());
            balance.setBalanceStart(line.start());
            balance.setEarnedCurrent(line.earned());
            balance.setUsedCurrent(line.used());
            balance.setBalanceEnd(line.end());
            leaveRepository.save(balance);
        }
        logger.info("Paycheck registered: id={}, payDate={}, periodEnding={}, gross={}",
                saved.getId(), saved.getPayDate(), saved.getPeriodEnding(), saved.getGrossPay());
        return toDeclared(saved);
    }

    @Transactional(readOnly = true)
    public List<Paycheck> listNewestFirst() {
        return paycheckRepository.findAllByOrderByPayDateDesc();
    }

    @Transactional(readOnly = true)
    public DeclaredPaycheck declared(Long paycheckId) {
        return toDeclared(find(paycheckId));
    }

    /** Every stored statement, oldest pay date first. */
    @Transactional(readOnly = true)
    public List<DeclaredPaycheck> declaredInPayDateOrder() {
        return paycheckRepository.findAllByOrderByPayDateAsc().stream()
                .map(this::toDeclared)
                .toList();
    }

    @Transactional(readOnly = true)
    public Paycheck find(Long paycheckId) {
        return paycheckRepository.findById(paycheckId)
                .orElseThrow(() -> new BusinessException("PAYCHECK_NOT_FOUND",
                        "Paycheck not found (id=" + paycheckId + ")", paycheckId));
    }

    DeclaredPaycheck toDeclared(Paycheck paycheck) {
        Long id = paycheck.getId();
        return new DeclaredPaycheck(id,
                paycheck.toPeriodMeta(),
                paycheck.getGrossPay(),
                paycheck.getTotalDeductions(),
                paycheck.getNetPay(),
                paycheck.getRemarks(),
                earningRepository.findByPaycheckIdOrderByIdAsc(id).stream().map(PaycheckEarning::toLine).toList(),
                deductionRepository.findByPaycheckIdOrderByIdAsc(id).stream().map(PaycheckDeduction::toLine).toList(),
                leaveRepository.findByPaycheckIdOrderByIdAsc(id).stream().map(PaycheckLeaveBalance::toLine).toList());
    }

    /** A statement to register, already validated at the web boundary. */
    public record PaycheckDraft(LocalDate payDate,
                                LocalDate periodEnding,
                                String agency,
                                BigDecimal grossPay,
                                BigDecimal totalDeductions,
                                BigDecimal netPay,
                                String remarks,
                                List<EarningsLine> earnings,
                                List<DeductionLine> deductions,
                                List<LeaveLine> leave) {

        public PaycheckDraft {
            earnings = earnings == null ? List.of() : earnings;
            deductions = deductions == null ? List.of() : deductions;
            leave = leave == null ? List.of() : leave;
        }
    }
}
