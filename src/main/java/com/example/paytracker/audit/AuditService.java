package com.example.paytracker.audit;

import com.example.paytracker.paycheck.DeclaredPaycheck;
import com.example.paytracker.paycheck.PaycheckService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@Transactional(readOnly = true)
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final PaycheckService paycheckService;
    private final PaycheckAuditChecker auditChecker;
    private final PaycheckCodeComparator codeComparator;
    private final EffectiveTaxRateCalculator taxRateCalculator;

    public AuditService(PaycheckService paycheckService,
                        PaycheckAuditChecker auditChecker,
                        PaycheckCodeComparator codeComparator,
                        EffectiveTaxRateCalculator taxRateCalculator) {
        this.paycheckService = paycheckService;
        this.auditChecker = auditChecker;
        this.codeComparator = codeComparator;
        this.taxRateCalculator = taxRateCalculator;
    }

    public AuditFlags audit(Long paycheckId) {
        return auditChecker.audit(paycheckService.declared(paycheckId));
    }

    public List<AuditSummary> auditAll() {
        List<AuditSummary> summaries = new ArrayList<>();
        for (DeclaredPaycheck paycheck : paycheckService.declaredInPayDateOrder()) {
            AuditFlags flags = auditChecker.audit(paycheck);
            if (!flags.isClean()) {
                logger.info("Paycheck {} ({}) has {} arithmetic finding(s)",
                        paycheck.id(), paycheck.meta().payDate(), flags.flags().size());
            }
            summaries.add(new AuditSummary(paycheck.id(), paycheck.meta().payDate(), flags.isClean(), flags.flags()));
        }
        return summaries;
    }

    /** Each statement compared with the one paid before it, oldest first. */
    public List<CodeChangeReport> codeHistory() {
        List<DeclaredPaycheck> paychecks = paycheckService.declaredInPayDateOrder();
        List<CodeChangeReport> reports = new ArrayList<>();
        for (int i = 1; i < paychecks.size(); i++) {
            CodeChangeReport report = codeComparator.compare(paychecks.get(i - 1), paychecks.get(i));
            if (!report.isClean()) {
                logger.info("Code changes on {}: {}", report.payDate(), report.messages());
            }
            reports.add(report);
        }
        return reports;
    }

    public EffectiveTaxRateCalculator.TaxRate taxRate(Long paycheckId) {
        return taxRateCalculator.calculate(paycheckService.declared(paycheckId));
    }

    public record AuditSummary(Long paycheckId, LocalDate payDate, boolean clean, Map<String, String> flags) {}
}
