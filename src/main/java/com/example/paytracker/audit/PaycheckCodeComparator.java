package com.example.paytracker.audit;

import com.example.paytracker.audit.CodeChangeReport.CodeChange;
import com.example.paytracker.audit.CodeChangeReport.Severity;
import com.example.paytracker.paycheck.DeclaredPaycheck;
import com.example.paytracker.paycheck.DeductionLine;
import com.example.paytracker.paycheck.EarningsLine;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

@Component
public class PaycheckCodeComparator {

    public CodeChangeReport compare(DeclaredPaycheck previous, DeclaredPaycheck current) {
        Set<String> previousEarnings = codes(previous.earnings(), EarningsLine::type);
        Set<String> currentEarnings = codes(current.earnings(), EarningsLine::type);
        Set<String> previousDeductions = codes(previous.deductions(), DeductionLine::type);
        Set<String> currentDeductions = codes(current.deductions(), DeductionLine::type);

        List<CodeChange> changes = new ArrayList<>();
        addIfAny(changes, Severity.ALERT, "New Earning Code detected", difference(currentEarnings, previousEarnings));
        addIfAny(changes, Severity.CRITICAL, "New Deduction appearing", difference(currentDeductions, previousDeductions));
        addIfAny(changes, Severity.WARNING, "Deduction disappeared", difference(previousDeductions, currentDeductions));

        return new CodeChangeReport(previous.id(), current.id(), current.meta().payDate(), changes);
    }

    private static void addIfAny(List<CodeChange> changes, Severity severity, String description, Set<String> codes) {
        if (!codes.isEmpty()) {
            changes.add(new CodeChange(severity, description, codes));
        }
    }

    private static Set<String> difference(Set<String> left, Set<String> right) {
        Set<String> result = new TreeSet<>(left);
        result.removeAll(right);
        return result;
    }

    private static <T> Set<String> codes(List<T> lines, Function<T, String> type) {
        Set<String> codes = new TreeSet<>();
        lines.stream().map(type).filter(Objects::nonNull).forEach(codes::add);
        return codes;
    }
}
