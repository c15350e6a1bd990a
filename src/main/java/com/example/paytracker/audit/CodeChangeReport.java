package com.example.paytracker.audit;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Earning and deduction codes that appeared or disappeared between two consecutive statements.
 */
public record CodeChangeReport(Long previousPaycheckId,
                               Long paycheckId,
                               LocalDate payDate,
                               List<CodeChange> changes) {

    public CodeChangeReport {
        changes = List.copyOf(changes);
    }

    public boolean isClean() {
        return changes.isEmpty();
    }

    public List<String> messages() {
        return changes.stream().map(CodeChange::message).toList();
    }

    public enum Severity {
        /** A new earning code. */
        ALERT,
        /** A new deduction code. */
        CRITICAL,
        /** A deduction code that is no longer taken. */
        WARNING
    }

    public record CodeChange(Severity severity, String description, Set<String> codes) {

        public String message() {
            return severity + ": " + description + ": " + codes;
        }
    }
}
