package com.example.paytracker.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Arithmetic findings on one declared statement, keyed by the field they concern, in the order found.
 * An empty set means the statement is internally consistent, not that it is correct.
 */
public record AuditFlags(Map<String, String> flags) {

    public AuditFlags {
        flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    public static AuditFlags clean() {
        return new AuditFlags(Map.of());
    }

    public boolean isClean() {
        return flags.isEmpty();
    }
}
