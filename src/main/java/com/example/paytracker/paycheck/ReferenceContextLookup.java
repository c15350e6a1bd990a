package com.example.paytracker.paycheck;

@FunctionalInterface
public interface ReferenceContextLookup {

    /**
     * Reference figures for the given statement, falling back to an earlier statement when the
     * requested one has no positive base rate (for example a pay lapse). Never null.
     */
    ReferenceContext forPaycheck(Long paycheckId);
}
