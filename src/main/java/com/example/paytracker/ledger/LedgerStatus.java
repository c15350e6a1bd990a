package com.example.paytracker.ledger;

public enum LedgerStatus {
    /** No timesheet was saved for the period; the declared gross is taken as correct. */
    UNAUDITED,
    BALANCED,
    /** Paid less than expected. */
    GOV_OWES_YOU,
    /** Paid more than expected; the difference may be recovered. */
    BACKPAY
}
