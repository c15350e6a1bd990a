package com.example.paytracker.timesheet;

import java.time.LocalDate;
import java.util.List;

/**
 * Saved shift entries, grouped by the pay period they belong to.
 */
public interface ShiftEntryStore {

    /** Entries for every day of the period, ordered by date. */
    List<ShiftEntry> entriesFor(LocalDate periodEnding);

    boolean hasSavedEntries(LocalDate periodEnding);
}
