package com.example.paytracker.timesheet;

import com.example.paytracker.common.ClockTimes;
import com.example.paytracker.exception.BusinessException;
import com.example.paytracker.schedule.ScheduleDay;
import com.example.paytracker.schedule.ScheduleLookup;
import com.example.paytracker.schedule.WeeklySchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Transactional
public class TimesheetService implements ShiftEntryStore {

    private static final Logger logger = LoggerFactory.getLogger(TimesheetService.class);

    private final TimesheetEntryRepository entryRepository;
    private final ScheduleLookup scheduleLookup;
    private final PayPeriodCalendar periodCalendar;

    public TimesheetService(TimesheetEntryRepository entryRepository,
                            ScheduleLookup scheduleLookup,
                            PayPeriodCalendar periodCalendar) {
        this.entryRepository = entryRepository;
        this.scheduleLookup = scheduleLookup;
        this.periodCalendar = periodCalendar;
    }

    /**
     * All 14 days of the period. Days never saved are pre-filled from the standard schedule of their year:
     * scheduled start and end on workdays, blank on RDOs.
     */
    @Transactional(readOnly = true)
    public List<TimesheetRow> loadPeriod(LocalDate periodEnding) {
        Map<LocalDate, TimesheetEntry> saved = entryRepository.findByPeriodEndingOrderByWorkDateAsc(periodEnding).stream()
                .collect(Collectors.toMap(TimesheetEntry::getWorkDate, Function.identity(), (a, b) -> a));
        Map<Integer, WeeklySchedule> schedules = new HashMap<>();

        List<TimesheetRow> rows = new ArrayList<>();
        for (LocalDate date : PayPeriodCalendar.datesOf(periodEnding)) {
            TimesheetEntry entry = saved.get(date);
            if (entry != null) {
                rows.add(TimesheetRow.from(entry));
                continue;
            }
            WeeklySchedule schedule = schedules.computeIfAbsent(date.getYear(), scheduleLookup::forYear);
            Optional<ScheduleDay> day = schedule.day(date.getDayOfWeek()).filter(ScheduleDay::workday);
            rows.add(new TimesheetRow(date,
                    day.map(d -> ClockTimes.format(d.startTime())).orElse(null),
                    day.map(d -> ClockTimes.format(d.endTime())).orElse(null),
                    LeaveDesignation.NONE,
                    BigDecimal.ZERO,
                    BigDecimal.ZERO,
                    false));
        }
        return rows;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ShiftEntry> entriesFor(LocalDate periodEnding) {
        return loadPeriod(periodEnding).stream().map(TimesheetRow::toShiftEntry).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasSavedEntries(LocalDate periodEnding) {
        return entryRepository.existsByPeriodEnding(periodEnding);
    }

    /** Upserts rows of one period; every date must lie inside it. */
    public List<TimesheetRow> savePeriod(LocalDate periodEnding, List<TimesheetRowRequest> rows) {
        for (TimesheetRowRequest row : rows) {
            if (row.date() == null || !PayPeriodCalendar.contains(periodEnding, row.date())) {
                throw new BusinessException("INVALID_TIMESHEET",
                        "Date " + row.date() + " is outside the period ending " + periodEnding, row.date());
            }
        }
        rows.forEach(row -> upsert(periodEnding, row));
        logger.info("Timesheet saved: periodEnding={}, rows={}", periodEnding, rows.size());
        return loadPeriod(periodEnding);
    }

    /**
     * Upserts rows keyed by date alone, filing each under the pay period that contains it.
     *
     * @return number of rows saved per period ending
     */
    public Map<LocalDate, Integer> saveEntries(List<TimesheetRowRequest> rows) {
        Map<LocalDate, Integer> counts = new LinkedHashMap<>();
        for (TimesheetRowRequest row : rows) {
            if (row.date() == null) {
                throw new BusinessException("INVALID_TIMESHEET", "date is required for every entry");
            }
            LocalDate periodEnding = periodCalendar.periodEndingFor(row.date());
            upsert(periodEnding, row);
            counts.merge(periodEnding, 1, Integer::sum);
        }
        logger.info("Timesheet entries saved across {} period(s): {}", counts.size(), counts);
        return counts;
    }

    private void upsert(LocalDate periodEnding, TimesheetRowRequest row) {
        LocalTime start = ClockTimes.parseOrNull(row.startTime());
        LocalTime end = ClockTimes.parseOrNull(row.endTime());
        BigDecimal ojti = nonNegative(row.ojtiHours(), "ojtiHours", row.date());
        BigDecimal cic = nonNegative(row.cicHours(), "cicHours", row.date());
        LeaveDesignation leave;
        try {
            leave = LeaveDesignation.fromLabel(row.leaveType());
        } catch (IllegalArgumentException e) {
            throw new BusinessException("INVALID_TIMESHEET", e.getMessage(), e, row.leaveType());
        }

        TimesheetEntry entry = entryRepository.findByPeriodEndingAndWorkDate(periodEnding, row.date())
                .orElseGet(() -> new TimesheetEntry(periodEnding, row.date()));
        entry.setStartTime(start);
        entry.setEndTime(end);
        entry.setLeaveDesignation(leave);
        entry.setOjtiHours(ojti);
        entry.setCicHours(cic);
        entryRepository.save(entry);
    }

    private BigDecimal nonNegative(BigDecimal value, String field, LocalDate date) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0) {
            throw new BusinessException("INVALID_TIMESHEET", field + " must not be negative (" + date + ")", date);
        }
        return value;
    }

    public record TimesheetRowRequest(LocalDate date,
                                      String startTime,
                                      String endTime,
                                      String leaveType,
                                      BigDecimal ojtiHours,
                                      BigDecimal cicHours) {}

    public record TimesheetRow(LocalDate date,
                               String startTime,
                               String endTime,
                               LeaveDesignation leaveType,
                               BigDecimal ojtiHours,
                               BigDecimal cicHours,
                               boolean saved) {
        static TimesheetRow from(TimesheetEntry entry) {
            return new TimesheetRow(entry.getWorkDate(),
                    ClockTimes.format(entry.getStartTime()),
                    ClockTimes.format(entry.getEndTime()),
                    entry.getLeaveDesignation(),
                    entry.getOjtiHours(),
                    entry.getCicHours(),
                    true);
        }

        ShiftEntry toShiftEntry() {
            Map<SupplementalCategory, BigDecimal> supplemental = new HashMap<>();
            supplemental.put(SupplementalCategory.OJTI, ojtiHours);
            supplemental.put(SupplementalCategory.CIC, cicHours);
            return new ShiftEntry(date,
                    ClockTimes.parseOrNull(startTime),
                    ClockTimes.parseOrNull(endTime),
                    leaveType,
                    supplemental);
        }
    }
}
