package com.example.paytracker.schedule;

import com.example.paytracker.common.ClockTimes;
import com.example.paytracker.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;

@Service
@Transactional
public class ScheduleService implements ScheduleLookup {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleEntryRepository scheduleRepository;

    public ScheduleService(ScheduleEntryRepository scheduleRepository) {
        this.scheduleRepository = scheduleRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public WeeklySchedule forYear(int year) {
        List<ScheduleEntry> entries = scheduleRepository.findByScheduleYear(year);
        if (entries.isEmpty()) {
            logger.warn("No standard schedule stored for {}; every day is treated as an RDO with no expected hours", year);
            return WeeklySchedule.empty();
        }
        return WeeklySchedule.of(entries.stream().map(ScheduleEntry::toScheduleDay).toList());
    }

    /**
     * Replaces the given weekdays of a year's schedule. Weekdays not mentioned keep their stored values.
     */
    public List<ScheduleEntry> saveYear(int year, List<ScheduleDayRequest> days) {
        for (ScheduleDayRequest day : days) {
            if (day.dayOfWeek() == null) {
                throw new BusinessException("INVALID_SCHEDULE", "dayOfWeek is required for every schedule row");
            }
            LocalTime start = ClockTimes.parseOrNull(day.startTime());
            LocalTime end = ClockTimes.parseOrNull(day.endTime());
            if (start != null && end == null) {
                throw new BusinessException("INVALID_SCHEDULE",
                        "End time is required when a start time is given (" + day.dayOfWeek() + ")", day.dayOfWeek());
            }
            ScheduleEntry entry = scheduleRepository.findByScheduleYearAndDayOfWeek(year, day.dayOfWeek())
                    .orElseGet(() -> new ScheduleEntry(year, day.dayOfWeek()));
            entry.applyTimes(start, end);
            scheduleRepository.save(entry);
        }
        logger.info("Standard schedule saved: year={}, days={}", year, days.size());
        return listYear(year);
    }

    @Transactional(readOnly = true)
    public List<ScheduleEntry> listYear(int year) {
        return scheduleRepository.findByScheduleYear(year).stream()
                .sorted(Comparator.comparing(ScheduleEntry::getDayOfWeek))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ScheduleEntry> listAll() {
        return scheduleRepository.findAllByOrderByScheduleYearAsc().stream()
                .sorted(Comparator.comparing(ScheduleEntry::getScheduleYear)
                        .thenComparing(ScheduleEntry::getDayOfWeek))
                .toList();
    }

    public record ScheduleDayRequest(DayOfWeek dayOfWeek, String startTime, String endTime) {}
}
