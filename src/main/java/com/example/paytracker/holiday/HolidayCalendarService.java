package com.example.paytracker.holiday;

import com.example.paytracker.exception.BusinessException;
import com.example.paytracker.schedule.ScheduleLookup;
import com.example.paytracker.schedule.WeeklySchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Service
@Transactional(readOnly = true)
public class HolidayCalendarService implements HolidayLookup {

    private static final Logger logger = LoggerFactory.getLogger(HolidayCalendarService.class);

    private final HolidayRepository holidayRepository;
    private final ScheduleLookup scheduleLookup;
    private final ObservedHolidayResolver resolver;

    public HolidayCalendarService(HolidayRepository holidayRepository,
                                  ScheduleLookup scheduleLookup,
                                  ObservedHolidayResolver resolver) {
        this.holidayRepository = holidayRepository;
        this.scheduleLookup = scheduleLookup;
        this.resolver = resolver;
    }

    @Override
    public List<CalendarHoliday> forYear(int year) {
        return holidayRepository.findByHolidayYearOrderByDateAsc(year).stream()
                .map(Holiday::toCalendarHoliday)
                .toList();
    }

    public List<Holiday> list(Integer year) {
        return year == null
                ? holidayRepository.findAllByOrderByDateAsc()
                : holidayRepository.findByHolidayYearOrderByDateAsc(year);
    }

    /** The year's holidays with the day each one is credited on under that year's schedule. */
    public List<ObservedHoliday> observedForYear(int year) {
        WeeklySchedule schedule = scheduleLookup.forYear(year);
        return forYear(year).stream()
                .map(h -> new ObservedHoliday(h.name(), h.date(), resolver.resolve(h.date(), schedule)))
                .toList();
    }

    /** Registers a calendar date as a holiday; a date already on the calendar is renamed in place. */
    @Transactional
    public Holiday register(LocalDate date, String name) {
        Holiday holiday = holidayRepository.findByDate(date)
                .map(existing -> {
                    existing.setName(name);
                    return existing;
                })
                .orElseGet(() -> new Holiday(date, name));
        Holiday saved = holidayRepository.save(holiday);
        logger.info("Holiday saved: {} {}", saved.getDate(), saved.getName());
        return saved;
    }

    @Transactional
    public Holiday update(Long id, LocalDate date, String name) {
        Holiday holiday = holidayRepository.findById(id)
                .orElseThrow(() -> BusinessException.notFound("Holiday", id));
        if (!holiday.getDate().equals(date)) {
            if (holidayRepository.existsByDate(date)) {
                throw new BusinessException("HOLIDAY_EXISTS", "A holiday is already registered on " + date, date);
            }
            holiday.setDate(date);
        }
        holiday.setName(name);
        return holidayRepository.save(holiday);
    }

    @Transactional
    public void delete(Long id) {
        if (!holidayRepository.existsById(id)) {
            throw BusinessException.notFound("Holiday", id);
        }
        holidayRepository.deleteById(id);
        logger.info("Holiday {} deleted", id);
    }

    public record ObservedHoliday(String name, LocalDate calendarDate, LocalDate observedDate) {}
}
