package com.example.paytracker.schedule;

import com.example.paytracker.common.ApiResponse;
import com.example.paytracker.common.ClockTimes;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.DayOfWeek;
import java.util.List;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ScheduleRowDto>>> listAll() {
        List<ScheduleRowDto> rows = scheduleService.listAll().stream().map(ScheduleRowDto::from).toList();
        return ResponseEntity.ok(ApiResponse.success("Schedules for all years", rows));
    }

    @GetMapping("/{year}")
    public ResponseEntity<ApiResponse<List<ScheduleRowDto>>> getYear(@PathVariable int year) {
        List<ScheduleRowDto> rows = scheduleService.listYear(year).stream().map(ScheduleRowDto::from).toList();
        return ResponseEntity.ok(ApiResponse.success("Schedule for " + year, rows));
    }

    @PutMapping("/{year}")
    public ResponseEntity<ApiResponse<List<ScheduleRowDto>>> saveYear(@PathVariable int year,
                                                                      @RequestBody List<ScheduleService.ScheduleDayRequest> days) {
        List<ScheduleRowDto> rows = scheduleService.saveYear(year, days).stream().map(ScheduleRowDto::from).toList();
        return ResponseEntity.ok(ApiResponse.success("Standard schedule updated", rows));
    }

    public record ScheduleRowDto(int year, DayOfWeek dayOfWeek, boolean workday, String startTime, String endTime) {
        static ScheduleRowDto from(ScheduleEntry entry) {
            return new ScheduleRowDto(entry.getScheduleYear(), entry.getDayOfWeek(),
                    Boolean.TRUE.equals(entry.getWorkday()),
                    ClockTimes.format(entry.getStartTime()), ClockTimes.format(entry.getEndTime()));
        }
    }
}
