package com.example.paytracker.holiday;

import com.example.paytracker.common.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/holidays")
public class HolidayController {

    private final HolidayCalendarService calendarService;

    public HolidayController(HolidayCalendarService calendarService) {
        this.calendarService = calendarService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<HolidayDto>>> list(@RequestParam(required = false) Integer year) {
        List<HolidayDto> holidays = calendarService.list(year).stream().map(HolidayDto::from).toList();
        return ResponseEntity.ok(ApiResponse.success("Holidays", holidays));
    }

    @GetMapping("/{year}/observed")
    public ResponseEntity<ApiResponse<List<HolidayCalendarService.ObservedHoliday>>> observed(@PathVariable int year) {
        return ResponseEntity.ok(ApiResponse.success("Observed holidays for " + year, calendarService.observedForYear(year)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<HolidayDto>> create(@Valid @RequestBody HolidayRequest request) {
        Holiday saved = calendarService.register(request.date(), request.name());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Holiday registered", HolidayDto.from(saved)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<HolidayDto>> update(@PathVariable Long id,
                                                          @Valid @RequestBody HolidayRequest request) {
        Holiday saved = calendarService.update(id, request.date(), request.name());
        return ResponseEntity.ok(ApiResponse.success("Holiday updated", HolidayDto.from(saved)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable Long id) {
        calendarService.delete(id);
        return ResponseEntity.ok(ApiResponse.success("Holiday deleted", null));
    }

    public record HolidayRequest(@NotNull(message = "date is required") LocalDate date, String name) {}

    public record HolidayDto(Long id, int year, LocalDate date, String name) {
        static HolidayDto from(Holiday holiday) {
            return new HolidayDto(holiday.getId(), holiday.getHolidayYear(), holiday.getDate(), holiday.getName());
        }
    }
}
