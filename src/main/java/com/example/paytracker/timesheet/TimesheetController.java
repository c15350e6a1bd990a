package com.example.paytracker.timesheet;

import com.example.paytracker.common.ApiResponse;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/timesheets")
public class TimesheetController {

    private final TimesheetService timesheetService;

    public TimesheetController(TimesheetService timesheetService) {
        this.timesheetService = timesheetService;
    }

    @GetMapping("/{periodEnding}")
    public ResponseEntity<ApiResponse<List<TimesheetService.TimesheetRow>>> load(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodEnding) {
        return ResponseEntity.ok(ApiResponse.success("Timesheet for period ending " + periodEnding,
                timesheetService.loadPeriod(periodEnding),
                Map.of("saved", timesheetService.hasSavedEntries(periodEnding))));
    }

    @PutMapping("/{periodEnding}")
    public ResponseEntity<ApiResponse<List<TimesheetService.TimesheetRow>>> save(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodEnding,
            @RequestBody List<TimesheetService.TimesheetRowRequest> rows) {
        return ResponseEntity.ok(ApiResponse.success("Timesheet saved", timesheetService.savePeriod(periodEnding, rows)));
    }

    @PostMapping("/entries")
    public ResponseEntity<ApiResponse<Map<LocalDate, Integer>>> saveEntries(
            @RequestBody List<TimesheetService.TimesheetRowRequest> rows) {
        return ResponseEntity.ok(ApiResponse.success("Saved " + rows.size() + " entries", timesheetService.saveEntries(rows)));
    }
}
