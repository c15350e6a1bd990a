package com.example.paytracker.timesheet;

import com.example.paytracker.schedule.ScheduleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class TimesheetControllerTest {

    private static final LocalDate PERIOD_ENDING = LocalDate.of(2025, 3, 8);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ScheduleService scheduleService;

    @Autowired
    private TimesheetService timesheetService;

    @BeforeEach
    void setUp() {
        List<ScheduleService.ScheduleDayRequest> days = new ArrayList<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
            days.add(new ScheduleService.ScheduleDayRequest(day, weekend ? null : "06:00", weekend ? null : "14:00"));
        }
        scheduleService.saveYear(2025, days);
    }

    @Test
    void unsavedPeriod_isPrefilledFromSchedule() throws Exception {
        mockMvc.perform(get("/api/timesheets/2025-03-08"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.saved").value(false))
            .andExpect(jsonPath("$.data.length()").value(14))
            .andExpect(jsonPath("$.data[0].date").value("2025-02-23"))
            .andExpect(jsonPath("$.data[0].startTime").doesNotExist())
            .andExpect(jsonPath("$.data[1].date").value("2025-02-24"))
            .andExpect(jsonPath("$.data[1].startTime").value("06:00"))
            .andExpect(jsonPath("$.data[1].endTime").value("14:00"))
            .andExpect(jsonPath("$.data[1].leaveType").value("NONE"))
            .andExpect(jsonPath("$.data[1].saved").value(false));
    }

    @Test
    void savePeriod_upsertsRowsAndMarksPeriodSaved() throws Exception {
        String payload = """
            [
              {"date": "2025-03-03", "startTime": "06:00", "endTime": "10:00", "leaveType": "Annual"},
              {"date": "2025-03-04", "startTime": "06:00", "endTime": "14:00", "ojtiHours": 2.5}
            ]
            """;

        mockMvc.perform(put("/api/timesheets/2025-03-08")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[8].date").value("2025-03-03"))
            .andExpect(jsonPath("$.data[8].endTime").value("10:00"))
            .andExpect(jsonPath("$.data[8].leaveType").value("ANNUAL"))
            .andExpect(jsonPath("$.data[8].saved").value(true))
            .andExpect(jsonPath("$.data[9].ojtiHours").value(2.5));

        assertThat(timesheetService.hasSavedEntries(PERIOD_ENDING)).isTrue();

        mockMvc.perform(put("/api/timesheets/2025-03-08")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"date\": \"2025-03-03\", \"startTime\": \"06:00\", \"endTime\": \"14:00\"}]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[8].endTime").value("14:00"))
            .andExpect(jsonPath("$.data[8].leaveType").value("NONE"));
    }

    @Test
    void savePeriod_rejectsDateOutsidePeriod() throws Exception {
        mockMvc.perform(put("/api/timesheets/2025-03-08")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"date\": \"2025-03-09\", \"startTime\": \"06:00\", \"endTime\": \"14:00\"}]"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_TIMESHEET"));
    }

    @Test
    void savePeriod_rejectsUnknownLeave() throws Exception {
        mockMvc.perform(put("/api/timesheets/2025-03-08")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[{\"date\": \"2025-03-03\", \"leaveType\": \"Vacation\"}]"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_TIMESHEET"));
    }

    @Test
    void saveEntries_filesEachDateUnderItsPeriod() throws Exception {
        String payload = """
            [
              {"date": "2025-03-07", "startTime": "06:00", "endTime": "16:00"},
              {"date": "2025-03-10", "startTime": "06:00", "endTime": "14:00"}
            ]
            """;

        mockMvc.perform(post("/api/timesheets/entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data['2025-03-08']").value(1))
            .andExpect(jsonPath("$.data['2025-03-22']").value(1));

        assertThat(timesheetService.hasSavedEntries(LocalDate.of(2025, 3, 8))).isTrue();
        assertThat(timesheetService.hasSavedEntries(LocalDate.of(2025, 3, 22))).isTrue();
        assertThat(timesheetService.hasSavedEntries(LocalDate.of(2025, 4, 5))).isFalse();
    }
}
