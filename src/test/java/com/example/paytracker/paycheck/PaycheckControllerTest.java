package com.example.paytracker.paycheck;

import com.example.paytracker.schedule.ScheduleService;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
class PaycheckControllerTest {

    private static final String PAYCHECK = """
        {
          "payDate": "2025-03-14",
          "periodEnding": "2025-03-08",
          "agency": "FAA",
          "grossPay": 4000.00,
          "totalDeductions": 458.00,
          "netPay": 3542.00,
          "earnings": [
            {"type": "Regular", "rate": 50.00, "hours": 80, "amountCurrent": 4000.00, "amountAdjusted": 0, "amountYtd": 20000.00}
          ],
          "deductions": [
            {"type": "Federal Tax", "amountCurrent": 400.00, "amountYtd": 2000.00},
            {"type": "Medicare", "amountCurrent": 58.00, "amountYtd": 290.00}
          ],
          "leave": [
            {"type": "Annual", "balanceStart": 6.45, "earnedCurrent": 4.00, "usedCurrent": 2.30, "balanceEnd": 8.15}
          ]
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private PaycheckRepository paycheckRepository;

    @Autowired
    private ScheduleService scheduleService;

    @Test
    void register_persistsStatementWithItsLines() throws Exception {
        mockMvc.perform(post("/api/paychecks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(PAYCHECK))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.id").isNumber())
            .andExpect(jsonPath("$.data.meta.periodEnding").value("2025-03-08"))
            .andExpect(jsonPath("$.data.earnings[0].type").value("Regular"))
            .andExpect(jsonPath("$.data.deductions.length()").value(2))
            .andExpect(jsonPath("$.data.leave[0].type").value("Annual"));

        Paycheck saved = paycheckRepository.findByPayDate(LocalDate.of(2025, 3, 14)).orElseThrow();
        assertThat(saved.getGrossPay()).isEqualByComparingTo("4000.00");
        assertThat(saved.getAgency()).isEqualTo("FAA");
    }

    @Test
    void register_rejectsSecondStatementForSamePayDate() throws Exception {
        register();

        mockMvc.perform(post("/api/paychecks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(PAYCHECK))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("PAYCHECK_EXISTS"));
    }

    @Test
    void register_requiresPayDate() throws Exception {
        mockMvc.perform(post("/api/paychecks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"periodEnding\": \"2025-03-08\", \"grossPay\": 100.00}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.payDate").value("payDate is required"));
    }

    @Test
    void unknownPaycheck_isNotFound() throws Exception {
        mockMvc.perform(get("/api/paychecks/999999"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("PAYCHECK_NOT_FOUND"));
    }

    @Test
    void list_isNewestFirst() throws Exception {
        register();
        mockMvc.perform(post("/api/paychecks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(PAYCHECK.replace("2025-03-14", "2025-03-28").replace("2025-03-08", "2025-03-22")))
            .andExpect(status().isCreated());

        mockMvc.perform(get("/api/paychecks"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(2))
            .andExpect(jsonPath("$.data[0].payDate").value("2025-03-28"))
            .andExpect(jsonPath("$.data[1].payDate").value("2025-03-14"));
    }

    @Test
    void audit_consistentStatementHasNoFlags() throws Exception {
        long id = register();

        mockMvc.perform(get("/api/paychecks/" + id + "/audit"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.flags").isEmpty());
    }

    @Test
    void audit_flagsLeaveThatDoesNotCarryForward() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/paychecks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(PAYCHECK.replace("\"balanceEnd\": 8.15", "\"balanceEnd\": 8.00")))
            .andExpect(status().isCreated())
            .andReturn();
        long id = idOf(result);

        mockMvc.perform(get("/api/paychecks/" + id + "/audit"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.flags.leave_Annual_end")
                .value("Math Error: 6.45 + 4.00 - 2.30 should be 8.15, stub says 8.00 (off by 15 min)"));
    }

    @Test
    void taxRate_isShareOfGrossWithheldAsTax() throws Exception {
        long id = register();

        mockMvc.perform(get("/api/paychecks/" + id + "/tax-rate"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.effectiveRatePercent").value(11.45));
    }

    @Test
    void expected_recomputesFromScheduleDefaults() throws Exception {
        saveWeekdaySchedule(2025);
        long id = register();

        mockMvc.perform(get("/api/paychecks/" + id + "/expected"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.meta.reliable").value(true))
            .andExpect(jsonPath("$.meta.timesheetSaved").value(false))
            .andExpect(jsonPath("$.data.breakdown.grossPay").value(4000.00))
            .andExpect(jsonPath("$.data.breakdown.netPay").value(3542.00))
            .andExpect(jsonPath("$.data.days.length()").value(14))
            .andExpect(jsonPath("$.data.uncreditedGapDates").isEmpty());
    }

    @Test
    void history_reportsCodeChangesBetweenConsecutiveStatements() throws Exception {
        register();
        String next = PAYCHECK.replace("2025-03-14", "2025-03-28").replace("2025-03-08", "2025-03-22")
                .replace("\"type\": \"Medicare\"", "\"type\": \"Union Dues\"");
        mockMvc.perform(post("/api/paychecks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(next))
            .andExpect(status().isCreated());

        mockMvc.perform(get("/api/paychecks/audit/history"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0].changes.length()").value(2))
            .andExpect(jsonPath("$.data[0].changes[0].severity").value("CRITICAL"))
            .andExpect(jsonPath("$.data[0].changes[1].severity").value("WARNING"));
    }

    private long register() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/paychecks")
                .contentType(MediaType.APPLICATION_JSON)
                .content(PAYCHECK))
            .andExpect(status().isCreated())
            .andReturn();
        return idOf(result);
    }

    private static long idOf(MvcResult result) throws Exception {
        Number id = JsonPath.read(result.getResponse().getContentAsString(), "$.data.id");
        return id.longValue();
    }

    private void saveWeekdaySchedule(int year) {
        List<ScheduleService.ScheduleDayRequest> days = new ArrayList<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
            days.add(new ScheduleService.ScheduleDayRequest(day, weekend ? null : "06:00", weekend ? null : "14:00"));
        }
        scheduleService.saveYear(year, days);
    }
}
