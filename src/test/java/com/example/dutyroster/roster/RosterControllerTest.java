package com.example.dutyroster.roster;

import com.example.dutyroster.common.error.ErrorLogBuffer;
import com.example.dutyroster.person.Gender;
import com.example.dutyroster.person.Person;
import com.example.dutyroster.post.GenderRestriction;
import com.example.dutyroster.support.RosterFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RosterControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RosterFixtures fixtures;

    @Autowired
    private RosterDayRepository rosterDayRepository;

    @Autowired
    private ErrorLogBuffer errorLogBuffer;

    private Person junior;

    @BeforeEach
    void setUp() {
        fixtures.reset();
        errorLogBuffer.clear();
        fixtures.post("正門", GenderRestriction.MIXED, "1", 1);
        junior = fixtures.person("一年A", Gender.M, 1);
        fixtures.person("一年B", Gender.F, 1);
    }

    @Test
    void generateDay_returnsAllocations() throws Exception {
        mockMvc.perform(post("/api/roster/generate/day")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"date": "2031-03-04", "dutyType": "RN"}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.date").value("2031-03-04"))
            .andExpect(jsonPath("$.data.dutyType").value("RN"))
            .andExpect(jsonPath("$.data.status").value("DRAFT"))
            .andExpect(jsonPath("$.data.allocations[0].postName").value("正門"))
            .andExpect(jsonPath("$.data.allocations[0].personId").value(junior.getId()));

        assertThat(rosterDayRepository.existsById(LocalDate.of(2031, 3, 4))).isTrue();
    }

    @Test
    void generateDay_rejectsMalformedRequests() throws Exception {
        mockMvc.perform(post("/api/roster/generate/day")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"date": "2031-03-04", "dutyType": "XX"}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION"));

        mockMvc.perform(post("/api/roster/generate/day")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"dutyType": "RN"}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION"))
            .andExpect(jsonPath("$.details.date").exists());

        assertThat(rosterDayRepository.count()).isZero();
    }

    @Test
    void generateDay_staffingFailureNamesBlockingPost() throws Exception {
        fixtures.post("当直長", GenderRestriction.MIXED, "3", 5);

        mockMvc.perform(post("/api/roster/generate/day")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"date": "2031-03-04", "dutyType": "RN"}
                    """))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("STAFFING"))
            .andExpect(jsonPath("$.details.post").value("当直長"))
            .andExpect(jsonPath("$.details.requiredYears").value("3"))
            .andExpect(jsonPath("$.details.date").value("2031-03-04"));

        mockMvc.perform(get("/api/admin/errors"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].code").value("STAFFING"));
    }

    @Test
    void generatePeriod_reportsGeneratedDaysAndFailedDate() throws Exception {
        mockMvc.perform(post("/api/roster/generate/period")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"startDate": "2031-03-03", "endDate": "2031-03-09"}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.generatedDays").value(7))
            .andExpect(jsonPath("$.meta.generatedDays").value(7))
            .andExpect(jsonPath("$.data.days[4].dutyType").value("RD"));

        fixtures.post("当直長", GenderRestriction.MIXED, "3", 5);
        mockMvc.perform(post("/api/roster/generate/period")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"startDate": "2031-03-10", "endDate": "2031-03-12"}
                    """))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("STAFFING"))
            .andExpect(jsonPath("$.details.failedDate").value("2031-03-10"))
            .andExpect(jsonPath("$.details.generatedDays").value(0))
            .andExpect(jsonPath("$.details.post").value("当直長"));
    }

    @Test
    void generatePeriod_reversedRangeIsValidationError() throws Exception {
        mockMvc.perform(post("/api/roster/generate/period")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"startDate": "2031-03-09", "endDate": "2031-03-03"}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("VALIDATION"));
    }

    @Test
    void publishAndReopen_followDayLifecycle() throws Exception {
        mockMvc.perform(post("/api/roster/publish")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"startDate": "2031-03-03", "endDate": "2031-03-04"}
                    """))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("NOTHING_TO_PUBLISH"));

        mockMvc.perform(post("/api/roster/generate/period")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"startDate": "2031-03-03", "endDate": "2031-03-04"}
                    """))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/roster/publish")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"startDate": "2031-03-03", "endDate": "2031-03-04"}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.publishedDays").value(2));

        mockMvc.perform(post("/api/roster/generate/day")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"date": "2031-03-04", "dutyType": "RN"}
                    """))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("ALREADY_PUBLISHED"));

        mockMvc.perform(post("/api/roster/days/2031-03-04/reopen"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("DRAFT"));

        mockMvc.perform(post("/api/roster/days/2031-03-04/reopen"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("NOT_PUBLISHED"));

        mockMvc.perform(post("/api/roster/days/2031-04-01/reopen"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        mockMvc.perform(get("/api/roster/days").param("from", "2031-03-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.published.length()").value(1))
            .andExpect(jsonPath("$.data.published[0].date").value("2031-03-03"))
            .andExpect(jsonPath("$.data.drafts.length()").value(1))
            .andExpect(jsonPath("$.data.drafts[0].allocations[0].postName").value("正門"));
    }

    @Test
    void readViews_listDutiesAndPunishedPersons() throws Exception {
        fixtures.person("懲罰中", Gender.M, 2, 0, 0, 2);
        mockMvc.perform(post("/api/roster/generate/day")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"date": "2031-03-04", "dutyType": "RN"}
                    """))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/roster/persons/" + junior.getId() + "/duties"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].date").value("2031-03-04"));

        mockMvc.perform(get("/api/roster/persons/999999/duties"))
            .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/roster/punished"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(1))
            .andExpect(jsonPath("$.data[0].name").value("懲罰中"))
            .andExpect(jsonPath("$.data[0].punishmentBalance").value(2));
    }

    @Test
    void health_isUp() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("UP"))
            .andExpect(jsonPath("$.data.restDays").value(1));
    }
}
