package com.example.dutyroster.common;

import com.example.dutyroster.roster.FatigueChecker;
import com.example.dutyroster.roster.RosterPeriodService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final Clock clock;
    private final FatigueChecker fatigueChecker;
    private final RosterPeriodService rosterPeriodService;

    public HealthController(Clock clock, FatigueChecker fatigueChecker, RosterPeriodService rosterPeriodService) {
        this.clock = clock;
        this.fatigueChecker = fatigueChecker;
        this.rosterPeriodService = rosterPeriodService;
    }

    @GetMapping("/api/health")
    public ResponseEntity<ApiResponse<Map<String, Object>>> health() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "UP");
        data.put("time", LocalDateTime.now(clock));
        data.put("restDays", fatigueChecker.getRestDays());
        data.put("periodMaxDays", rosterPeriodService.getMaxDays());
        return ResponseEntity.ok(ApiResponse.success("OK", data));
    }
}
