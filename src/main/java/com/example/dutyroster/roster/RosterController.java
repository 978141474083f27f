package com.example.dutyroster.roster;

import com.example.dutyroster.common.ApiResponse;
import com.example.dutyroster.person.PunishedPersonView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/roster")
public class RosterController {

    private static final Logger logger = LoggerFactory.getLogger(RosterController.class);

    private final RosterDayService rosterDayService;
    private final RosterPeriodService rosterPeriodService;
    private final PublicationService publicationService;
    private final RosterQueryService rosterQueryService;

    public RosterController(RosterDayService rosterDayService,
                            RosterPeriodService rosterPeriodService,
                            PublicationService publicationService,
                            RosterQueryService rosterQueryService) {
        this.rosterDayService = rosterDayService;
        this.rosterPeriodService = rosterPeriodService;
        this.publicationService = publicationService;
        this.rosterQueryService = rosterQueryService;
    }

    /**
     * 期間の勤務表を生成（曜日から勤務種別を決定）
     */
    @PostMapping("/generate/period")
    public ResponseEntity<ApiResponse<PeriodGenerationResult>> generatePeriod(@RequestBody @Valid DateRangeRequest request) {
        logger.info("期間生成リクエスト: {} 〜 {}", request.startDate(), request.endDate());
        PeriodGenerationResult result = rosterPeriodService.generatePeriod(request.startDate(), request.endDate());
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("generatedDays", result.generatedDays());
        return ResponseEntity.ok(ApiResponse.success(result.generatedDays() + "日分の勤務表を生成しました", result, meta));
    }

    /**
     * 1日分の勤務表を生成
     */
    @PostMapping("/generate/day")
    public ResponseEntity<ApiResponse<DayGenerationResult>> generateDay(@RequestBody @Valid GenerateDayRequest request) {
        DayGenerationResult result = rosterDayService.generateDay(request.date(), request.dutyType());
        return ResponseEntity.ok(ApiResponse.success(request.date() + " の勤務表を生成しました", result));
    }

    /**
     * 期間内の下書きを公開
     */
    @PostMapping("/publish")
    public ResponseEntity<ApiResponse<Map<String, Object>>> publish(@RequestBody @Valid DateRangeRequest request) {
        int published = publicationService.publish(request.startDate(), request.endDate());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("startDate", request.startDate());
        data.put("endDate", request.endDate());
        data.put("publishedDays", published);
        return ResponseEntity.ok(ApiResponse.success(published + "日分の勤務表を公開しました", data));
    }

    /**
     * 公開済みの日を下書きに戻す（正誤）
     */
    @PostMapping("/days/{date}/reopen")
    public ResponseEntity<ApiResponse<Map<String, Object>>> reopen(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        RosterDay day = publicationService.reopen(date);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("date", day.getDate());
        data.put("status", day.getStatus());
        return ResponseEntity.ok(ApiResponse.success(date + " を下書きに戻しました", data));
    }

    @GetMapping("/days")
    public ResponseEntity<ApiResponse<RosterOverview>> days(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from) {
        RosterOverview overview = rosterQueryService.daysFrom(from);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("published", overview.published().size());
        meta.put("drafts", overview.drafts().size());
        return ResponseEntity.ok(ApiResponse.success("勤務表", overview, meta));
    }

    @GetMapping("/persons/{personId}/duties")
    public ResponseEntity<ApiResponse<List<AllocationView>>> upcomingDuties(@PathVariable Long personId) {
        return ResponseEntity.ok(ApiResponse.success(rosterQueryService.upcomingDuties(personId)));
    }

    @GetMapping("/punished")
    public ResponseEntity<ApiResponse<List<PunishedPersonView>>> punished() {
        return ResponseEntity.ok(ApiResponse.success(rosterQueryService.punishedPersons()));
    }

    public record DateRangeRequest(
            @NotNull(message = "開始日は必須です") LocalDate startDate,
            @NotNull(message = "終了日は必須です") LocalDate endDate
    ) {}

    public record GenerateDayRequest(
            @NotNull(message = "日付は必須です") LocalDate date,
            @NotNull(message = "勤務種別は必須です") DutyType dutyType
    ) {}
}
