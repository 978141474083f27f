package com.example.dutyroster.roster;

import com.example.dutyroster.exception.BusinessException;
import com.example.dutyroster.exception.PeriodGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * 期間の勤務表を1日ずつ生成する。各日付は {@link RosterDayService} の独立したトランザクションで確定し、
 * 最初に失敗した日付で停止する（それより前の日付は確定済みのまま残る）。
 */
@Service
public class RosterPeriodService {

    private static final Logger logger = LoggerFactory.getLogger(RosterPeriodService.class);

    private final RosterDayService rosterDayService;
    private final int maxDays;

    public RosterPeriodService(RosterDayService rosterDayService,
                               @Value("${roster.period.max-days:62}") int maxDays) {
        this.rosterDayService = rosterDayService;
        this.maxDays = maxDays;
    }

    public PeriodGenerationResult generatePeriod(LocalDate startDate, LocalDate endDate) {
        validateRange(startDate, endDate, maxDays);
        logger.info("期間の勤務表を生成します: {} 〜 {}", startDate, endDate);

        List<DayGenerationResult> days = new ArrayList<>();
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            try {
                days.add(rosterDayService.generateDay(date, DutyType.forDate(date)));
            } catch (RuntimeException e) {
                logger.warn("期間生成を停止しました: 失敗日={}, 生成済み={}日, 理由={}", date, days.size(), e.getMessage());
                throw new PeriodGenerationException(date, days.size(), e);
            }
        }

        logger.info("期間の勤務表を生成しました: {} 〜 {}, {}日", startDate, endDate, days.size());
        return new PeriodGenerationResult(startDate, endDate, days.size(), days);
    }

    static void validateRange(LocalDate startDate, LocalDate endDate, int maxDays) {
        if (startDate == null || endDate == null) {
            throw BusinessException.validation("開始日と終了日は必須です");
        }
        if (startDate.isAfter(endDate)) {
            throw BusinessException.validation("開始日は終了日以前である必要があります: " + startDate + " > " + endDate,
                    startDate, endDate);
        }
        long days = ChronoUnit.DAYS.between(startDate, endDate) + 1;
        if (days > maxDays) {
            throw BusinessException.validation("期間が長すぎます: " + days + "日 (上限 " + maxDays
                            + "日、roster.period.max-days で変更可能)",
                    startDate, endDate, maxDays);
        }
    }

    public int getMaxDays() {
        return maxDays;
    }
}
