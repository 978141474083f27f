package com.example.dutyroster.roster;

import com.example.dutyroster.exception.ConstraintViolationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * 休息ルール: 対象日の前後 {@code restDays} 日以内（当日を含む）に別の勤務があれば配置不可。
 * <p>
 * 呼び出し元のトランザクション内で評価するため、同じ処理で先に書き込んだ割り当ても判定に含まれる。
 */
@Component
public class FatigueChecker {

    private final AllocationRepository allocationRepository;
    private final int restDays;

    public FatigueChecker(AllocationRepository allocationRepository,
                          @Value("${roster.fatigue.rest-days:1}") int restDays) {
        if (restDays < 0) {
            throw new IllegalArgumentException("roster.fatigue.rest-days must not be negative: " + restDays);
        }
        this.allocationRepository = allocationRepository;
        this.restDays = restDays;
    }

    public boolean isFatigued(Long personId, LocalDate date) {
        return allocationRepository.existsByPersonIdAndDateBetween(
                personId, date.minusDays(restDays), date.plusDays(restDays));
    }

    /**
     * 交代対象の割り当て自身との衝突を避けるため、指定IDを除外して判定する。
     */
    public boolean isFatigued(Long personId, LocalDate date, Collection<Long> excludedAllocationIds) {
        if (excludedAllocationIds == null || excludedAllocationIds.isEmpty()) {
            return isFatigued(personId, date);
        }
        return allocationRepository.countByPersonIdAndDateBetweenExcluding(
                personId, date.minusDays(restDays), date.plusDays(restDays), excludedAllocationIds) > 0;
    }

    public void requireRested(Long personId, LocalDate date, Collection<Long> excludedAllocationIds) {
        if (isFatigued(personId, date, excludedAllocationIds)) {
            throw ConstraintViolationException.fatigue(personId, date);
        }
    }

    public void requireRested(Long personId, LocalDate date) {
        requireRested(personId, date, List.of());
    }

    public int getRestDays() {
        return restDays;
    }
}
