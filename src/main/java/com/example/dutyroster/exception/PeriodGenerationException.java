package com.example.dutyroster.exception;

import java.time.LocalDate;

/**
 * 期間生成が途中の日付で失敗した場合の例外。失敗前の日付はコミット済み。
 */
public class PeriodGenerationException extends RuntimeException {

    private final LocalDate failedDate;
    private final int generatedDays;

    public PeriodGenerationException(LocalDate failedDate, int generatedDays, RuntimeException cause) {
        super(failedDate + " の生成に失敗しました: " + cause.getMessage(), cause);
        this.failedDate = failedDate;
        this.generatedDays = generatedDays;
    }

    public LocalDate getFailedDate() {
        return failedDate;
    }

    public int getGeneratedDays() {
        return generatedDays;
    }
}
