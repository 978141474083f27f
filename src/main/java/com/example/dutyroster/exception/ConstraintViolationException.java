package com.example.dutyroster.exception;

/**
 * 休息ルール（前後24時間）などの配置制約に違反した場合の例外。
 */
public class ConstraintViolationException extends BusinessException {

    public static final String FATIGUE = "FATIGUE";

    private final String constraintType;
    private final Object constraintValue;

    public ConstraintViolationException(String message, String constraintType, Object constraintValue) {
        super(ErrorCode.FATIGUE_VIOLATION, message, constraintValue);
        this.constraintType = constraintType;
        this.constraintValue = constraintValue;
    }

    public static ConstraintViolationException fatigue(Long personId, java.time.LocalDate date) {
        return new ConstraintViolationException(
                "休息ルール違反: 対象者 " + personId + " は " + date + " の前後に別の勤務があります",
                FATIGUE, date);
    }

    public String getConstraintType() {
        return constraintType;
    }

    public Object getConstraintValue() {
        return constraintValue;
    }
}
