package com.example.dutyroster.exception;

import java.time.LocalDate;

/**
 * 配置可能な候補者が見つからず、その日の勤務表生成を中断した場合の例外。
 */
public class RosterGenerationException extends BusinessException {

    private final LocalDate date;
    private final String postName;
    private final String requiredYears;

    public RosterGenerationException(LocalDate date, String postName, String requiredYears) {
        super(ErrorCode.STAFFING,
                "配置可能な人員がいません: 日付=" + date + ", ポスト='" + postName
                        + "', 対象学年=(" + requiredYears + ")。学年制限または人員不足を確認してください",
                date, postName, requiredYears);
        this.date = date;
        this.postName = postName;
        this.requiredYears = requiredYears;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getPostName() {
        return postName;
    }

    public String getRequiredYears() {
        return requiredYears;
    }
}
