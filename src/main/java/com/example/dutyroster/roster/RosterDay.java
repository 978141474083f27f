package com.example.dutyroster.roster;

import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 日付ごとの勤務表ヘッダ。日付が主キーで、同一日の生成・更新の直列化点になる。
 */
@Entity
@Table(name = "roster_days")
public class RosterDay {

    @Id
    @Column(name = "roster_date")
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(name = "duty_type", nullable = false, length = 2)
    private DutyType dutyType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DayStatus status = DayStatus.DRAFT;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected RosterDay() {
    }

    public RosterDay(LocalDate date, DutyType dutyType) {
        this.date = date;
        this.dutyType = dutyType;
        this.status = DayStatus.DRAFT;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isPublished() {
        return status == DayStatus.PUBLISHED;
    }

    public boolean isDraft() {
        return status == DayStatus.DRAFT;
    }

    public LocalDate getDate() {
        return date;
    }

    public DutyType getDutyType() {
        return dutyType;
    }

    public void setDutyType(DutyType dutyType) {
        this.dutyType = dutyType;
    }

    public DayStatus getStatus() {
        return status;
    }

    public void setStatus(DayStatus status) {
        this.status = status;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
