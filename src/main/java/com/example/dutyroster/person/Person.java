package com.example.dutyroster.person;

import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

/**
 * 勤務対象者。アカウント管理側が所有し、公平性カウンタと懲罰残高のみ本モジュールが更新する。
 */
@Entity
@Table(name = "persons")
public class Person {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    @NotBlank(message = "氏名は必須です")
    @Size(max = 100, message = "氏名は100文字以下で入力してください")
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 1)
    @NotNull(message = "性別は必須です")
    private Gender gender;

    @Column(name = "class_label", nullable = false)
    private String classLabel = "";

    // seniority year
    @Column(name = "seniority_year", nullable = false)
    @Min(value = 0, message = "学年は0以上である必要があります")
    private Integer year = 0;

    // RN (normal routine) counter
    @Column(name = "normal_duties", nullable = false)
    private Integer normalDuties = 0;

    // RD (weekend/holiday routine) counter
    @Column(name = "weekend_duties", nullable = false)
    private Integer weekendDuties = 0;

    @Column(name = "punishment_balance", nullable = false)
    @Min(value = 0, message = "懲罰残高は0以上である必要があります")
    private Integer punishmentBalance = 0;

    @Version
    private Long version;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected Person() {
    }

    public Person(String name, Gender gender, String classLabel, int year) {
        this.name = name;
        this.gender = gender;
        this.classLabel = classLabel;
        this.year = year;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public boolean hasPunishmentDebt() {
        return punishmentBalance != null && punishmentBalance > 0;
    }

    public void consumePunishment() {
        if (!hasPunishmentDebt()) {
            throw new IllegalStateException("懲罰残高がありません: " + id);
        }
        punishmentBalance = punishmentBalance - 1;
    }

    public void restorePunishment() {
        punishmentBalance = punishmentBalance + 1;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Gender getGender() {
        return gender;
    }

    public void setGender(Gender gender) {
        this.gender = gender;
    }

    public String getClassLabel() {
        return classLabel;
    }

    public void setClassLabel(String classLabel) {
        this.classLabel = classLabel;
    }

    public Integer getYear() {
        return year;
    }

    public void setYear(Integer year) {
        this.year = year;
    }

    public Integer getNormalDuties() { return normalDuties; }
    public void setNormalDuties(Integer normalDuties) { this.normalDuties = normalDuties; }
    public Integer getWeekendDuties() { return weekendDuties; }
    public void setWeekendDuties(Integer weekendDuties) { this.weekendDuties = weekendDuties; }
    public Integer getPunishmentBalance() { return punishmentBalance; }
    public void setPunishmentBalance(Integer punishmentBalance) { this.punishmentBalance = punishmentBalance; }

    public Long getVersion() {
        return version;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Person{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", gender=" + gender +
                ", year=" + year +
                ", normalDuties=" + normalDuties +
                ", weekendDuties=" + weekendDuties +
                ", punishmentBalance=" + punishmentBalance +
                '}';
    }
}
