package com.example.dutyroster.unavailability;

import com.example.dutyroster.person.Person;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * 勤務不可期間（診断書・休暇など）。開始日・終了日とも含む。
 */
@Entity
@Table(name = "unavailabilities")
public class Unavailability {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "person_id", nullable = false)
    @NotNull(message = "対象者は必須です")
    private Person person;

    @Column(name = "start_date", nullable = false)
    @NotNull(message = "開始日は必須です")
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    @NotNull(message = "終了日は必須です")
    private LocalDate endDate;

    @Column(length = 200)
    private String reason;

    protected Unavailability() {
    }

    public Unavailability(Person person, LocalDate startDate, LocalDate endDate, String reason) {
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("終了日は開始日以降である必要があります");
        }
        this.person = person;
        this.startDate = startDate;
        this.endDate = endDate;
        this.reason = reason;
    }

    public Long getId() {
        return id;
    }

    public Person getPerson() {
        return person;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public String getReason() {
        return reason;
    }
}
