package com.example.dutyroster.swap;

import com.example.dutyroster.person.Person;
import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * 片方向の交代で生じる貸し借り。債務者が債権者の勤務を代わると返済済みになる。
 */
@Entity
@Table(name = "swap_debts")
public class SwapDebt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "debtor_id", nullable = false)
    private Person debtor;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "creditor_id", nullable = false)
    private Person creditor;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "origin_swap_id", nullable = false)
    private SwapRequest originSwap;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "settled_by_swap_id")
    private SwapRequest settledBySwap;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DebtStatus status = DebtStatus.PENDING;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    protected SwapDebt() {
    }

    public SwapDebt(Person debtor, Person creditor, SwapRequest originSwap, LocalDateTime createdAt) {
        this.debtor = debtor;
        this.creditor = creditor;
        this.originSwap = originSwap;
        this.createdAt = createdAt;
    }

    public void settle(SwapRequest settledBy, LocalDateTime at) {
        this.status = DebtStatus.PAID;
        this.settledBySwap = settledBy;
        this.paidAt = at;
    }

    public Long getId() {
        return id;
    }

    public Person getDebtor() {
        return debtor;
    }

    public Person getCreditor() {
        return creditor;
    }

    public SwapRequest getOriginSwap() {
        return originSwap;
    }

    public SwapRequest getSettledBySwap() {
        return settledBySwap;
    }

    public DebtStatus getStatus() {
        return status;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getPaidAt() {
        return paidAt;
    }
}
