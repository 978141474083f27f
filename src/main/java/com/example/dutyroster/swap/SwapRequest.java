package com.example.dutyroster.swap;

import com.example.dutyroster.person.Person;
import com.example.dutyroster.roster.Allocation;
import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * 勤務交代申請。申請 → 交代者の承諾 → 勤務担当者の承認 の順に進む。
 */
@Entity
@Table(name = "swap_requests")
public class SwapRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "requester_id", nullable = false)
    private Person requester;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "substitute_id", nullable = false)
    private Person substitute;

    // cleared when the day is regenerated
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "allocation_id")
    private Allocation allocation;

    // two-way swap: the substitute's duty taken over by the requester
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "counter_allocation_id")
    private Allocation counterAllocation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SwapStatus status = SwapStatus.PENDING;

    @Column(length = 500)
    private String reason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "responded_at")
    private LocalDateTime respondedAt;

    @Column(name = "processed_by")
    private Long processedBy;

    protected SwapRequest() {
    }

    public SwapRequest(Person requester, Person substitute, Allocation allocation,
                       Allocation counterAllocation, String reason, LocalDateTime createdAt) {
        this.requester = requester;
        this.substitute = substitute;
        this.allocation = allocation;
        this.counterAllocation = counterAllocation;
        this.reason = reason;
        this.createdAt = createdAt;
    }

    public boolean isTwoWay() {
        return counterAllocation != null;
    }

    public boolean isAddressedTo(Long personId) {
        return substitute != null && substitute.getId().equals(personId);
    }

    public void accept() {
        this.status = SwapStatus.AWAITING_SCHEDULER;
    }

    public void reject(LocalDateTime at, Long processedBy) {
        this.status = SwapStatus.REJECTED;
        this.respondedAt = at;
        this.processedBy = processedBy;
    }

    public void approve(LocalDateTime at, Long processedBy) {
        this.status = SwapStatus.APPROVED;
        this.respondedAt = at;
        this.processedBy = processedBy;
    }

    /**
     * 再生成で割り当てが削除される前に参照を外す。未完了の申請は却下扱いにする。
     */
    public void detachFrom(Collection<Long> removedAllocationIds, LocalDateTime at) {
        if (allocation != null && removedAllocationIds.contains(allocation.getId())) {
            allocation = null;
        }
        if (counterAllocation != null && removedAllocationIds.contains(counterAllocation.getId())) {
            counterAllocation = null;
        }
        if (status.isOpen()) {
            reject(at, null);
        }
    }

    public Long getId() {
        return id;
    }

    public Person getRequester() {
        return requester;
    }

    public Person getSubstitute() {
        return substitute;
    }

    public Allocation getAllocation() {
        return allocation;
    }

    public Allocation getCounterAllocation() {
        return counterAllocation;
    }

    public SwapStatus getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getRespondedAt() {
        return respondedAt;
    }

    public Long getProcessedBy() {
        return processedBy;
    }

    @Override
    public String toString() {
        return "SwapRequest{" +
                "id=" + id +
                ", requester=" + (requester != null ? requester.getId() : null) +
                ", substitute=" + (substitute != null ? substitute.getId() : null) +
                ", allocation=" + (allocation != null ? allocation.getId() : null) +
                ", status=" + status +
                ", createdAt=" + createdAt +
                '}';
    }
}
