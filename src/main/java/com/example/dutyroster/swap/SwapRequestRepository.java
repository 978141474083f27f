package com.example.dutyroster.swap;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SwapRequestRepository extends JpaRepository<SwapRequest, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SwapRequest s WHERE s.id = :id")
    Optional<SwapRequest> findByIdForUpdate(@Param("id") Long id);

    /**
     * 申請が参照している割り当て（交換勤務を含む）の勤務日。申請行はロックしない。
     */
    @Query("SELECT a.date FROM Allocation a " +
           "WHERE a.id IN (SELECT s.allocation.id FROM SwapRequest s WHERE s.id = :id) " +
           "OR a.id IN (SELECT s.counterAllocation.id FROM SwapRequest s WHERE s.id = :id)")
    List<LocalDate> findAllocationDates(@Param("id") Long id);

    /**
     * 指定した割り当てに未完了の申請があるか
     */
    boolean existsByAllocationIdAndStatusIn(Long allocationId, Collection<SwapStatus> statuses);

    /**
     * 交代者宛ての申請一覧を取得
     */
    @Query("SELECT s FROM SwapRequest s JOIN FETCH s.requester LEFT JOIN FETCH s.allocation a LEFT JOIN FETCH a.post " +
           "WHERE s.substitute.id = :substituteId AND s.status = :status ORDER BY s.createdAt DESC")
    List<SwapRequest> findBySubstituteAndStatus(@Param("substituteId") Long substituteId,
                                               @Param("status") SwapStatus status);

    /**
     * 勤務担当者の承認待ち一覧を勤務日順に取得
     */
    @Query("SELECT s FROM SwapRequest s JOIN FETCH s.requester JOIN FETCH s.substitute " +
           "JOIN FETCH s.allocation a JOIN FETCH a.post " +
           "WHERE s.status = com.example.dutyroster.swap.SwapStatus.AWAITING_SCHEDULER ORDER BY a.date ASC")
    List<SwapRequest> findAwaitingScheduler();

    /**
     * 指定した割り当てを参照している申請を取得（再生成時の切り離し用）
     */
    @Query("SELECT s FROM SwapRequest s WHERE s.allocation.id IN :allocationIds " +
           "OR s.counterAllocation.id IN :allocationIds")
    List<SwapRequest> findReferencingAllocations(@Param("allocationIds") Collection<Long> allocationIds);
}
