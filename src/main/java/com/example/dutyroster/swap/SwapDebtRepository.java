package com.example.dutyroster.swap;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SwapDebtRepository extends JpaRepository<SwapDebt, Long> {

    /**
     * 債務者・債権者の組で最も古い未返済の貸し借りを取得
     */
    Optional<SwapDebt> findFirstByDebtorIdAndCreditorIdAndStatusOrderByCreatedAtAscIdAsc(
            Long debtorId, Long creditorId, DebtStatus status);

    /**
     * 対象者が債務者または債権者となっている未返済の貸し借りを取得
     */
    @Query("SELECT d FROM SwapDebt d JOIN FETCH d.debtor JOIN FETCH d.creditor " +
           "WHERE (d.debtor.id = :personId OR d.creditor.id = :personId) " +
           "AND d.status = com.example.dutyroster.swap.DebtStatus.PENDING ORDER BY d.createdAt ASC")
    List<SwapDebt> findOpenByPerson(@Param("personId") Long personId);
}
