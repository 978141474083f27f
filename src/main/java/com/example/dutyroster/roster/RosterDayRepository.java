package com.example.dutyroster.roster;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface RosterDayRepository extends JpaRepository<RosterDay, LocalDate> {

    /**
     * 日付ヘッダを行ロック付きで取得
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM RosterDay d WHERE d.date = :date")
    Optional<RosterDay> findByDateForUpdate(@Param("date") LocalDate date);

    /**
     * 指定期間の下書きを一括で公開
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RosterDay d SET d.status = com.example.dutyroster.roster.DayStatus.PUBLISHED " +
           "WHERE d.date BETWEEN :startDate AND :endDate " +
           "AND d.status = com.example.dutyroster.roster.DayStatus.DRAFT")
    int publishDrafts(@Param("startDate") LocalDate startDate, @Param("endDate") LocalDate endDate);

    /**
     * 指定日以降の日付ヘッダを取得
     */
    List<RosterDay> findByDateGreaterThanEqualOrderByDateAsc(LocalDate from);

    List<RosterDay> findByDateBetweenOrderByDateAsc(LocalDate startDate, LocalDate endDate);
}
