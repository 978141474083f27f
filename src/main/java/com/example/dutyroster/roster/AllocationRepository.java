package com.example.dutyroster.roster;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface AllocationRepository extends JpaRepository<Allocation, Long> {

    /**
     * 指定日付の割り当てを取得
     */
    List<Allocation> findByDate(LocalDate date);

    /**
     * 指定日以降の割り当てをポスト・対象者込みで取得（表示用）
     */
    @Query("SELECT a FROM Allocation a JOIN FETCH a.person JOIN FETCH a.post " +
           "WHERE a.date >= :from ORDER BY a.date ASC, a.post.priority DESC, a.post.name ASC")
    List<Allocation> findForDisplayFrom(@Param("from") LocalDate from);

    /**
     * 対象者の指定日以降の勤務を取得
     */
    @Query("SELECT a FROM Allocation a JOIN FETCH a.post " +
           "WHERE a.person.id = :personId AND a.date >= :from ORDER BY a.date ASC")
    List<Allocation> findUpcomingByPerson(@Param("personId") Long personId, @Param("from") LocalDate from);

    /**
     * 期間内に対象者の勤務があるか
     */
    boolean existsByPersonIdAndDateBetween(Long personId, LocalDate startDate, LocalDate endDate);

    /**
     * 期間内に対象者の勤務があるか（指定した割り当ては除外）
     */
    @Query("SELECT COUNT(a) FROM Allocation a WHERE a.person.id = :personId " +
           "AND a.date BETWEEN :startDate AND :endDate AND a.id NOT IN :excludedIds")
    long countByPersonIdAndDateBetweenExcluding(@Param("personId") Long personId,
                                                    @Param("startDate") LocalDate startDate,
                                                    @Param("endDate") LocalDate endDate,
                                                    @Param("excludedIds") Collection<Long> excludedIds);
}
