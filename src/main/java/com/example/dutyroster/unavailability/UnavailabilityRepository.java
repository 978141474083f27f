package com.example.dutyroster.unavailability;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface UnavailabilityRepository extends JpaRepository<Unavailability, Long> {

    /**
     * 指定期間と重なる対象者の勤務不可期間を取得
     */
    @Query("SELECT u FROM Unavailability u WHERE u.person.id = :personId " +
           "AND u.startDate <= :endDate AND u.endDate >= :startDate ORDER BY u.startDate ASC")
    List<Unavailability> findOverlapping(@Param("personId") Long personId,
                                         @Param("startDate") LocalDate startDate,
                                         @Param("endDate") LocalDate endDate);
}
