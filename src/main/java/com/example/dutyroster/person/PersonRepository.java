package com.example.dutyroster.person;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface PersonRepository extends JpaRepository<Person, Long> {

    /**
     * 指定日に勤務不可期間がなく、性別条件を満たす対象者を取得（並び順は呼び出し側で決定）
     */
    @Query("SELECT p FROM Person p WHERE p.gender IN :genders " +
           "AND NOT EXISTS (SELECT 1 FROM Unavailability u WHERE u.person = p " +
           "AND u.startDate <= :date AND u.endDate >= :date)")
    List<Person> findAvailableByGenderIn(@Param("genders") Collection<Gender> genders,
                                         @Param("date") LocalDate date);

    /**
     * 懲罰残高が残っている対象者を残高の多い順に取得
     */
    List<Person> findByPunishmentBalanceGreaterThanOrderByPunishmentBalanceDescNameAsc(int balance);
}
