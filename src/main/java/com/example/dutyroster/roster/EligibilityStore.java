package com.example.dutyroster.roster;

import com.example.dutyroster.person.Person;
import com.example.dutyroster.person.PersonRepository;
import com.example.dutyroster.post.Post;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * ポスト・日付ごとの候補者プール。
 * 性別条件を満たし勤務不可期間にかからない全員を、懲罰残高の多い順、
 * 勤務種別カウンタの少ない順、ID順で返す。
 */
@Component
public class EligibilityStore {

    private final PersonRepository personRepository;

    public EligibilityStore(PersonRepository personRepository) {
        this.personRepository = personRepository;
    }

    public List<Person> rankedCandidates(Post post, LocalDate date, DutyType dutyType) {
        List<Person> pool = personRepository.findAvailableByGenderIn(
                post.getGenderRestriction().admittedGenders(), date);
        pool.sort(ranking(dutyType));
        return pool;
    }

    static Comparator<Person> ranking(DutyType dutyType) {
        return Comparator
                .comparing(Person::getPunishmentBalance, Comparator.reverseOrder())
                .thenComparingInt(dutyType::dutyCount)
                .thenComparing(Person::getId);
    }
}
