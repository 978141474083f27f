package com.example.dutyroster.roster;

import com.example.dutyroster.person.Person;
import com.example.dutyroster.post.Post;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 並び済みプールを先頭から走査し、学年条件と休息ルールを満たす最初の一人を選ぶ。
 */
@Component
public class CandidateSelector {

    private static final Logger logger = LoggerFactory.getLogger(CandidateSelector.class);

    private final EligibilityStore eligibilityStore;
    private final FatigueChecker fatigueChecker;

    public CandidateSelector(EligibilityStore eligibilityStore, FatigueChecker fatigueChecker) {
        this.eligibilityStore = eligibilityStore;
        this.fatigueChecker = fatigueChecker;
    }

    public Optional<Person> select(Post post, LocalDate date, DutyType dutyType) {
        for (Person candidate : eligibilityStore.rankedCandidates(post, date, dutyType)) {
            if (!post.acceptsYear(candidate.getYear())) {
                continue;
            }
            if (fatigueChecker.isFatigued(candidate.getId(), date)) {
                logger.debug("skip {} for post '{}' on {}: rest rule", candidate.getId(), post.getName(), date);
                continue;
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }
}
