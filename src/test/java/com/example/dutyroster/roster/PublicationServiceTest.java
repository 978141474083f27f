package com.example.dutyroster.roster;

import com.example.dutyroster.exception.BusinessException;
import com.example.dutyroster.exception.ErrorCode;
import com.example.dutyroster.person.Gender;
import com.example.dutyroster.post.GenderRestriction;
import com.example.dutyroster.support.RosterFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@SpringBootTest
class PublicationServiceTest {

    private static final LocalDate START = LocalDate.of(2031, 3, 3);

    @Autowired
    private PublicationService publicationService;

    @Autowired
    private RosterPeriodService rosterPeriodService;

    @Autowired
    private RosterDayRepository rosterDayRepository;

    @Autowired
    private RosterFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures.reset();
        fixtures.post("正門", GenderRestriction.MIXED, "1", 1);
        fixtures.person("A", Gender.M, 1);
        fixtures.person("B", Gender.F, 1);
    }

    @Test
    void publish_movesOnlyDraftDaysInRange() {
        rosterPeriodService.generatePeriod(START, START.plusDays(4));

        int published = publicationService.publish(START.plusDays(1), START.plusDays(3));

        assertThat(published).isEqualTo(3);
        assertThat(rosterDayRepository.findById(START).orElseThrow().isDraft()).isTrue();
        assertThat(rosterDayRepository.findById(START.plusDays(2)).orElseThrow().isPublished()).isTrue();
        assertThat(rosterDayRepository.findById(START.plusDays(4)).orElseThrow().isDraft()).isTrue();
    }

    @Test
    void publish_countsOnlyDaysThatWereDraft() {
        rosterPeriodService.generatePeriod(START, START.plusDays(2));
        publicationService.publish(START, START);

        assertThat(publicationService.publish(START, START.plusDays(2))).isEqualTo(2);
    }

    @Test
    void publish_withoutDraftsReportsNothingToPublish() {
        rosterPeriodService.generatePeriod(START, START.plusDays(1));
        publicationService.publish(START, START.plusDays(1));

        BusinessException ex = catchThrowableOfType(
                () -> publicationService.publish(START, START.plusDays(1)), BusinessException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.NOTHING_TO_PUBLISH);
        assertThat(rosterDayRepository.findAll()).allMatch(RosterDay::isPublished);
    }

    @Test
    void publish_emptyRangeReportsNothingToPublish() {
        BusinessException ex = catchThrowableOfType(
                () -> publicationService.publish(START, START.plusDays(6)), BusinessException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.NOTHING_TO_PUBLISH);
    }

    @Test
    void reopen_returnsPublishedDayToDraft() {
        rosterPeriodService.generatePeriod(START, START);
        publicationService.publish(START, START);

        RosterDay reopened = publicationService.reopen(START);

        assertThat(reopened.getStatus()).isEqualTo(DayStatus.DRAFT);
        assertThat(rosterDayRepository.findById(START).orElseThrow().isDraft()).isTrue();
    }

    @Test
    void reopen_draftDayFails() {
        rosterPeriodService.generatePeriod(START, START);

        BusinessException ex = catchThrowableOfType(() -> publicationService.reopen(START), BusinessException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.NOT_PUBLISHED);
    }

    @Test
    void reopen_unknownDayFails() {
        BusinessException ex = catchThrowableOfType(() -> publicationService.reopen(START), BusinessException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
    }
}
