package com.example.dutyroster.roster;

import com.example.dutyroster.exception.BusinessException;
import com.example.dutyroster.exception.ErrorCode;
import com.example.dutyroster.exception.RosterGenerationException;
import com.example.dutyroster.person.Gender;
import com.example.dutyroster.person.Person;
import com.example.dutyroster.post.GenderRestriction;
import com.example.dutyroster.post.Post;
import com.example.dutyroster.support.RosterFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * トランザクションの取り消しを検証するため、テスト自体はトランザクションで囲まない。
 */
@SpringBootTest
class RosterDayServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2031, 3, 3);
    private static final LocalDate TUESDAY = LocalDate.of(2031, 3, 4);

    @Autowired
    private RosterDayService rosterDayService;

    @Autowired
    private PublicationService publicationService;

    @Autowired
    private AllocationRepository allocationRepository;

    @Autowired
    private RosterDayRepository rosterDayRepository;

    @Autowired
    private RosterFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures.reset();
    }

    @Test
    void generateDay_punishmentDebtTakesPriorityAndLeavesCounterUntouched() {
        fixtures.post("正門", GenderRestriction.MIXED, "1,2", 1);
        Person a = fixtures.person("A", Gender.M, 1, 3, 0, 0);
        Person b = fixtures.person("B", Gender.F, 2, 5, 0, 1);

        DayGenerationResult result = rosterDayService.generateDay(TUESDAY, DutyType.RN);

        assertThat(result.allocations()).hasSize(1);
        AllocationView allocation = result.allocations().get(0);
        assertThat(allocation.personId()).isEqualTo(b.getId());
        assertThat(allocation.punishment()).isTrue();
        assertThat(result.punishmentAllocations()).isEqualTo(1);

        Person reloadedB = fixtures.reload(b);
        assertThat(reloadedB.getPunishmentBalance()).isZero();
        assertThat(reloadedB.getNormalDuties()).isEqualTo(5);
        assertThat(fixtures.reload(a).getNormalDuties()).isEqualTo(3);
        assertThat(allocationRepository.findByDate(TUESDAY)).singleElement()
                .satisfies(saved -> assertThat(saved.isPunishment()).isTrue());
    }

    @Test
    void generateDay_picksFewestDutiesAndIncrementsThatCounter() {
        fixtures.post("正門", GenderRestriction.MIXED, "1,2", 1);
        Person busy = fixtures.person("多忙", Gender.M, 1, 3, 0, 0);
        Person idle = fixtures.person("余裕", Gender.F, 1, 1, 4, 0);

        DayGenerationResult result = rosterDayService.generateDay(TUESDAY, DutyType.RN);

        assertThat(result.allocations()).extracting(AllocationView::personId).containsExactly(idle.getId());
        assertThat(result.allocations().get(0).punishment()).isFalse();
        assertThat(fixtures.reload(idle).getNormalDuties()).isEqualTo(2);
        assertThat(fixtures.reload(idle).getWeekendDuties()).isEqualTo(4);
        assertThat(fixtures.reload(busy).getNormalDuties()).isEqualTo(3);
    }

    @Test
    void generateDay_weekendTypeUsesWeekendCounter() {
        fixtures.post("正門", GenderRestriction.MIXED, "1", 1);
        Person fewWeekends = fixtures.person("週末少", Gender.M, 1, 9, 0, 0);
        fixtures.person("週末多", Gender.M, 1, 0, 3, 0);

        DayGenerationResult result = rosterDayService.generateDay(TUESDAY, DutyType.RD);

        assertThat(result.dutyType()).isEqualTo(DutyType.RD);
        assertThat(result.allocations()).extracting(AllocationView::personId).containsExactly(fewWeekends.getId());
        Person reloaded = fixtures.reload(fewWeekends);
        assertThat(reloaded.getWeekendDuties()).isEqualTo(1);
        assertThat(reloaded.getNormalDuties()).isEqualTo(9);
        assertThat(rosterDayRepository.findById(TUESDAY)).get()
                .extracting(RosterDay::getDutyType).isEqualTo(DutyType.RD);
    }

    @Test
    void generateDay_requiresExactSeniorityYear() {
        fixtures.post("正門", GenderRestriction.MIXED, "1,3", 1);
        fixtures.person("二年", Gender.M, 2, 0, 0, 0);
        Person third = fixtures.person("三年", Gender.M, 3, 9, 0, 0);

        DayGenerationResult result = rosterDayService.generateDay(TUESDAY, DutyType.RN);

        assertThat(result.allocations()).extracting(AllocationView::personId).containsExactly(third.getId());
    }

    @Test
    void generateDay_respectsGenderRestriction() {
        fixtures.post("女子寮", GenderRestriction.F, "1", 1);
        fixtures.person("男子", Gender.M, 1, 0, 0, 0);
        Person female = fixtures.person("女子", Gender.F, 1, 5, 0, 0);

        DayGenerationResult result = rosterDayService.generateDay(TUESDAY, DutyType.RN);

        assertThat(result.allocations()).extracting(AllocationView::personId).containsExactly(female.getId());
    }

    @Test
    void generateDay_fillsPostsByPriorityAndSeesEarlierWritesOfSameDay() {
        fixtures.post("正門", GenderRestriction.MIXED, "1,2,3", 1);
        fixtures.post("当直長", GenderRestriction.MIXED, "3", 3);
        Person senior = fixtures.person("三年", Gender.M, 3, 0, 0, 0);
        Person junior = fixtures.person("一年", Gender.M, 1, 5, 0, 0);

        DayGenerationResult result = rosterDayService.generateDay(TUESDAY, DutyType.RN);

        assertThat(result.allocations()).extracting(AllocationView::postName).containsExactly("当直長", "正門");
        assertThat(result.allocations()).extracting(AllocationView::personId)
                .containsExactly(senior.getId(), junior.getId());
        assertThat(allocationRepository.findByDate(TUESDAY)).hasSize(2);
    }

    @Test
    void generateDay_skipsFatiguedAndUnavailableCandidates() {
        Post gate = fixtures.post("正門", GenderRestriction.MIXED, "1", 1);
        Person first = fixtures.person("先頭", Gender.M, 1, 0, 0, 0);
        Person onLeave = fixtures.person("休暇中", Gender.M, 1, 0, 0, 0);
        Person fallback = fixtures.person("控え", Gender.M, 1, 3, 0, 0);
        fixtures.allocate(first, gate, MONDAY, DutyType.RN);
        fixtures.unavailable(onLeave, TUESDAY, TUESDAY.plusDays(2));

        DayGenerationResult result = rosterDayService.generateDay(TUESDAY, DutyType.RN);

        assertThat(result.allocations()).extracting(AllocationView::personId).containsExactly(fallback.getId());
    }

    @Test
    void generateDay_failsWhenNobodyQualifiesAndRollsBackEverything() {
        fixtures.post("正門", GenderRestriction.MIXED, "1", 2);
        fixtures.post("当直長", GenderRestriction.MIXED, "3", 1);
        Person junior = fixtures.person("一年", Gender.M, 1, 0, 0, 1);

        RosterGenerationException ex = catchThrowableOfType(
                () -> rosterDayService.generateDay(TUESDAY, DutyType.RN), RosterGenerationException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.STAFFING);
        assertThat(ex.getDate()).isEqualTo(TUESDAY);
        assertThat(ex.getPostName()).isEqualTo("当直長");
        assertThat(ex.getRequiredYears()).isEqualTo("3");
        assertThat(allocationRepository.count()).isZero();
        assertThat(rosterDayRepository.existsById(TUESDAY)).isFalse();
        assertThat(fixtures.reload(junior).getPunishmentBalance()).isEqualTo(1);
    }

    @Test
    void generateDay_failedRegenerationKeepsPreviousDraft() {
        fixtures.post("正門", GenderRestriction.MIXED, "1", 1);
        Person junior = fixtures.person("一年", Gender.M, 1, 0, 0, 0);
        rosterDayService.generateDay(TUESDAY, DutyType.RN);
        List<Long> before = allocationRepository.findByDate(TUESDAY).stream().map(Allocation::getId).toList();

        fixtures.post("当直長", GenderRestriction.MIXED, "3", 2);
        RosterGenerationException ex = catchThrowableOfType(
                () -> rosterDayService.generateDay(TUESDAY, DutyType.RN), RosterGenerationException.class);

        assertThat(ex).isNotNull();
        assertThat(allocationRepository.findByDate(TUESDAY)).extracting(Allocation::getId)
                .containsExactlyElementsOf(before);
        assertThat(fixtures.reload(junior).getNormalDuties()).isEqualTo(1);
    }

    @Test
    void generateDay_regeneratingDraftLeavesCountersAsAfterSingleGeneration() {
        fixtures.post("正門", GenderRestriction.MIXED, "1,2", 2);
        fixtures.post("裏門", GenderRestriction.MIXED, "1,2", 1);
        Person a = fixtures.person("A", Gender.M, 1, 0, 0, 1);
        Person b = fixtures.person("B", Gender.M, 2, 2, 0, 0);
        Person c = fixtures.person("C", Gender.F, 2, 1, 0, 0);

        rosterDayService.generateDay(TUESDAY, DutyType.RN);
        List<Person> once = List.of(fixtures.reload(a), fixtures.reload(b), fixtures.reload(c));

        rosterDayService.generateDay(TUESDAY, DutyType.RN);
        DayGenerationResult third = rosterDayService.generateDay(TUESDAY, DutyType.RN);

        List<Person> after = List.of(fixtures.reload(a), fixtures.reload(b), fixtures.reload(c));
        for (int i = 0; i < once.size(); i++) {
            assertThat(after.get(i).getNormalDuties()).isEqualTo(once.get(i).getNormalDuties());
            assertThat(after.get(i).getWeekendDuties()).isEqualTo(once.get(i).getWeekendDuties());
            assertThat(after.get(i).getPunishmentBalance()).isEqualTo(once.get(i).getPunishmentBalance());
        }
        assertThat(third.allocations()).hasSize(2);
        assertThat(allocationRepository.findByDate(TUESDAY)).hasSize(2);
    }

    @Test
    void generateDay_regeneratingWithOtherTypeMovesCounter() {
        fixtures.post("正門", GenderRestriction.MIXED, "1", 1);
        Person only = fixtures.person("一年", Gender.M, 1, 0, 0, 0);

        rosterDayService.generateDay(TUESDAY, DutyType.RN);
        rosterDayService.generateDay(TUESDAY, DutyType.RD);

        Person reloaded = fixtures.reload(only);
        assertThat(reloaded.getNormalDuties()).isZero();
        assertThat(reloaded.getWeekendDuties()).isEqualTo(1);
    }

    @Test
    void generateDay_publishedDayCannotBeRegenerated() {
        fixtures.post("正門", GenderRestriction.MIXED, "1", 1);
        Person only = fixtures.person("一年", Gender.M, 1, 0, 0, 0);
        fixtures.person("二人目", Gender.M, 1, 4, 0, 0);
        rosterDayService.generateDay(TUESDAY, DutyType.RN);
        publicationService.publish(TUESDAY, TUESDAY);
        List<Long> before = allocationRepository.findByDate(TUESDAY).stream().map(Allocation::getId).toList();

        BusinessException ex = catchThrowableOfType(
                () -> rosterDayService.generateDay(TUESDAY, DutyType.RD), BusinessException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.ALREADY_PUBLISHED);
        assertThat(allocationRepository.findByDate(TUESDAY)).extracting(Allocation::getId)
                .containsExactlyElementsOf(before);
        RosterDay day = rosterDayRepository.findById(TUESDAY).orElseThrow();
        assertThat(day.getStatus()).isEqualTo(DayStatus.PUBLISHED);
        assertThat(day.getDutyType()).isEqualTo(DutyType.RN);
        assertThat(fixtures.reload(only).getNormalDuties()).isEqualTo(1);
        assertThat(fixtures.reload(only).getWeekendDuties()).isZero();
    }

    @Test
    void generateDay_reopenedDayCanBeRegenerated() {
        fixtures.post("正門", GenderRestriction.MIXED, "1", 1);
        fixtures.person("一年", Gender.M, 1, 0, 0, 0);
        rosterDayService.generateDay(TUESDAY, DutyType.RN);
        publicationService.publish(TUESDAY, TUESDAY);
        publicationService.reopen(TUESDAY);

        DayGenerationResult result = rosterDayService.generateDay(TUESDAY, DutyType.RN);

        assertThat(result.status()).isEqualTo(DayStatus.DRAFT);
        assertThat(result.allocations()).hasSize(1);
    }
}
