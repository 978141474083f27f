package com.example.dutyroster.swap;

import com.example.dutyroster.exception.BusinessException;
import com.example.dutyroster.exception.ErrorCode;
import com.example.dutyroster.person.Person;
import com.example.dutyroster.person.PersonRepository;
import com.example.dutyroster.person.Role;
import com.example.dutyroster.person.RoleDirectory;
import com.example.dutyroster.roster.Allocation;
import com.example.dutyroster.roster.AllocationRepository;
import com.example.dutyroster.roster.DutyType;
import com.example.dutyroster.roster.FatigueChecker;
import com.example.dutyroster.roster.RosterDay;
import com.example.dutyroster.roster.RosterDayRepository;
import com.example.dutyroster.unavailability.UnavailabilityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 勤務交代のワークフロー。
 * <p>
 * 申請（担当者） → 承諾/辞退（交代者） → 承認/却下（勤務担当者）。
 * 割り当ての担当者と公平性カウンタを書き換えるのは承認時のみで、その直前に休息ルールを再検査する。
 * <p>
 * 承認は勤務表の再生成と同じく日付ヘッダ → 申請行の順にロックする。
 */
@Service
@Transactional
public class SwapService {

    private static final Logger logger = LoggerFactory.getLogger(SwapService.class);

    private final SwapRequestRepository swapRequestRepository;
    private final SwapDebtRepository swapDebtRepository;
    private final AllocationRepository allocationRepository;
    private final RosterDayRepository rosterDayRepository;
    private final PersonRepository personRepository;
    private final UnavailabilityRepository unavailabilityRepository;
    private final FatigueChecker fatigueChecker;
    private final RoleDirectory roleDirectory;
    private final Clock clock;

    public SwapService(SwapRequestRepository swapRequestRepository,
                       SwapDebtRepository swapDebtRepository,
                       AllocationRepository allocationRepository,
                       RosterDayRepository rosterDayRepository,
                       PersonRepository personRepository,
                       UnavailabilityRepository unavailabilityRepository,
                       FatigueChecker fatigueChecker,
                       RoleDirectory roleDirectory,
                       Clock clock) {
        this.swapRequestRepository = swapRequestRepository;
        this.swapDebtRepository = swapDebtRepository;
        this.allocationRepository = allocationRepository;
        this.rosterDayRepository = rosterDayRepository;
        this.personRepository = personRepository;
        this.unavailabilityRepository = unavailabilityRepository;
        this.fatigueChecker = fatigueChecker;
        this.roleDirectory = roleDirectory;
        this.clock = clock;
    }

    /**
     * 交代申請を作成。対象の勤務日が下書きで、交代者が休息ルールを満たす場合のみ受け付ける。
     */
    public SwapView requestSwap(Long requesterId, Long allocationId, Long substituteId,
                                String reason, Long counterAllocationId) {
        if (requesterId == null || allocationId == null || substituteId == null) {
            throw BusinessException.validation("申請者・割り当て・交代者は必須です");
        }
        if (requesterId.equals(substituteId)) {
            throw BusinessException.validation("申請者と交代者は異なる必要があります", requesterId);
        }

        Person requester = findPerson(requesterId);
        Person substitute = findPerson(substituteId);
        Allocation allocation = findAllocation(allocationId);
        if (!allocation.isHeldBy(requesterId)) {
            throw BusinessException.forbidden("申請者はこの勤務の担当者ではありません", allocationId, requesterId);
        }
        requireUpcomingDraft(allocation);
        if (swapRequestRepository.existsByAllocationIdAndStatusIn(allocationId, SwapStatus.OPEN)) {
            throw new BusinessException(ErrorCode.ALREADY_REQUESTED,
                    "この勤務には処理中の交代申請があります: " + allocationId, allocationId);
        }

        Allocation counter = null;
        if (counterAllocationId != null) {
            if (counterAllocationId.equals(allocationId)) {
                throw BusinessException.validation("交換する勤務が同じです", allocationId);
            }
            counter = findAllocation(counterAllocationId);
            if (!counter.isHeldBy(substituteId)) {
                throw BusinessException.validation("交換する勤務は交代者の担当ではありません", counterAllocationId, substituteId);
            }
            requireUpcomingDraft(counter);
        }

        checkSwapConstraints(requester, substitute, allocation, counter);

        SwapRequest request = swapRequestRepository.save(
                new SwapRequest(requester, substitute, allocation, counter, reason, now()));
        logger.info("交代申請を作成しました: ID={}, 勤務={}, 日付={}, 申請者={}, 交代者={}, 交換勤務={}",
                request.getId(), allocationId, allocation.getDate(), requesterId, substituteId, counterAllocationId);
        return SwapView.from(request);
    }

    /**
     * 交代者による承諾・辞退。承諾は勤務担当者への引き継ぎで、辞退はその場で却下となる。
     */
    public SwapView respondToSwap(Long swapId, Long responderId, SwapAction action) {
        if (action == null) {
            throw BusinessException.validation("回答（ACCEPT/DECLINE）は必須です");
        }
        SwapRequest request = lockRequest(swapId);
        if (!request.isAddressedTo(responderId)) {
            throw BusinessException.forbidden("この交代申請の交代者ではありません", swapId, responderId);
        }
        if (request.getStatus() != SwapStatus.PENDING) {
            throw new BusinessException(ErrorCode.ALREADY_RESOLVED,
                    "交代申請は既に回答済みです: " + swapId + " (" + request.getStatus() + ")", swapId);
        }

        if (action == SwapAction.ACCEPT) {
            request.accept();
            logger.info("交代申請が承諾されました: ID={}, 交代者={}", swapId, responderId);
        } else {
            request.reject(now(), null);
            logger.info("交代申請が辞退されました: ID={}, 交代者={}", swapId, responderId);
        }
        return SwapView.from(request);
    }

    /**
     * 交代者が承諾済みの申請を承認する。
     */
    public SwapView approveSwap(Long swapId, Long schedulerId) {
        requireScheduler(schedulerId);
        Map<LocalDate, RosterDay> days = lockDaysOf(swapId);
        SwapRequest request = lockRequest(swapId);
        if (request.getStatus() == SwapStatus.PENDING) {
            throw new BusinessException(ErrorCode.NOT_ACCEPTED,
                    "交代者がまだ承諾していません: " + swapId, swapId);
        }
        requireOpen(request);
        return SwapView.from(finalizeSwap(request, schedulerId, days));
    }

    /**
     * 交代者の回答を待たずに勤務担当者の権限で承認する。
     */
    public SwapView overrideApproveSwap(Long swapId, Long schedulerId) {
        requireScheduler(schedulerId);
        Map<LocalDate, RosterDay> days = lockDaysOf(swapId);
        SwapRequest request = lockRequest(swapId);
        requireOpen(request);
        logger.info("交代申請を強制承認します: ID={}, 状態={}, 処理者={}", swapId, request.getStatus(), schedulerId);
        return SwapView.from(finalizeSwap(request, schedulerId, days));
    }

    public SwapView rejectSwap(Long swapId, Long schedulerId) {
        requireScheduler(schedulerId);
        SwapRequest request = lockRequest(swapId);
        requireOpen(request);
        request.reject(now(), schedulerId);
        logger.info("交代申請を却下しました: ID={}, 処理者={}", swapId, schedulerId);
        return SwapView.from(request);
    }

    @Transactional(readOnly = true)
    public List<SwapView> pendingForSubstitute(Long personId) {
        return swapRequestRepository.findBySubstituteAndStatus(personId, SwapStatus.PENDING).stream()
                .map(SwapView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<SwapView> awaitingScheduler() {
        return swapRequestRepository.findAwaitingScheduler().stream()
                .map(SwapView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<SwapDebtView> openDebts(Long personId) {
        return swapDebtRepository.findOpenByPerson(personId).stream()
                .map(SwapDebtView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public SwapView view(Long swapId) {
        return swapRequestRepository.findById(swapId)
                .map(SwapView::from)
                .orElseThrow(() -> BusinessException.notFound("交代申請が見つかりません: " + swapId, swapId));
    }

    private SwapRequest finalizeSwap(SwapRequest request, Long schedulerId, Map<LocalDate, RosterDay> days) {
        Allocation allocation = request.getAllocation();
        if (allocation == null) {
            throw BusinessException.notFound("交代対象の勤務は既に削除されています: " + request.getId(), request.getId());
        }
        Allocation counter = request.getCounterAllocation();
        if (request.isTwoWay() && counter == null) {
            throw BusinessException.notFound("交換対象の勤務は既に削除されています: " + request.getId(), request.getId());
        }

        RosterDay day = lockedDay(days, allocation.getDate(), request.getId());
        RosterDay counterDay = counter == null ? null : lockedDay(days, counter.getDate(), request.getId());

        Person requester = request.getRequester();
        Person substitute = request.getSubstitute();
        if (!allocation.isHeldBy(requester.getId())
                || (counter != null && !counter.isHeldBy(substitute.getId()))) {
            throw new BusinessException(ErrorCode.CONCURRENT_MODIFICATION,
                    "申請後に勤務の担当者が変更されています: " + request.getId(), request.getId());
        }

        checkSwapConstraints(requester, substitute, allocation, counter);

        transfer(allocation, day.getDutyType(), requester, substitute);
        if (counter != null) {
            transfer(counter, counterDay.getDutyType(), substitute, requester);
        }
        LocalDateTime at = now();
        request.approve(at, schedulerId);
        if (!request.isTwoWay()) {
            recordDebt(request, requester, substitute, at);
        }

        logger.info("交代申請を承認しました: ID={}, 勤務={}, 日付={}, {} -> {}, 処理者={}",
                request.getId(), allocation.getId(), allocation.getDate(),
                requester.getId(), substitute.getId(), schedulerId);
        return request;
    }

    /**
     * 担当者を書き換え、懲罰勤務でなければ公平性カウンタを1つ移す。
     */
    private void transfer(Allocation allocation, DutyType dutyType, Person from, Person to) {
        allocation.setPerson(to);
        if (!allocation.isPunishment()) {
            dutyType.adjustDutyCount(from, -1);
            dutyType.adjustDutyCount(to, 1);
        }
    }

    private void recordDebt(SwapRequest request, Person requester, Person substitute, LocalDateTime at) {
        Optional<SwapDebt> repaid = swapDebtRepository.findFirstByDebtorIdAndCreditorIdAndStatusOrderByCreatedAtAscIdAsc(
                substitute.getId(), requester.getId(), DebtStatus.PENDING);
        if (repaid.isPresent()) {
            repaid.get().settle(request, at);
            logger.info("交代の貸し借りを返済済みにしました: 債務={}, 債務者={}, 債権者={}",
                    repaid.get().getId(), substitute.getId(), requester.getId());
            return;
        }
        SwapDebt debt = swapDebtRepository.save(new SwapDebt(requester, substitute, request, at));
        logger.info("交代の貸し借りを記録しました: 債務={}, 債務者={}, 債権者={}",
                debt.getId(), requester.getId(), substitute.getId());
    }

    /**
     * 勤務不可期間と休息ルール。交換する割り当て同士は互いの判定から除外する。
     */
    private void checkSwapConstraints(Person requester, Person substitute, Allocation allocation, Allocation counter) {
        List<Long> excluded = new ArrayList<>(2);
        excluded.add(allocation.getId());
        if (counter != null) {
            excluded.add(counter.getId());
        }

        requireAvailable(substitute, allocation.getDate());
        fatigueChecker.requireRested(substitute.getId(), allocation.getDate(), excluded);
        if (counter != null) {
            requireAvailable(requester, counter.getDate());
            fatigueChecker.requireRested(requester.getId(), counter.getDate(), excluded);
        }
    }

    private void requireAvailable(Person person, LocalDate date) {
        if (!unavailabilityRepository.findOverlapping(person.getId(), date, date).isEmpty()) {
            throw new BusinessException(ErrorCode.UNAVAILABLE,
                    "対象者 " + person.getId() + " は " + date + " に勤務できません", person.getId(), date);
        }
    }

    private void requireUpcomingDraft(Allocation allocation) {
        LocalDate date = allocation.getDate();
        if (date.isBefore(LocalDate.now(clock))) {
            throw BusinessException.validation("過去の勤務は交代できません: " + date, allocation.getId(), date);
        }
        RosterDay day = rosterDayRepository.findById(date)
                .orElseThrow(() -> BusinessException.notFound("勤務表が見つかりません: " + date, date));
        if (day.isPublished()) {
            throw new BusinessException(ErrorCode.ALREADY_PUBLISHED,
                    "公開済みの勤務表は直接交代申請できません: " + date, date);
        }
    }

    private void requireOpen(SwapRequest request) {
        if (!request.getStatus().isOpen()) {
            throw new BusinessException(ErrorCode.ALREADY_RESOLVED,
                    "交代申請は既に処理済みです: " + request.getId() + " (" + request.getStatus() + ")", request.getId());
        }
    }

    private void requireScheduler(Long schedulerId) {
        if (!roleDirectory.hasRole(schedulerId, Role.SCHEDULER)) {
            throw BusinessException.forbidden("勤務担当者の権限がありません: " + schedulerId, schedulerId);
        }
    }

    private SwapRequest lockRequest(Long swapId) {
        return swapRequestRepository.findByIdForUpdate(swapId)
                .orElseThrow(() -> BusinessException.notFound("交代申請が見つかりません: " + swapId, swapId));
    }

    /**
     * 申請が参照する勤務日のヘッダを日付の昇順でロックする。申請行のロックより先に呼ぶこと。
     */
    private Map<LocalDate, RosterDay> lockDaysOf(Long swapId) {
        Map<LocalDate, RosterDay> days = new TreeMap<>();
        for (LocalDate date : new TreeSet<>(swapRequestRepository.findAllocationDates(swapId))) {
            days.put(date, lockDay(date));
        }
        return days;
    }

    private RosterDay lockedDay(Map<LocalDate, RosterDay> days, LocalDate date, Long swapId) {
        RosterDay day = days.get(date);
        if (day == null) {
            throw new BusinessException(ErrorCode.CONCURRENT_MODIFICATION,
                    "申請後に交代対象の勤務が変更されています: " + swapId, swapId);
        }
        return day;
    }

    private RosterDay lockDay(LocalDate date) {
        return rosterDayRepository.findByDateForUpdate(date)
                .orElseThrow(() -> BusinessException.notFound("勤務表が見つかりません: " + date, date));
    }

    private Person findPerson(Long personId) {
        return personRepository.findById(personId)
                .orElseThrow(() -> BusinessException.notFound("対象者が見つかりません: " + personId, personId));
    }

    private Allocation findAllocation(Long allocationId) {
        return allocationRepository.findById(allocationId)
                .orElseThrow(() -> BusinessException.notFound("割り当てが見つかりません: " + allocationId, allocationId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
