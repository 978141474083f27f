package com.example.dutyroster.roster;

import com.example.dutyroster.exception.BusinessException;
import com.example.dutyroster.exception.ErrorCode;
import com.example.dutyroster.exception.RosterGenerationException;
import com.example.dutyroster.person.Person;
import com.example.dutyroster.post.Post;
import com.example.dutyroster.post.PostCatalog;
import com.example.dutyroster.post.PostRepository;
import com.example.dutyroster.swap.SwapRequest;
import com.example.dutyroster.swap.SwapRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 1日分の勤務表を生成する。
 * <p>
 * 1回の呼び出しが1トランザクションで、途中のポストで候補者が尽きた場合は
 * 既存割り当ての削除やカウンタの巻き戻しも含めて全て取り消される。
 */
@Service
public class RosterDayService {

    private static final Logger logger = LoggerFactory.getLogger(RosterDayService.class);

    private final RosterDayRepository rosterDayRepository;
    private final AllocationRepository allocationRepository;
    private final PostRepository postRepository;
    private final PostCatalog postCatalog;
    private final CandidateSelector candidateSelector;
    private final SwapRequestRepository swapRequestRepository;
    private final Clock clock;

    public RosterDayService(RosterDayRepository rosterDayRepository,
                            AllocationRepository allocationRepository,
                            PostRepository postRepository,
                            PostCatalog postCatalog,
                            CandidateSelector candidateSelector,
                            SwapRequestRepository swapRequestRepository,
                            Clock clock) {
        this.rosterDayRepository = rosterDayRepository;
        this.allocationRepository = allocationRepository;
        this.postRepository = postRepository;
        this.postCatalog = postCatalog;
        this.candidateSelector = candidateSelector;
        this.swapRequestRepository = swapRequestRepository;
        this.clock = clock;
    }

    @Transactional
    public DayGenerationResult generateDay(LocalDate date, DutyType dutyType) {
        if (date == null || dutyType == null) {
            throw BusinessException.validation("日付と勤務種別は必須です");
        }
        logger.info("勤務表を生成します: 日付={}, 種別={}", date, dutyType);

        RosterDay day = lockOrCreateDay(date, dutyType);

        List<Post> posts = postCatalog.orderedPosts();
        List<AllocationView> created = new ArrayList<>(posts.size());
        int punishmentCount = 0;
        for (Post post : posts) {
            Person chosen = candidateSelector.select(post, date, dutyType)
                    .orElseThrow(() -> new RosterGenerationException(date, post.getName(), post.getAllowedYears()));

            boolean punishment = chosen.hasPunishmentDebt();
            if (punishment) {
                chosen.consumePunishment();
                punishmentCount++;
            } else {
                dutyType.adjustDutyCount(chosen, 1);
            }
            Allocation allocation = allocationRepository.save(
                    new Allocation(chosen, postRepository.getReferenceById(post.getId()), date, punishment));
            created.add(new AllocationView(allocation.getId(), date, post.getId(), post.getName(),
                    chosen.getId(), chosen.getName(), punishment));
            logger.debug("割り当て: 日付={}, ポスト='{}', 対象者={}, 懲罰={}",
                    date, post.getName(), chosen.getId(), punishment);
        }

        logger.info("勤務表を生成しました: 日付={}, 種別={}, 割り当て={}件 (懲罰 {}件)",
                date, dutyType, created.size(), punishmentCount);
        return new DayGenerationResult(date, dutyType, day.getStatus(), punishmentCount, created);
    }

    /**
     * 日付ヘッダを行ロックで確保し、下書きなら既存の割り当てを取り消してから種別を更新する。
     * 公開済みなら何も変更せずに失敗する。
     */
    private RosterDay lockOrCreateDay(LocalDate date, DutyType dutyType) {
        Optional<RosterDay> existing = rosterDayRepository.findByDateForUpdate(date);
        if (existing.isEmpty()) {
            try {
                return rosterDayRepository.saveAndFlush(new RosterDay(date, dutyType));
            } catch (DataIntegrityViolationException e) {
                throw new BusinessException(ErrorCode.CONCURRENT_MODIFICATION,
                        "同じ日付の勤務表が同時に生成されました: " + date, e, date);
            }
        }

        RosterDay day = existing.get();
        if (day.isPublished()) {
            throw new BusinessException(ErrorCode.ALREADY_PUBLISHED,
                    "公開済みの勤務表は再生成できません: " + date, date);
        }
        clearDraft(day);
        day.setDutyType(dutyType);
        return day;
    }

    private void clearDraft(RosterDay day) {
        List<Allocation> previous = allocationRepository.findByDate(day.getDate());
        if (previous.isEmpty()) {
            return;
        }
        DutyType previousType = day.getDutyType();
        for (Allocation allocation : previous) {
            if (allocation.isPunishment()) {
                allocation.getPunishedPerson().restorePunishment();
            } else {
                previousType.adjustDutyCount(allocation.getPerson(), -1);
            }
        }

        List<Long> ids = previous.stream().map(Allocation::getId).toList();
        LocalDateTime now = LocalDateTime.now(clock);
        List<SwapRequest> referencing = swapRequestRepository.findReferencingAllocations(ids);
        for (SwapRequest request : referencing) {
            request.detachFrom(ids, now);
        }
        swapRequestRepository.flush();

        allocationRepository.deleteAll(previous);
        // deletes must reach the database before the new rows hit the (post, date) unique key
        allocationRepository.flush();
        logger.info("下書きの割り当てを取り消しました: 日付={}, {}件 (交代申請 {}件を切り離し)",
                day.getDate(), previous.size(), referencing.size());
    }
}
