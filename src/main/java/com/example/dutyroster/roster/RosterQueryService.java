package com.example.dutyroster.roster;

import com.example.dutyroster.exception.BusinessException;
import com.example.dutyroster.person.PersonRepository;
import com.example.dutyroster.person.PunishedPersonView;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class RosterQueryService {

    private final RosterDayRepository rosterDayRepository;
    private final AllocationRepository allocationRepository;
    private final PersonRepository personRepository;
    private final Clock clock;
    private final int upcomingLimit;

    public RosterQueryService(RosterDayRepository rosterDayRepository,
                              AllocationRepository allocationRepository,
                              PersonRepository personRepository,
                              Clock clock,
                              @Value("${roster.swap.upcoming-limit:5}") int upcomingLimit) {
        this.rosterDayRepository = rosterDayRepository;
        this.allocationRepository = allocationRepository;
        this.personRepository = personRepository;
        this.clock = clock;
        this.upcomingLimit = upcomingLimit;
    }

    /**
     * 指定日以降の勤務表を公開済み・下書きに分けて返す。各日の割り当てはポスト優先度の高い順。
     */
    public RosterOverview daysFrom(LocalDate from) {
        LocalDate start = from != null ? from : LocalDate.now(clock);
        Map<LocalDate, List<AllocationView>> byDate = allocationRepository.findForDisplayFrom(start).stream()
                .collect(Collectors.groupingBy(Allocation::getDate, LinkedHashMap::new,
                        Collectors.mapping(AllocationView::from, Collectors.toList())));

        List<RosterDayView> published = new ArrayList<>();
        List<RosterDayView> drafts = new ArrayList<>();
        for (RosterDay day : rosterDayRepository.findByDateGreaterThanEqualOrderByDateAsc(start)) {
            RosterDayView view = new RosterDayView(day.getDate(), day.getDutyType(), day.getStatus(),
                    byDate.getOrDefault(day.getDate(), List.of()));
            if (day.isPublished()) {
                published.add(view);
            } else {
                drafts.add(view);
            }
        }
        return new RosterOverview(published, drafts);
    }

    /**
     * 対象者の今日以降の勤務（日付順、件数上限あり）。
     */
    public List<AllocationView> upcomingDuties(Long personId) {
        if (!personRepository.existsById(personId)) {
            throw BusinessException.notFound("対象者が見つかりません: " + personId, personId);
        }
        return allocationRepository.findUpcomingByPerson(personId, LocalDate.now(clock)).stream()
                .limit(upcomingLimit)
                .map(AllocationView::from)
                .toList();
    }

    public List<PunishedPersonView> punishedPersons() {
        return personRepository.findByPunishmentBalanceGreaterThanOrderByPunishmentBalanceDescNameAsc(0).stream()
                .map(PunishedPersonView::from)
                .toList();
    }
}
