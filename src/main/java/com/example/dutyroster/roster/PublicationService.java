package com.example.dutyroster.roster;

import com.example.dutyroster.exception.BusinessException;
import com.example.dutyroster.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

/**
 * 勤務表の公開と正誤（公開済みの日を下書きに戻す）。
 */
@Service
public class PublicationService {

    private static final Logger logger = LoggerFactory.getLogger(PublicationService.class);

    private final RosterDayRepository rosterDayRepository;
    private final int maxDays;

    public PublicationService(RosterDayRepository rosterDayRepository,
                              @Value("${roster.period.max-days:62}") int maxDays) {
        this.rosterDayRepository = rosterDayRepository;
        this.maxDays = maxDays;
    }

    @Transactional
    public int publish(LocalDate startDate, LocalDate endDate) {
        RosterPeriodService.validateRange(startDate, endDate, maxDays);

        int published = rosterDayRepository.publishDrafts(startDate, endDate);
        if (published == 0) {
            throw new BusinessException(ErrorCode.NOTHING_TO_PUBLISH,
                    "公開対象の下書きがありません: " + startDate + " 〜 " + endDate, startDate, endDate);
        }
        logger.info("勤務表を公開しました: {} 〜 {}, {}日", startDate, endDate, published);
        return published;
    }

    @Transactional
    public RosterDay reopen(LocalDate date) {
        if (date == null) {
            throw BusinessException.validation("日付は必須です");
        }
        RosterDay day = rosterDayRepository.findByDateForUpdate(date)
                .orElseThrow(() -> BusinessException.notFound("勤務表が見つかりません: " + date, date));
        if (!day.isPublished()) {
            throw new BusinessException(ErrorCode.NOT_PUBLISHED,
                    "公開されていない勤務表は差し戻せません: " + date, date);
        }
        day.setStatus(DayStatus.DRAFT);
        logger.info("公開済みの勤務表を下書きに戻しました: {}", date);
        return day;
    }
}
