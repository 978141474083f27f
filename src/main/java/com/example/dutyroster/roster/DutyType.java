package com.example.dutyroster.roster;

import com.example.dutyroster.person.Person;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * 勤務種別。種別ごとに独立した公平性カウンタを持つ。
 */
public enum DutyType {
    RN("通常勤務") {
        @Override
        public int dutyCount(Person person) {
            return person.getNormalDuties();
        }

        @Override
        public void adjustDutyCount(Person person, int delta) {
            person.setNormalDuties(person.getNormalDuties() + delta);
        }
    },
    RD("休日勤務") {
        @Override
        public int dutyCount(Person person) {
            return person.getWeekendDuties();
        }

        @Override
        public void adjustDutyCount(Person person, int delta) {
            person.setWeekendDuties(person.getWeekendDuties() + delta);
        }
    };

    private static final Set<DayOfWeek> WEEKEND_ROUTINE_DAYS =
            EnumSet.of(DayOfWeek.FRIDAY, DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

    private final String displayName;

    DutyType(String displayName) {
        this.displayName = displayName;
    }

    public abstract int dutyCount(Person person);

    public abstract void adjustDutyCount(Person person, int delta);

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 金・土・日は休日勤務、それ以外は通常勤務。
     */
    public static DutyType forDate(LocalDate date) {
        return WEEKEND_ROUTINE_DAYS.contains(date.getDayOfWeek()) ? RD : RN;
    }
}
