package com.example.dutyroster.roster;

import java.time.LocalDate;
import java.util.List;

public record RosterDayView(
        LocalDate date,
        DutyType dutyType,
        DayStatus status,
        List<AllocationView> allocations
) {}
