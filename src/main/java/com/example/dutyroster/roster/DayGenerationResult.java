package com.example.dutyroster.roster;

import java.time.LocalDate;
import java.util.List;

public record DayGenerationResult(
        LocalDate date,
        DutyType dutyType,
        DayStatus status,
        int punishmentAllocations,
        List<AllocationView> allocations
) {}
