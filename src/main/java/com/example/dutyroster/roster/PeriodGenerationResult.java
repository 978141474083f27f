package com.example.dutyroster.roster;

import java.time.LocalDate;
import java.util.List;

public record PeriodGenerationResult(
        LocalDate startDate,
        LocalDate endDate,
        int generatedDays,
        List<DayGenerationResult> days
) {}
