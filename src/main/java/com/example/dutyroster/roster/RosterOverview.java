package com.example.dutyroster.roster;

import java.util.List;

public record RosterOverview(
        List<RosterDayView> published,
        List<RosterDayView> drafts
) {}
