package com.example.dutyroster.roster;

public enum DayStatus {
    DRAFT("下書き"),
    PUBLISHED("公開済み");

    private final String displayName;

    DayStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
