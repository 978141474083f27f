package com.example.dutyroster.swap;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum SwapStatus {
    PENDING("交代者の回答待ち"),
    AWAITING_SCHEDULER("勤務担当者の承認待ち"),
    APPROVED("承認済み"),
    REJECTED("却下");

    public static final Set<SwapStatus> OPEN = Collections.unmodifiableSet(EnumSet.of(PENDING, AWAITING_SCHEDULER));

    private final String displayName;

    SwapStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isOpen() {
        return OPEN.contains(this);
    }
}
