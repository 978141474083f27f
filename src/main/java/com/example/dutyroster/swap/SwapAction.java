package com.example.dutyroster.swap;

public enum SwapAction {
    ACCEPT,
    DECLINE
}
