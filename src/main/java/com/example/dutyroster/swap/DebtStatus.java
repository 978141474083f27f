package com.example.dutyroster.swap;

public enum DebtStatus {
    PENDING,
    PAID
}
