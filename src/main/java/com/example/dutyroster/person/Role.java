package com.example.dutyroster.person;

public enum Role {
    ADMIN,
    SCHEDULER
}
