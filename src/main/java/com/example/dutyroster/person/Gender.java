package com.example.dutyroster.person;

public enum Gender {
    M,
    F
}
