package com.example.dutyroster.post;

import com.example.dutyroster.person.Gender;

import java.util.EnumSet;
import java.util.Set;

public enum GenderRestriction {
    M(EnumSet.of(Gender.M)),
    F(EnumSet.of(Gender.F)),
    MIXED(EnumSet.allOf(Gender.class));

    private final Set<Gender> admitted;

    GenderRestriction(Set<Gender> admitted) {
        this.admitted = admitted;
    }

    public boolean admits(Gender gender) {
        return gender != null && admitted.contains(gender);
    }

    public Set<Gender> admittedGenders() {
        return EnumSet.copyOf(admitted);
    }
}
