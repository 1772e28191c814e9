package com.repstack.model.enums;

public enum IneligibilityReason {
    PROFILE_NOT_FOUND,
    MAX_LEVEL_REACHED,
    INSUFFICIENT_WORKOUTS,
    COOLDOWN_ACTIVE,
    LOOKUP_FAILED
}
