package com.repstack.model.enums;

public enum RangeOfMotion {
    FULL,
    MEDIUM,
    SHORT
}
