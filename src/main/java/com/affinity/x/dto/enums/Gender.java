package com.affinity.x.dto.enums;

public enum Gender {
    MALE,
    FEMALE,
    NON_BINARY
}
