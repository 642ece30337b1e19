package com.affinity.x.dto.enums;

public enum SwipeDirection {
    LIKE,
    PASS
}
