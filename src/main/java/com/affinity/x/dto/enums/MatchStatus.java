package com.affinity.x.dto.enums;

public enum MatchStatus {
    ACTIVE,
    UNMATCHED
}
