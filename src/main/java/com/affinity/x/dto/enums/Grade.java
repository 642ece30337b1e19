package com.affinity.x.dto.enums;

import com.affinity.x.exceptions.BadRequestException;
import com.affinity.x.exceptions.ErrorCode;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Letter grade for one compatibility dimension, best first.
 * <p>
 * Every grade maps to exactly one value on the numeric scale, and the scale strictly decreases
 * in declaration order, so improving a grade by one step always raises its numeric value.
 * </p>
 */
public enum Grade {
    A_PLUS("A+", 98),
    A("A", 95),
    A_MINUS("A-", 90),
    B_PLUS("B+", 87),
    B("B", 83),
    B_MINUS("B-", 80),
    C_PLUS("C+", 77),
    C("C", 73),
    C_MINUS("C-", 70),
    D_PLUS("D+", 65),
    D("D", 60),
    D_MINUS("D-", 55),
    F("F", 40);

    private final String label;
    private final int numericValue;

    Grade(String label, int numericValue) {
        this.label = label;
        this.numericValue = numericValue;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getNumericValue() {
        return numericValue;
    }

    /**
     * The letter without its +/- modifier.
     */
    public char letter() {
        return label.charAt(0);
    }

    @JsonCreator
    public static Grade fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new BadRequestException(ErrorCode.INVALID_INPUT, "Grade label must not be blank");
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(grade -> grade.label.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new BadRequestException(ErrorCode.INVALID_INPUT, "Unknown grade: " + label));
    }

    /**
     * Plain letter for a raw 0-100 score: A from 90, B from 80, C from 70, D from 60, else F.
     * Modified grades are never produced here; they enter only through {@link #fromLabel(String)}.
     */
    public static Grade fromScore(double score) {
        if (score >= 90.0) {
            return A;
        }
        if (score >= 80.0) {
            return B;
        }
        if (score >= 70.0) {
            return C;
        }
        if (score >= 60.0) {
            return D;
        }
        return F;
    }
}
