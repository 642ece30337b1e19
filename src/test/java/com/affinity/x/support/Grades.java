package com.affinity.x.support;

import com.affinity.x.dto.enums.Grade;

public final class Grades {

    private Grades() {
    }

    /**
     * The next better grade, or the same grade when it is already the best.
     */
    public static Grade stepUp(Grade grade) {
        return grade.ordinal() == 0 ? grade : Grade.values()[grade.ordinal() - 1];
    }
}
