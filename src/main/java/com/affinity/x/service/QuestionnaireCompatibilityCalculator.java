package com.affinity.x.service;

import com.affinity.x.dto.enums.Grade;
import com.affinity.x.models.Profile;

public interface QuestionnaireCompatibilityCalculator {
    Grade calculate(Profile viewer, Profile candidate);
}
