package com.affinity.x.processors;

import com.affinity.x.dto.enums.Grade;
import com.affinity.x.exceptions.InsufficientDataException;
import com.affinity.x.models.Profile;
import com.affinity.x.service.QuestionnaireCompatibilityCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Grades questionnaire agreement. Answers are Likert values 1-5 in five groups of five questions;
 * each question scores 4 minus the distance between the two answers, each group is its mean
 * on a 0-100 scale, and the overall score is the mean of the groups that had comparable answers.
 */
@Slf4j
@Component
public class DivergenceQuestionnaireCompatibilityCalculator implements QuestionnaireCompatibilityCalculator {
    static final int GROUP_COUNT = 5;
    static final int QUESTIONS_PER_GROUP = 5;
    private static final int MIN_ANSWER = 1;
    private static final int MAX_ANSWER = 5;
    private static final double MAX_QUESTION_SCORE = MAX_ANSWER - MIN_ANSWER;

    @Override
    public Grade calculate(Profile viewer, Profile candidate) {
        return Grade.fromScore(score(viewer.getQuestionnaireAnswers(), candidate.getQuestionnaireAnswers()));
    }

    double score(List<Integer> first, List<Integer> second) {
        if (first == null || second == null) {
            throw new InsufficientDataException("Questionnaire answers missing");
        }
        double groupTotal = 0.0;
        int scoredGroups = 0;
        for (int group = 0; group < GROUP_COUNT; group++) {
            double questionTotal = 0.0;
            int compared = 0;
            for (int q = group * QUESTIONS_PER_GROUP; q < (group + 1) * QUESTIONS_PER_GROUP; q++) {
                Integer a = answerAt(first, q);
                Integer b = answerAt(second, q);
                if (a == null || b == null) {
                    continue;
                }
                questionTotal += MAX_QUESTION_SCORE - Math.abs(a - b);
                compared++;
            }
            if (compared > 0) {
                groupTotal += questionTotal / compared / MAX_QUESTION_SCORE * 100.0;
                scoredGroups++;
            }
        }
        if (scoredGroups == 0) {
            throw new InsufficientDataException("No comparable questionnaire answers");
        }
        return groupTotal / scoredGroups;
    }

    private static Integer answerAt(List<Integer> answers, int index) {
        if (index >= answers.size()) {
            return null;
        }
        Integer answer = answers.get(index);
        return answer == null || answer < MIN_ANSWER || answer > MAX_ANSWER ? null : answer;
    }
}
