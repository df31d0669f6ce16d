package com.eainde.fitengine.config;

import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.SeniorityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PenaltyScheduleTest {

    private final PenaltySchedule schedule = PenaltySchedule.of(Map.of(PenaltyType.EXPERIENCE_GAP_PER_LEVEL, 8,
                    PenaltyType.PRESENTATION_GAP, 5))
            .withScope(JobFunction.ENGINEERING, SeniorityLevel.STAFF, Map.of(PenaltyType.EXPERIENCE_GAP_PER_LEVEL, 12))
            .withScope(JobFunction.ENGINEERING, null, Map.of(PenaltyType.EXPERIENCE_GAP_PER_LEVEL, 10,
                    PenaltyType.PRESENTATION_GAP, 6));

    @Test
    @DisplayName("Exact function and level scope wins")
    void exactScope() {
        assertThat(schedule.valueOf(PenaltyType.EXPERIENCE_GAP_PER_LEVEL, JobFunction.ENGINEERING, SeniorityLevel.STAFF))
                .isEqualTo(12);
    }

    @Test
    @DisplayName("Function-wide scope applies to other levels and to types the exact scope lacks")
    void functionWideScope() {
        assertThat(schedule.valueOf(PenaltyType.EXPERIENCE_GAP_PER_LEVEL, JobFunction.ENGINEERING, SeniorityLevel.SENIOR))
                .isEqualTo(10);
        assertThat(schedule.valueOf(PenaltyType.PRESENTATION_GAP, JobFunction.ENGINEERING, SeniorityLevel.STAFF))
                .isEqualTo(6);
    }

    @Test
    @DisplayName("Other functions use the defaults, and unknown types are zero")
    void defaults() {
        assertThat(schedule.valueOf(PenaltyType.EXPERIENCE_GAP_PER_LEVEL, JobFunction.MARKETING, SeniorityLevel.STAFF))
                .isEqualTo(8);
        assertThat(schedule.valueOf(PenaltyType.KEYWORD_STUFFING, JobFunction.MARKETING, SeniorityLevel.MID))
                .isZero();
    }

    @Test
    @DisplayName("Repeated scopes merge their values")
    void mergeScopes() {
        PenaltySchedule merged = schedule.withScope(JobFunction.ENGINEERING, SeniorityLevel.STAFF,
                Map.of(PenaltyType.PRESENTATION_GAP, 9));

        assertThat(merged.valueOf(PenaltyType.EXPERIENCE_GAP_PER_LEVEL, JobFunction.ENGINEERING, SeniorityLevel.STAFF))
                .isEqualTo(12);
        assertThat(merged.valueOf(PenaltyType.PRESENTATION_GAP, JobFunction.ENGINEERING, SeniorityLevel.STAFF))
                .isEqualTo(9);
    }
}
