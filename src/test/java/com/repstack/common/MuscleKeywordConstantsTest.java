package com.repstack.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MuscleKeywordConstantsTest {

    @Test
    void every_matching_group_is_kept_in_table_order() {
        assertThat(MuscleKeywordConstants.extractMuscles("I want a bigger chest and a wider back"))
                .containsExactly(MuscleKeywordConstants.BACK, MuscleKeywordConstants.CHEST);
    }

    @Test
    void korean_goals_resolve_like_english_ones() {
        assertThat(MuscleKeywordConstants.extractMuscles("하체 강화")).containsExactly(MuscleKeywordConstants.LEGS);
        assertThat(MuscleKeywordConstants.extractMuscles("가슴이랑 복근")).containsExactly(
                MuscleKeywordConstants.CHEST, MuscleKeywordConstants.CORE);
    }

    @Test
    void full_body_only_when_nothing_specific_matched() {
        assertThat(MuscleKeywordConstants.extractMuscles("full body workout"))
                .containsExactly(MuscleKeywordConstants.FULL_BODY);
        assertThat(MuscleKeywordConstants.extractMuscles("full body with extra arms"))
                .containsExactly(MuscleKeywordConstants.ARMS);
    }

    @Test
    void latin_keywords_must_start_a_word() {
        assertThat(MuscleKeywordConstants.extractMuscles("warm up and grow")).isEmpty();
        assertThat(MuscleKeywordConstants.extractMuscles(null)).isEmpty();
    }

    @Test
    void normalize_maps_synonyms_and_keeps_unknown_labels() {
        assertThat(MuscleKeywordConstants.normalizeMuscle("Pecs")).isEqualTo(MuscleKeywordConstants.CHEST);
        assertThat(MuscleKeywordConstants.normalizeMuscle(" 하체 ")).isEqualTo(MuscleKeywordConstants.LEGS);
        assertThat(MuscleKeywordConstants.normalizeMuscle("cardio")).isEqualTo(MuscleKeywordConstants.CARDIO);
        assertThat(MuscleKeywordConstants.normalizeMuscle("Forearms")).isEqualTo("forearms");
        assertThat(MuscleKeywordConstants.normalizeMuscle("")).isEqualTo(MuscleKeywordConstants.FULL_BODY);
    }
}
