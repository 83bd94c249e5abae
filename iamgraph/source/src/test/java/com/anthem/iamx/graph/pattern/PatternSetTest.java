package com.anthem.iamx.graph.pattern;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatternSetTest {

    @Test
    void shouldMatchWhenAnyPatternMatches() {
        PatternSet actions = PatternSet.of(List.of("s3:GetObject", "s3:List*"));

        assertThat(actions.matches("s3:ListBucket")).isTrue();
        assertThat(actions.matches("s3:PutObject")).isFalse();
    }

    @Test
    void shouldInvertMatchingForNegatedSet() {
        PatternSet notIam = PatternSet.not(List.of("iam:*"));

        assertThat(notIam.matches("s3:GetObject")).isTrue();
        assertThat(notIam.matches("iam:CreateUser")).isFalse();
    }

    @Test
    void negatedSetOverlapsUnlessExcludedPatternCoversQuery() {
        PatternSet notIam = PatternSet.not(List.of("iam:*"));

        assertThat(notIam.overlaps(WildcardPattern.of("iam:Create*"))).isFalse();
        assertThat(notIam.overlaps(WildcardPattern.of("*"))).isTrue();
        assertThat(notIam.overlaps(WildcardPattern.of("s3:GetObject"))).isTrue();
    }

    @Test
    void negatedSetCoversOnlyDisjointQueries() {
        PatternSet notIam = PatternSet.not(List.of("iam:*"));

        assertThat(notIam.covers(WildcardPattern.of("s3:*"))).isTrue();
        assertThat(notIam.covers(WildcardPattern.of("*"))).isFalse();
    }

    @Test
    void shouldKeepValuesAndFormForToString() {
        PatternSet notIam = PatternSet.not(List.of("iam:*", "sts:*"));

        assertThat(notIam.getValues()).containsExactly("iam:*", "sts:*");
        assertThat(notIam.isNegated()).isTrue();
        assertThat(notIam).hasToString("Not[iam:*, sts:*]");
    }
}
