package com.anthem.iamx.graph.query;

import com.anthem.iamx.graph.exception.InvalidPatternException;
import com.anthem.iamx.graph.pattern.WildcardPattern;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternValidatorTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "s3:GetObject",
            "*",
            "arn:aws:s3:::my-bucket/path/*.json",
            "arn:aws:iam::123456789012:role/service-role/Name+With=Chars,@x",
            "arn:aws:s3:::bucket/${aws:username}/*",
            "ec2:Describe?nstances"
    })
    void acceptsActionAndArnAlphabet(String pattern) {
        assertThat(PatternValidator.validate("action", pattern)).isEqualTo(WildcardPattern.of(pattern));
    }

    @ParameterizedTest
    @ValueSource(strings = {"s3:Get Object", "s3:\"x\"", "bucket|other", "a\tb", "s3:[a]"})
    void rejectsCharactersOutsideAlphabet(String pattern) {
        assertThatThrownBy(() -> PatternValidator.validate("action", pattern))
                .isInstanceOf(InvalidPatternException.class)
                .hasMessageStartingWith("Invalid action pattern");
    }

    @Test
    void rejectsNullAndEmpty() {
        assertThatThrownBy(() -> PatternValidator.validate("resource", null))
                .isInstanceOf(InvalidPatternException.class);
        assertThatThrownBy(() -> PatternValidator.validate("resource", ""))
                .isInstanceOf(InvalidPatternException.class)
                .hasMessageContaining("must not be empty");
    }
}
