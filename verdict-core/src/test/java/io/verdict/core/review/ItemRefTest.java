package io.verdict.core.review;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.verdict.core.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ItemRefTest {

    @Test
    void shouldSplitOnFirstSeparatorOnly() {
        ItemRef ref = ItemRef.parse("quiz:week-2:retake");

        assertThat(ref.contentType()).isEqualTo("quiz");
        assertThat(ref.contentId()).isEqualTo("week-2:retake");
        assertThat(ref.toString()).isEqualTo("quiz:week-2:retake");
    }

    @ParameterizedTest
    @ValueSource(strings = {"page", ":intro", "page:", ""})
    void shouldRejectMalformedIds(String itemId) {
        assertThatThrownBy(() -> ItemRef.parse(itemId)).isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectNullId() {
        assertThatThrownBy(() -> ItemRef.parse(null)).isInstanceOf(ValidationException.class);
    }
}
