package com.costsheet.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Revisions}.
 */
class RevisionsTest {

    @Test
    void next_noRevision_returnsA() {
        assertThat(Revisions.next(null)).isEqualTo("A");
        assertThat(Revisions.next("")).isEqualTo("A");
    }

    @Test
    void next_advancesLastLetter() {
        assertThat(Revisions.next("A")).isEqualTo("B");
        assertThat(Revisions.next("b")).isEqualTo("C");
        assertThat(Revisions.next("AB")).isEqualTo("AC");
    }

    @Test
    void next_wrapsLikeColumnNames() {
        assertThat(Revisions.next("Z")).isEqualTo("AA");
        assertThat(Revisions.next("AZ")).isEqualTo("BA");
        assertThat(Revisions.next("ZZ")).isEqualTo("AAA");
    }

    @Test
    void next_nonLetters_throwsIllegalArgumentException() {
        assertThatThrownBy(() -> Revisions.next("A1"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("A1");
    }
}
