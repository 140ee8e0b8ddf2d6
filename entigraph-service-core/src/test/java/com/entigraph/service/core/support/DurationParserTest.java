package com.entigraph.service.core.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationParserTest {

    @Test
    void parsesShorthandAndIsoDurations() {
        assertThat(DurationParser.parse("250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(DurationParser.parse("30s")).isEqualTo(Duration.ofSeconds(30));
        assertThat(DurationParser.parse("5m")).isEqualTo(Duration.ofMinutes(5));
        assertThat(DurationParser.parse(" 8h ")).isEqualTo(Duration.ofHours(8));
        assertThat(DurationParser.parse("1d")).isEqualTo(Duration.ofDays(1));
        assertThat(DurationParser.parse("PT8H")).isEqualTo(Duration.ofHours(8));
        assertThat(DurationParser.parse("p1d")).isEqualTo(Duration.ofDays(1));
    }

    @Test
    void rejectsBlankMalformedAndNonPositiveDurations() {
        assertThatThrownBy(() -> DurationParser.parse(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DurationParser.parse("soon")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DurationParser.parse("xm")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DurationParser.parse("0s"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> DurationParser.parse("PT-5M")).isInstanceOf(IllegalArgumentException.class);
    }
}
