package com.migrationanalyzer.core.classifier;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Version}.
 */
class VersionTest {

    @ParameterizedTest
    @CsvSource({
        "2.13.0, 2.17.1",
        "2.17, 2.17.1",
        "2.0.0-rc1, 2.0.0",
        "2.0-SNAPSHOT, 2.0",
        "5.3.17.RELEASE, 5.3.18",
        "1.4.17, 1.4.18",
        "6.3.0.1, 6.3.0.2"
    })
    void isBefore_olderVersion_returnsTrue(String older, String newer) {
        Version left = Version.parse(older).orElseThrow();
        Version right = Version.parse(newer).orElseThrow();

        assertThat(left.isBefore(right)).isTrue();
        assertThat(right.isBefore(left)).isFalse();
    }

    @Test
    void compareTo_trailingZeros_areEqual() {
        assertThat(Version.parse("2.0").orElseThrow())
            .isEqualByComparingTo(Version.parse("2.0.0").orElseThrow());
    }

    @Test
    void parse_releaseQualifier_isNotPreRelease() {
        Version version = Version.parse("4.3.30.RELEASE").orElseThrow();

        assertThat(version.preRelease()).isFalse();
        assertThat(version.major()).isEqualTo(4);
    }

    @Test
    void parse_milestone_isPreRelease() {
        assertThat(Version.parse("6.0.0-M3").orElseThrow().preRelease()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"${log4j.version}", "latest.release", "", "[1.0,2.0)"})
    void parse_nonNumeric_returnsEmpty(String text) {
        assertThat(Version.parse(text)).isEmpty();
    }

    @Test
    void parse_null_returnsEmpty() {
        assertThat(Version.parse(null)).isEmpty();
    }
}
