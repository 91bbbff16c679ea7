package com.geo.match.api;

import com.geo.match.core.model.JoinMode;
import com.geo.match.geocode.FetchConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MatchOptionsTest {

    @Test
    @DisplayName("Should create default options")
    void testDefaultOptions() {
        MatchOptions options = MatchOptions.defaults();

        assertEquals(JoinMode.LEFT, options.getJoinMode());
        assertTrue(options.isExclusive());
        assertEquals(0.25, options.getRadiusMiles());
        assertEquals(Path.of("matches.csv"), options.matchesPath());
        assertEquals(FetchConfig.defaults(), options.getFetchConfig());
    }

    @Test
    @DisplayName("The coords path should replace the extension with the suffix")
    void testCoordsPath() {
        MatchOptions options = MatchOptions.builder()
                .outputDirectory(Path.of("out"))
                .build();

        assertEquals(Path.of("out", "stores_coords.csv"), options.coordsPath(Path.of("data", "stores.csv")));
        assertEquals(Path.of("out", "archive.v2_coords.csv"), options.coordsPath(Path.of("archive.v2.txt")));
        assertEquals(Path.of("out", "README_coords.csv"), options.coordsPath(Path.of("README")));
        assertEquals(Path.of("out", ".hidden_coords.csv"), options.coordsPath(Path.of(".hidden")));
    }

    @Test
    @DisplayName("toBuilder should copy every option")
    void testToBuilder() {
        MatchOptions original = MatchOptions.builder()
                .joinMode(JoinMode.OUTER)
                .exclusive(false)
                .radiusMiles(1.5)
                .matchesFileName("joined.csv")
                .fetchConfig(FetchConfig.of(10, 2))
                .build();

        MatchOptions copy = original.toBuilder().radiusMiles(2.0).build();

        assertEquals(JoinMode.OUTER, copy.getJoinMode());
        assertFalse(copy.isExclusive());
        assertEquals(2.0, copy.getRadiusMiles());
        assertEquals("joined.csv", copy.getMatchesFileName());
        assertEquals(FetchConfig.of(10, 2), copy.getFetchConfig());
        assertEquals(1.5, original.getRadiusMiles());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Should reject a radius that is not a positive finite number")
    void testInvalidRadius(double radius) {
        assertThrows(IllegalArgumentException.class, () -> MatchOptions.builder().radiusMiles(radius));
    }

    @Test
    @DisplayName("Should reject a missing join mode and blank file names")
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> MatchOptions.builder().joinMode(null));
        assertThrows(IllegalArgumentException.class, () -> MatchOptions.builder().matchesFileName(" "));
        assertThrows(IllegalArgumentException.class, () -> MatchOptions.builder().coordsFileSuffix(""));
    }

    @Test
    @DisplayName("toString should print radius, mode and exclusivity on separate lines")
    void testToString() {
        assertEquals("Radius: 0.25\nMatchMode: LEFT\nExclusive: true", MatchOptions.defaults().toString());
    }
}
