package com.calor.compiler.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FuzzyMatcher.
 */
class FuzzyMatcherTest {

    @Test
    void testDistance() {
        assertThat(FuzzyMatcher.distance("kitten", "sitting")).isEqualTo(3);
        assertThat(FuzzyMatcher.distance("", "abc")).isEqualTo(3);
        assertThat(FuzzyMatcher.distance("same", "same")).isZero();
    }

    @Test
    void testFindClosestWithinThreshold() {
        List<String> names = List.of("count", "counter", "total");

        assertThat(FuzzyMatcher.findClosest("cuont", names)).isEqualTo("count");
        assertThat(FuzzyMatcher.findClosest("xyzzy", names)).isNull();
    }

    @Test
    void testComparisonIgnoresCaseButSkipsExactMatch() {
        assertThat(FuzzyMatcher.findClosest("COUNT", List.of("count"))).isEqualTo("count");
        assertThat(FuzzyMatcher.findClosest("count", List.of("count"))).isNull();
    }

    @Test
    void testFindSimilarOrdersByDistanceThenName() {
        List<String> similar = FuzzyMatcher.findSimilar("cat", List.of("cut", "bat", "cart", "dog"), 3);

        assertThat(similar).containsExactly("bat", "cart", "cut");
    }

    @Test
    void testFindSimilarRespectsLimit() {
        List<String> similar = FuzzyMatcher.findSimilar("cat", List.of("cut", "bat", "cart"), 1);

        assertThat(similar).containsExactly("bat");
    }

    @Test
    void testEmptyInput() {
        assertThat(FuzzyMatcher.findSimilar("", List.of("a"), 3)).isEmpty();
        assertThat(FuzzyMatcher.findSimilar(null, List.of("a"), 3)).isEmpty();
    }
}
