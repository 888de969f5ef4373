package com.project.hatchmark.match;

import com.project.hatchmark.core.ValidationException;
import com.project.hatchmark.fingerprint.Fingerprint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity matching")
class SimilarityMatcherTest {

    private static final Fingerprint ZERO = Fingerprint.parse("0000000000000000");
    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private static CorpusEntry<String> entry(String id, String hex, long secondsAfterT0) {
        return new CorpusEntry<>(id, Fingerprint.parse(hex), T0.plusSeconds(secondsAfterT0), id);
    }

    @Nested
    @DisplayName("Hamming distance")
    class HammingDistanceTests {

        @Test
        @DisplayName("Counts differing bits per hex digit")
        void testCountsBits() {
            assertEquals(0, HammingDistance.between(ZERO, ZERO));
            assertEquals(64, HammingDistance.between(ZERO, Fingerprint.parse("ffffffffffffffff")));
            assertEquals(4, HammingDistance.between(ZERO, Fingerprint.parse("000000000000000f")));
            assertEquals(4, HammingDistance.between(Fingerprint.parse("a0"), Fingerprint.parse("50")));
        }

        @Test
        @DisplayName("Distance is symmetric")
        void testSymmetric() {
            Random random = new Random(42);
            for (int i = 0; i < 200; i++) {
                Fingerprint a = Fingerprint.parse(String.format("%016x", random.nextLong()));
                Fingerprint b = Fingerprint.parse(String.format("%016x", random.nextLong()));
                assertEquals(HammingDistance.between(a, b), HammingDistance.between(b, a));
            }
        }

        @Test
        @DisplayName("Different widths are maximally distant, never an error")
        void testLengthMismatch() {
            Fingerprint legacy = Fingerprint.parse("00000000000000000000000000000000");

            assertEquals(128, HammingDistance.between(ZERO, legacy));
            assertEquals(128, HammingDistance.between(legacy, ZERO));
            assertEquals(0, HammingDistance.similarity(ZERO, legacy));
        }

        @Test
        @DisplayName("Similarity strictly decreases as distance grows")
        void testMonotonic() {
            int previous = HammingDistance.similarity(0, 64);
            assertEquals(100, previous);
            for (int d = 1; d <= 64; d++) {
                int current = HammingDistance.similarity(d, 64);
                assertTrue(current <= previous, "similarity rose at distance " + d);
                previous = current;
            }
            assertEquals(0, previous);
            assertTrue(HammingDistance.similarity(3, 64) > HammingDistance.similarity(7, 64));
        }
    }

    @Nested
    @DisplayName("Thresholds")
    class ThresholdTests {

        @Test
        @DisplayName("An entry at exactly 90% is included, 89% is excluded")
        void testBoundary() {
            // 40-bit fingerprints: 4 differing bits is exactly 90%
            Fingerprint candidate = Fingerprint.parse("0000000000");
            List<CorpusEntry<String>> corpus = List.of(
                    entry("0xa", "000000000f", 0),
                    entry("0xb", "00000000ff", 1));

            MatchReport<String> report = SimilarityMatcher.match(candidate, corpus, 90);

            assertEquals(1, report.matches().size());
            assertEquals("0xa", report.matches().get(0).id());
            assertEquals(90, report.matches().get(0).similarity());

            // 64-bit fingerprint 7 bits away rounds to 89%
            MatchReport<String> below = SimilarityMatcher.match(ZERO,
                    List.of(entry("0xc", "000000000000007f", 0)), 90);
            assertTrue(below.matches().isEmpty());
            assertTrue(below.isOriginal());
        }

        @Test
        @DisplayName("Threshold outside 0-100 is rejected")
        void testInvalidThreshold() {
            assertThrows(ValidationException.class, () -> SimilarityMatcher.match(ZERO, List.of(), 101));
            assertThrows(ValidationException.class, () -> SimilarityMatcher.match(ZERO, List.of(), -1));
        }

        @Test
        @DisplayName("Different-width entries never match, even at threshold 0")
        void testDifferentWidthNeverMatches() {
            MatchReport<String> report = SimilarityMatcher.match(ZERO,
                    List.of(entry("0xa", "00000000000000000000000000000000", 0),
                            entry("0xb", "0000000000000000", 1)), 0);

            assertEquals(1, report.matches().size());
            assertEquals("0xb", report.matches().get(0).id());
            assertEquals(2, report.corpusSize());
            assertTrue(SimilarityMatcher.match(ZERO,
                    List.of(entry("0xa", "00000000000000000000000000000000", 0)), 0).isOriginal());
        }
    }

    @Nested
    @DisplayName("Ranking")
    class RankingTests {

        @Test
        @DisplayName("Sorted by similarity, ties broken by earliest registration")
        void testOrdering() {
            List<CorpusEntry<String>> corpus = List.of(
                    entry("0x1", "0000000000000003", 30),
                    entry("0x2", "0000000000000001", 20),
                    entry("0x3", "0000000000000003", 10),
                    entry("0x4", "0000000000000000", 40));

            MatchReport<String> report = SimilarityMatcher.match(ZERO, corpus, 70);

            assertEquals(List.of("0x4", "0x2", "0x3", "0x1"),
                    report.matches().stream().map(Match::id).collect(Collectors.toList()));
            assertTrue(report.exactMatch().isPresent());
            assertEquals("0x4", report.exactMatch().get().id());
            assertFalse(report.isOriginal());
            assertEquals(4, report.corpusSize());
        }

        @Test
        @DisplayName("Identical similarity and time fall back to id order")
        void testTotalOrder() {
            List<CorpusEntry<String>> corpus = List.of(
                    entry("0xb", "0000000000000001", 0),
                    entry("0xa", "0000000000000001", 0));

            MatchReport<String> report = SimilarityMatcher.match(ZERO, corpus, 0);

            assertEquals("0xa", report.matches().get(0).id());
            assertTrue(report.exactMatch().isEmpty());
        }

        @Test
        @DisplayName("Empty corpus reports an original")
        void testEmptyCorpus() {
            MatchReport<String> report = SimilarityMatcher.match(ZERO, List.of(), 70);

            assertTrue(report.isOriginal());
            assertTrue(report.best().isEmpty());
            assertEquals(0, report.corpusSize());
        }
    }

    @Nested
    @DisplayName("Linear scan index")
    class LinearScanIndexTests {

        @Test
        @DisplayName("Answers the same report as a direct match")
        void testIndexMatchesDirectScan() {
            List<CorpusEntry<String>> corpus = List.of(
                    entry("0x1", "00000000000000ff", 0),
                    entry("0x2", "0000000000000001", 1));
            SimilarityIndex<String> index = new LinearScanIndex<>(corpus);
            index.add(entry("0x3", "ffffffffffffffff", 2));

            MatchReport<String> fromIndex = index.query(ZERO, 70);

            assertEquals(3, index.size());
            assertEquals(SimilarityMatcher.match(ZERO, List.of(corpus.get(0), corpus.get(1),
                    entry("0x3", "ffffffffffffffff", 2)), 70).matches().size(), fromIndex.matches().size());
            assertEquals("0x2", fromIndex.best().orElseThrow().id());
        }
    }
}
