package com.company.uptime.pacing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PacerTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final Pacer pacer = new Pacer(sleeps::add, new Random(42));

    // ========================================================================
    // pace
    // ========================================================================

    @Nested
    @DisplayName("pace")
    class PaceTests {

        @Test
        @DisplayName("should return the first item without pausing")
        void shouldNotPauseBeforeFirstItem() {
            Iterator<String> paced = pacer.pace(List.of("a", "b"), 1000, 5000);

            assertThat(paced.next()).isEqualTo("a");
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("should pause within bounds before every later item")
        void shouldPauseWithinBounds() {
            List<Integer> items = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                items.add(i);
            }

            List<Integer> seen = new ArrayList<>();
            pacer.pace(items, 1000, 5000).forEachRemaining(seen::add);

            assertThat(seen).isEqualTo(items);
            assertThat(sleeps).hasSize(199);
            assertThat(sleeps).allSatisfy(delay -> assertThat(delay).isBetween(1000L, 5000L));
        }

        @Test
        @DisplayName("should space dispatches by at least the minimum in wall-clock time")
        void shouldSpaceDispatchesInRealTime() {
            Pacer realTime = new Pacer(Sleeper.system(), new Random());
            List<Long> timestamps = new ArrayList<>();

            Iterator<Integer> paced = realTime.pace(List.of(1, 2, 3), 50, 80);
            while (paced.hasNext()) {
                paced.next();
                timestamps.add(System.nanoTime());
            }

            for (int i = 1; i < timestamps.size(); i++) {
                long gapMillis = (timestamps.get(i) - timestamps.get(i - 1)) / 1_000_000;
                assertThat(gapMillis).isGreaterThanOrEqualTo(50);
            }
        }

        @Test
        @DisplayName("should not see changes made to the source list afterwards")
        void shouldSnapshotItems() {
            List<String> source = new ArrayList<>(List.of("a", "b"));
            Iterator<String> paced = pacer.pace(source, 0, 0);
            source.add("c");

            List<String> seen = new ArrayList<>();
            paced.forEachRemaining(seen::add);

            assertThat(seen).containsExactly("a", "b");
        }

        @Test
        @DisplayName("should throw once exhausted")
        void shouldThrowWhenExhausted() {
            Iterator<String> paced = pacer.pace(List.of(), 1000, 5000);

            assertThat(paced.hasNext()).isFalse();
            assertThatThrownBy(paced::next).isInstanceOf(NoSuchElementException.class);
        }

        @Test
        @DisplayName("should cancel and keep the interrupt flag when interrupted while pausing")
        void shouldCancelOnInterrupt() {
            Pacer interrupted = new Pacer(millis -> {
                throw new InterruptedException();
            }, new Random());
            Iterator<String> paced = interrupted.pace(List.of("a", "b"), 1000, 5000);
            paced.next();

            try {
                assertThatThrownBy(paced::next).isInstanceOf(CancellationException.class);
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }
        }
    }

    // ========================================================================
    // Bounds
    // ========================================================================

    @Nested
    @DisplayName("Bounds")
    class BoundsTests {

        @Test
        @DisplayName("should use the exact value when min equals max")
        void shouldUseFixedDelay() {
            assertThat(pacer.nextDelayMillis(3000, 3000)).isEqualTo(3000);
        }

        @Test
        @DisplayName("should pause once for a single jitter")
        void shouldJitterOnce() {
            pacer.jitter(2000, 5000);

            assertThat(sleeps).hasSize(1);
            assertThat(sleeps.get(0)).isBetween(2000L, 5000L);
        }

        @Test
        @DisplayName("should reject inverted or negative bounds")
        void shouldRejectInvalidBounds() {
            assertThatThrownBy(() -> pacer.pace(List.of("a"), 5000, 1000))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> pacer.jitter(-1, 10))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
