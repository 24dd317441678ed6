package com.company.uptime.pacing;

import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.concurrent.CancellationException;

/**
 * Spreads calls against third-party endpoints (registrars, WHOIS servers) over time with a
 * uniformly random gap, so a batch never reaches them as a burst.
 */
@Slf4j
public class Pacer {

    private final Sleeper sleeper;
    private final Random random;

    public Pacer(Sleeper sleeper, Random random) {
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * Lazy iterator over {@code items}: the first element is returned at once, every later
     * element only after a random pause in {@code [minDelayMs, maxDelayMs]}. The pause happens
     * inside {@link Iterator#next()}, on the consuming thread.
     *
     * @throws CancellationException from {@code next()} if the thread is interrupted while pausing
     */
    public <T> Iterator<T> pace(List<T> items, long minDelayMs, long maxDelayMs) {
        validateBounds(minDelayMs, maxDelayMs);
        List<T> snapshot = List.copyOf(items);

        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < snapshot.size();
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                if (index > 0) {
                    pause(nextDelayMillis(minDelayMs, maxDelayMs));
                }
                return snapshot.get(index++);
            }
        };
    }

    /**
     * Single random pause, used before each individual registrar query.
     */
    public void jitter(long minDelayMs, long maxDelayMs) {
        validateBounds(minDelayMs, maxDelayMs);
        pause(nextDelayMillis(minDelayMs, maxDelayMs));
    }

    public long nextDelayMillis(long minDelayMs, long maxDelayMs) {
        validateBounds(minDelayMs, maxDelayMs);
        if (minDelayMs == maxDelayMs) {
            return minDelayMs;
        }
        return random.nextLong(minDelayMs, maxDelayMs + 1);
    }

    private void pause(long millis) {
        log.trace("Pacing for {}ms", millis);
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while pacing");
        }
    }

    private static void validateBounds(long minDelayMs, long maxDelayMs) {
        if (minDelayMs < 0 || maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException(
                    "Invalid pacing bounds [" + minDelayMs + ", " + maxDelayMs + "]");
        }
    }
}
