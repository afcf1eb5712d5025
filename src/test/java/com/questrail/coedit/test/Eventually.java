package com.questrail.coedit.test;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Polls a condition until it holds or a deadline passes.
 */
public final class Eventually {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private Eventually() {}

    public static void await(String description, BooleanSupplier condition) {
        await(description, condition, DEFAULT_TIMEOUT);
    }

    public static void await(String description, BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out after " + timeout.toMillis() + " ms waiting for: " + description);
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting for: " + description);
            }
        }
    }
}
