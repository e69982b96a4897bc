package com.smartlists.ruleengine.runtime.operators;

import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Regex matching with a wall-clock budget per match.
 *
 * <p>{@link java.util.regex} has no timeout, so the input is wrapped in a
 * {@link CharSequence} that checks a deadline while the matcher reads it.
 * Catastrophic backtracking keeps reading characters, so it trips the deadline.
 */
public final class BoundedRegex {

    private BoundedRegex() {
    }

    /**
     * @return whether {@code pattern} is found anywhere in {@code input}
     * @throws RegexTimeoutException if matching takes longer than {@code timeoutMillis}
     */
    public static boolean find(Pattern pattern, String input, long timeoutMillis) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        return pattern.matcher(new DeadlineCharSequence(input, deadline, pattern.pattern())).find();
    }

    /**
     * Raised when a match exceeds its budget.
     */
    public static final class RegexTimeoutException extends RuntimeException {
        RegexTimeoutException(String pattern) {
            super("Regex match timed out: " + pattern);
        }
    }

    private static final class DeadlineCharSequence implements CharSequence {
        // nanoTime is not free; check the clock every few hundred reads.
        private static final int CHECK_INTERVAL = 256;

        private final CharSequence inner;
        private final long deadline;
        private final String pattern;
        private int reads;

        DeadlineCharSequence(CharSequence inner, long deadline, String pattern) {
            this.inner = inner;
            this.deadline = deadline;
            this.pattern = pattern;
        }

        @Override
        public char charAt(int index) {
            if (++reads % CHECK_INTERVAL == 0 && System.nanoTime() > deadline) {
                throw new RegexTimeoutException(pattern);
            }
            return inner.charAt(index);
        }

        @Override
        public int length() {
            return inner.length();
        }

        @Override
        public CharSequence subSequence(int start, int end) {
            return new DeadlineCharSequence(inner.subSequence(start, end), deadline, pattern);
        }

        @Override
        public String toString() {
            return inner.toString();
        }
    }
}
