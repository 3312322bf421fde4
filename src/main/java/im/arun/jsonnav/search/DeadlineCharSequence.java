package im.arun.jsonnav.search;

/**
 * Char sequence that aborts a regex match once a deadline passes. The clock
 * is read every few hundred character accesses.
 */
final class DeadlineCharSequence implements CharSequence {
    private static final int CHECK_INTERVAL = 256;

    private final CharSequence delegate;
    private final long deadlineNanos;
    private final long timeoutMillis;
    private int accesses;

    DeadlineCharSequence(CharSequence delegate, long deadlineNanos, long timeoutMillis) {
        this.delegate = delegate;
        this.deadlineNanos = deadlineNanos;
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public char charAt(int index) {
        if (++accesses % CHECK_INTERVAL == 0) {
            checkDeadline(deadlineNanos, timeoutMillis);
        }
        return delegate.charAt(index);
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return new DeadlineCharSequence(delegate.subSequence(start, end), deadlineNanos, timeoutMillis);
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    static void checkDeadline(long deadlineNanos, long timeoutMillis) {
        if (System.nanoTime() - deadlineNanos > 0) {
            throw new SearchTimeoutException(timeoutMillis);
        }
    }
}
