package org.janelia.diffraction.util;

/**
 * Utility to track progress of a fixed amount of work.
 * Callers check {@link #hasIntervalPassed()} to throttle progress log statements.
 *
 * @author Eric Trautman
 */
public class ProgressTimer {

    public static final long DEFAULT_INTERVAL = 5000;

    private final long totalCount;
    private final long interval;
    private final long start;
    private long lastIntervalStart;

    /**
     * Timer for a process without a known amount of work (only elapsed time is meaningful).
     */
    public ProgressTimer() {
        this(0);
    }

    public ProgressTimer(final long totalCount) {
        this(totalCount, DEFAULT_INTERVAL);
    }

    public ProgressTimer(final long totalCount,
                         final long interval) {
        this.totalCount = totalCount;
        this.interval = interval;
        this.start = System.currentTimeMillis();
        this.lastIntervalStart = this.start;
    }

    public boolean hasIntervalPassed() {
        final boolean hasPassed = ((System.currentTimeMillis() - lastIntervalStart) > interval);
        if (hasPassed) {
            lastIntervalStart = System.currentTimeMillis();
        }
        return hasPassed;
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    /**
     * @return estimated seconds until all work is done based upon the average rate so far,
     *         or -1 if nothing has been completed yet.
     */
    public long getEstimatedRemainingSeconds(final long completedCount) {
        if (completedCount <= 0) {
            return -1;
        }
        final double millisPerItem = getElapsedMilliseconds() / (double) completedCount;
        return Math.round(millisPerItem * (totalCount - completedCount) / 1000.0);
    }

    /**
     * @return progress summary like "12 of 40 (30%), about 95 seconds remaining".
     */
    public String getProgress(final long completedCount) {
        final long percent = totalCount > 0 ? (100 * completedCount) / totalCount : 100;
        final long remaining = getEstimatedRemainingSeconds(completedCount);
        final String eta = remaining < 0 ? "remaining time unknown" : "about " + remaining + " seconds remaining";
        return completedCount + " of " + totalCount + " (" + percent + "%), " + eta;
    }

    @Override
    public String toString() {
        final long totalSeconds = getElapsedMilliseconds() / 1000;
        final long totalMinutes = totalSeconds / 60;
        final long hours = totalMinutes / 60;
        final long minutes = totalMinutes % 60;
        final long seconds = totalSeconds % 60;
        return hours + " hours, " + minutes + " minutes, " + seconds + " seconds";
    }
}
