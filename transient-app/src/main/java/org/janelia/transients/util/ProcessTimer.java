package org.janelia.transients.util;

/**
 * Tracks elapsed time for batch stages and units of work.
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    @Override
    public String toString() {
        final long elapsedMilliseconds = getElapsedMilliseconds();
        if (elapsedMilliseconds < 1000) {
            return elapsedMilliseconds + " milliseconds";
        }
        final long totalSeconds = elapsedMilliseconds / 1000;
        final long totalMinutes = totalSeconds / 60;
        final long hours = totalMinutes / 60;
        final long minutes = totalMinutes % 60;
        final long seconds = totalSeconds % 60;
        return hours + " hours, " + minutes + " minutes, " + seconds + " seconds";
    }
}
