package com.mimecast.leveler.leveling;

/**
 * One processing outcome.
 */
public final class ProcessingSample {

    private final long timestamp;
    private final long durationMillis;
    private final boolean success;

    /**
     * Constructs a new ProcessingSample instance.
     *
     * @param timestamp      Record time in epoch millis.
     * @param durationMillis Processing time in millis.
     * @param success        Outcome.
     */
    public ProcessingSample(long timestamp, long durationMillis, boolean success) {
        this.timestamp = timestamp;
        this.durationMillis = durationMillis;
        this.success = success;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public boolean isSuccess() {
        return success;
    }
}
