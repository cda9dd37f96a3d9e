package com.mimecast.leveler.leveling;

import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rolling metrics for one queue.
 * <p>Samples are kept oldest first and bounded to {@code maxSamples}; older samples are dropped on insert.
 */
public class QueueMetrics {

    private final int maxSamples;
    private final Deque<ProcessingSample> samples = new ConcurrentLinkedDeque<>();
    private final AtomicInteger sampleCount = new AtomicInteger();
    private final AtomicInteger currentLoad = new AtomicInteger();
    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong backlog = new AtomicLong();
    private final AtomicLong lastActivity;

    /**
     * Constructs a new QueueMetrics instance.
     *
     * @param maxSamples Sample bound.
     * @param now        Creation time in epoch millis.
     */
    public QueueMetrics(int maxSamples, long now) {
        this.maxSamples = maxSamples;
        this.lastActivity = new AtomicLong(now);
    }

    /**
     * Append a sample.
     *
     * @param sample Sample.
     */
    void addSample(ProcessingSample sample) {
        samples.addLast(sample);
        if (sample.isSuccess()) {
            successCount.incrementAndGet();
        } else {
            errorCount.incrementAndGet();
        }
        touch(sample.getTimestamp());

        if (sampleCount.incrementAndGet() > maxSamples && samples.pollFirst() != null) {
            sampleCount.decrementAndGet();
        }
    }

    /**
     * Drop samples recorded before the cutoff.
     *
     * @param cutoff Epoch millis.
     * @return Number of dropped samples.
     */
    int evictBefore(long cutoff) {
        int evicted = 0;
        Iterator<ProcessingSample> iterator = samples.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getTimestamp() < cutoff) {
                iterator.remove();
                sampleCount.decrementAndGet();
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * Error rate over samples recorded at or after the window start.
     *
     * @param windowStart Epoch millis.
     * @return Rate between 0 and 1, 0 without samples.
     */
    public double getErrorRate(long windowStart) {
        int total = 0;
        int errors = 0;
        for (ProcessingSample sample : samples) {
            if (sample.getTimestamp() >= windowStart) {
                total++;
                if (!sample.isSuccess()) {
                    errors++;
                }
            }
        }
        return total == 0 ? 0.0 : (double) errors / total;
    }

    /**
     * Average processing time over samples recorded at or after the window start.
     *
     * @param windowStart Epoch millis.
     * @return Millis, 0 without samples.
     */
    public double getAverageProcessingMillis(long windowStart) {
        int total = 0;
        long sum = 0;
        for (ProcessingSample sample : samples) {
            if (sample.getTimestamp() >= windowStart) {
                total++;
                sum += sample.getDurationMillis();
            }
        }
        return total == 0 ? 0.0 : (double) sum / total;
    }

    void touch(long now) {
        lastActivity.accumulateAndGet(now, Math::max);
    }

    void setCurrentLoad(int load) {
        currentLoad.set(load);
    }

    void setBacklog(long value) {
        backlog.set(value);
    }

    public int getCurrentLoad() {
        return currentLoad.get();
    }

    public long getSuccessCount() {
        return successCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    public long getBacklog() {
        return backlog.get();
    }

    public long getLastActivity() {
        return lastActivity.get();
    }

    public int getSampleCount() {
        return sampleCount.get();
    }
}
