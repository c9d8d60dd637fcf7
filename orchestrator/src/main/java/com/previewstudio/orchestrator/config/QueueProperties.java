package com.previewstudio.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Durable queue behaviour ({@code preview.queue.*}).
 *
 * Scheduling intervals (dispatch, lock renewal, stall check, cleanup) are
 * read directly by the @Scheduled annotations in QueueScheduler and
 * JobHousekeeping; everything else is read here.
 */
@ConfigurationProperties(prefix = "preview.queue")
public class QueueProperties {

    private String   name          = "preview-jobs";

    // Preview jobs are not retried automatically; the user retries manually.
    private int      attempts      = 1;
    private Duration backoffDelay  = Duration.ofSeconds(5);

    // Renders can take a long time, so the lock is generous.
    private Duration lockDuration  = Duration.ofMinutes(10);

    // A job that stalls more often than this is failed instead of re-dispatched.
    private int      maxStalledCount = 1;

    private final Retention removeOnComplete = new Retention(100, Duration.ofHours(24));
    private final Retention removeOnFail     = new Retention(50,  Duration.ofDays(7));

    public String   getName()                       { return name; }
    public void     setName(String name)            { this.name = name; }
    public int      getAttempts()                   { return attempts; }
    public void     setAttempts(int attempts)       { this.attempts = attempts; }
    public Duration getBackoffDelay()               { return backoffDelay; }
    public void     setBackoffDelay(Duration d)     { this.backoffDelay = d; }
    public Duration getLockDuration()               { return lockDuration; }
    public void     setLockDuration(Duration d)     { this.lockDuration = d; }
    public int      getMaxStalledCount()            { return maxStalledCount; }
    public void     setMaxStalledCount(int n)       { this.maxStalledCount = n; }
    public Retention getRemoveOnComplete()          { return removeOnComplete; }
    public Retention getRemoveOnFail()              { return removeOnFail; }

    /**
     * Keep at most {@code count} entries, none older than {@code age}.
     */
    public static class Retention {
        private int      count;
        private Duration age;

        public Retention() {}

        public Retention(int count, Duration age) {
            this.count = count;
            this.age   = age;
        }

        public int      getCount()              { return count; }
        public void     setCount(int count)     { this.count = count; }
        public Duration getAge()                { return age; }
        public void     setAge(Duration age)    { this.age = age; }
    }
}
