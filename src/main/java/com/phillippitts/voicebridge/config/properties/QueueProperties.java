package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Kafka scale-out path. Disabled by default; when disabled every segment is dispatched
 * in-process.
 */
@ConfigurationProperties(prefix = "voicebridge.queue")
@Validated
public class QueueProperties {

    private boolean enabled = false;

    @NotBlank
    private String segmentsTopic = "audio.segments";

    @NotBlank
    private String resultsTopic = "transcription.results";

    /** Consumer group shared by dispatch workers. */
    @NotBlank
    private String workerGroup = "voicebridge-transcription-group";

    /** Prefix of the per-instance results consumer group. */
    @NotBlank
    private String resultsGroupPrefix = "voicebridge-results";

    @Positive
    private int partitions = 6;

    /** Wait before the broker is probed again after a failed publish, in ms. */
    @Positive
    private long retryIntervalMs = 30_000;

    /** Delivery keys remembered for duplicate suppression. */
    @Positive
    private int dedupCapacity = 10_000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSegmentsTopic() {
        return segmentsTopic;
    }

    public void setSegmentsTopic(String segmentsTopic) {
        this.segmentsTopic = segmentsTopic;
    }

    public String getResultsTopic() {
        return resultsTopic;
    }

    public void setResultsTopic(String resultsTopic) {
        this.resultsTopic = resultsTopic;
    }

    public String getWorkerGroup() {
        return workerGroup;
    }

    public void setWorkerGroup(String workerGroup) {
        this.workerGroup = workerGroup;
    }

    public String getResultsGroupPrefix() {
        return resultsGroupPrefix;
    }

    public void setResultsGroupPrefix(String resultsGroupPrefix) {
        this.resultsGroupPrefix = resultsGroupPrefix;
    }

    public int getPartitions() {
        return partitions;
    }

    public void setPartitions(int partitions) {
        this.partitions = partitions;
    }

    public long getRetryIntervalMs() {
        return retryIntervalMs;
    }

    public void setRetryIntervalMs(long retryIntervalMs) {
        this.retryIntervalMs = retryIntervalMs;
    }

    public int getDedupCapacity() {
        return dedupCapacity;
    }

    public void setDedupCapacity(int dedupCapacity) {
        this.dedupCapacity = dedupCapacity;
    }
}
