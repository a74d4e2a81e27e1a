package com.starscape.imagepipeline.common.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the image pipeline.
 * Binds to app.pipeline.* properties from application.yml.
 *
 * The mail addresses and region are mandatory: a missing value fails context startup
 * rather than surfacing later as a delivery error.
 */
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    @Valid
    private Images images = new Images();

    @Valid
    private Queue queue = new Queue();

    @Valid
    private ChangeStream changeStream = new ChangeStream();

    @Valid
    private Mail mail = new Mail();

    public Images getImages() {
        return images;
    }

    public void setImages(Images images) {
        this.images = images;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public ChangeStream getChangeStream() {
        return changeStream;
    }

    public void setChangeStream(ChangeStream changeStream) {
        this.changeStream = changeStream;
    }

    public Mail getMail() {
        return mail;
    }

    public void setMail(Mail mail) {
        this.mail = mail;
    }

    public static class Images {

        @NotEmpty
        private List<String> allowedSuffixes = new ArrayList<>(List.of(".jpeg", ".png"));

        /**
         * Largest object the blob store will read into memory.
         */
        @NotNull
        private DataSize maxObjectSize = DataSize.ofMegabytes(50);

        public DataSize getMaxObjectSize() {
            return maxObjectSize;
        }

        public void setMaxObjectSize(DataSize maxObjectSize) {
            this.maxObjectSize = maxObjectSize;
        }

        public List<String> getAllowedSuffixes() {
            return allowedSuffixes;
        }

        public void setAllowedSuffixes(List<String> allowedSuffixes) {
            this.allowedSuffixes = allowedSuffixes;
        }

        /**
         * Check if an object key carries one of the allowed image suffixes.
         * The comparison is case-sensitive, matching the object store's own key semantics.
         * @param objectKey The decoded object key
         * @return true if the key ends with an allowed suffix
         */
        public boolean isAllowedImageKey(String objectKey) {
            if (objectKey == null || allowedSuffixes == null) {
                return false;
            }
            return allowedSuffixes.stream().anyMatch(objectKey::endsWith);
        }
    }

    public static class Queue {

        @NotNull
        private QueueMode mode = QueueMode.IN_MEMORY;

        @Min(1)
        private int batchSize = 5;

        @NotNull
        private Duration maxBatchingWindow = Duration.ofSeconds(10);

        @Min(0)
        private int retryBudget = 1;

        @NotNull
        private Duration visibilityTimeout = Duration.ofSeconds(30);

        private String imageProcessQueueUrl;

        private String rejectionQueueUrl;

        public QueueMode getMode() {
            return mode;
        }

        public void setMode(QueueMode mode) {
            this.mode = mode;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getMaxBatchingWindow() {
            return maxBatchingWindow;
        }

        public void setMaxBatchingWindow(Duration maxBatchingWindow) {
            this.maxBatchingWindow = maxBatchingWindow;
        }

        public int getRetryBudget() {
            return retryBudget;
        }

        public void setRetryBudget(int retryBudget) {
            this.retryBudget = retryBudget;
        }

        public Duration getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public String getImageProcessQueueUrl() {
            return imageProcessQueueUrl;
        }

        public void setImageProcessQueueUrl(String imageProcessQueueUrl) {
            this.imageProcessQueueUrl = imageProcessQueueUrl;
        }

        public String getRejectionQueueUrl() {
            return rejectionQueueUrl;
        }

        public void setRejectionQueueUrl(String rejectionQueueUrl) {
            this.rejectionQueueUrl = rejectionQueueUrl;
        }
    }

    public enum QueueMode {
        IN_MEMORY,
        SQS
    }

    public static class ChangeStream {

        @Min(1)
        private int batchSize = 5;

        @Min(1)
        private int maxRecordAttempts = 2;

        @NotBlank
        private String consumerName = "deletion-mailer";

        /**
         * How long a hole in the change-log sequence is assumed to be an uncommitted write.
         * After that the missing sequence is treated as rolled back and skipped.
         */
        @NotNull
        private Duration gapGracePeriod = Duration.ofSeconds(30);

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxRecordAttempts() {
            return maxRecordAttempts;
        }

        public void setMaxRecordAttempts(int maxRecordAttempts) {
            this.maxRecordAttempts = maxRecordAttempts;
        }

        public String getConsumerName() {
            return consumerName;
        }

        public void setConsumerName(String consumerName) {
            this.consumerName = consumerName;
        }

        public Duration getGapGracePeriod() {
            return gapGracePeriod;
        }

        public void setGapGracePeriod(Duration gapGracePeriod) {
            this.gapGracePeriod = gapGracePeriod;
        }
    }

    public static class Mail {

        @NotBlank
        private String from;

        @NotBlank
        private String to;

        @NotBlank
        private String region;

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getTo() {
            return to;
        }

        public void setTo(String to) {
            this.to = to;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }
    }
}
