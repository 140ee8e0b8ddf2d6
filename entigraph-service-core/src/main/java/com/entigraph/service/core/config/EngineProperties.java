package com.entigraph.service.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "entigraph")
public class EngineProperties {
    private Synthesis synthesis = new Synthesis();
    private Relationships relationships = new Relationships();
    private Pipeline pipeline = new Pipeline();
    private Expiry expiry = new Expiry();
    private Ingest ingest = new Ingest();

    public Synthesis getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(Synthesis synthesis) {
        this.synthesis = synthesis;
    }

    public Relationships getRelationships() {
        return relationships;
    }

    public void setRelationships(Relationships relationships) {
        this.relationships = relationships;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Expiry getExpiry() {
        return expiry;
    }

    public void setExpiry(Expiry expiry) {
        this.expiry = expiry;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public static class Synthesis {
        private Duration defaultEntityExpiration = Duration.ofHours(8);
        private String accountAttribute = "accountId";
        private String eventTypeAttribute = "eventType";

        public Duration getDefaultEntityExpiration() {
            return defaultEntityExpiration;
        }

        public void setDefaultEntityExpiration(Duration defaultEntityExpiration) {
            this.defaultEntityExpiration = defaultEntityExpiration;
        }

        public String getAccountAttribute() {
            return accountAttribute;
        }

        public void setAccountAttribute(String accountAttribute) {
            this.accountAttribute = accountAttribute;
        }

        public String getEventTypeAttribute() {
            return eventTypeAttribute;
        }

        public void setEventTypeAttribute(String eventTypeAttribute) {
            this.eventTypeAttribute = eventTypeAttribute;
        }
    }

    public static class Relationships {
        private String originAttribute = "instrumentation.provider";

        public String getOriginAttribute() {
            return originAttribute;
        }

        public void setOriginAttribute(String originAttribute) {
            this.originAttribute = originAttribute;
        }
    }

    public static class Pipeline {
        private int workers = 4;
        private int queueCapacity = 10000;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        /** How long {@code submit} waits for queue space before rejecting an event. */
        private Duration submitTimeout = Duration.ofSeconds(1);
        private StoreRetry storeRetry = new StoreRetry();

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public Duration getSubmitTimeout() {
            return submitTimeout;
        }

        public void setSubmitTimeout(Duration submitTimeout) {
            this.submitTimeout = submitTimeout;
        }

        public StoreRetry getStoreRetry() {
            return storeRetry;
        }

        public void setStoreRetry(StoreRetry storeRetry) {
            this.storeRetry = storeRetry;
        }
    }

    public static class StoreRetry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(100);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }
    }

    public static class Expiry {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Ingest {
        private Kafka kafka = new Kafka();

        public Kafka getKafka() {
            return kafka;
        }

        public void setKafka(Kafka kafka) {
            this.kafka = kafka;
        }
    }

    /** Kafka consumer settings; the listener is only registered when {@code enabled} is true. */
    public static class Kafka {
        private boolean enabled;
        private String bootstrapServers = "localhost:9092";
        private String topic = "entigraph.telemetry";
        private String groupId = "entigraph-ingest";
        private int concurrency = 1;
        private int maxPollRecords = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxPollRecords() {
            return maxPollRecords;
        }

        public void setMaxPollRecords(int maxPollRecords) {
            this.maxPollRecords = maxPollRecords;
        }
    }
}
