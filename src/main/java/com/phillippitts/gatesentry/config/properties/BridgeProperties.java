package com.phillippitts.gatesentry.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the state bridge and the gate event queue drained by the event loop.
 */
@Validated
@ConfigurationProperties(prefix = "gate.bridge")
public class BridgeProperties {

    @Min(1)
    private int queueCapacity = 50;

    /** Delay between event-loop cycles in milliseconds. */
    @Min(10)
    private long pollIntervalMs = 50;

    /** Maximum state updates applied per event-loop cycle. */
    @Min(1)
    private int batchSize = 10;

    /** Attempts before a failing update is dropped. */
    @Min(1)
    private int maxAttempts = 3;

    @Min(1)
    private int eventQueueCapacity = 20;

    /** Maximum gate events dispatched per event-loop cycle. */
    @Min(1)
    private int eventBatchSize = 5;

    /** Outbox entries retained per session. */
    @Min(1)
    private int outboxCapacity = 50;

    /** Agent line sent when a session becomes active. */
    @NotBlank
    private String greeting = "Hello there! Please tell me who you are and why you are here.";

    /** Agent line sent when a session goes inactive. */
    @NotBlank
    private String farewell = "No one is in front of the camera. See you next time.";

    /** Synthetic visitor line used to run a turn after a threat escalation. */
    @NotBlank
    private String escalationMessage = "I am here to visit someone";

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getEventQueueCapacity() {
        return eventQueueCapacity;
    }

    public void setEventQueueCapacity(int eventQueueCapacity) {
        this.eventQueueCapacity = eventQueueCapacity;
    }

    public int getEventBatchSize() {
        return eventBatchSize;
    }

    public void setEventBatchSize(int eventBatchSize) {
        this.eventBatchSize = eventBatchSize;
    }

    public int getOutboxCapacity() {
        return outboxCapacity;
    }

    public void setOutboxCapacity(int outboxCapacity) {
        this.outboxCapacity = outboxCapacity;
    }

    public String getGreeting() {
        return greeting;
    }

    public void setGreeting(String greeting) {
        this.greeting = greeting;
    }

    public String getFarewell() {
        return farewell;
    }

    public void setFarewell(String farewell) {
        this.farewell = farewell;
    }

    public String getEscalationMessage() {
        return escalationMessage;
    }

    public void setEscalationMessage(String escalationMessage) {
        this.escalationMessage = escalationMessage;
    }
}
