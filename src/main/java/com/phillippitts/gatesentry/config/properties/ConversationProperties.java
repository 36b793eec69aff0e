package com.phillippitts.gatesentry.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the conversation state machine and history compaction.
 */
@Validated
@ConfigurationProperties(prefix = "gate.conversation")
public class ConversationProperties {

    public enum HistoryMode { SUMMARIZE, SHORTEN }

    /** System preamble placed at the head of every session log. */
    @NotBlank
    private String preamble = "You are a helpful assistant at the gate. Ask necessary questions and decide on access.";

    /** Human messages allowed before the history is compacted. */
    @Min(1)
    private int maxHumanMessages = 10;

    @NotNull
    private HistoryMode historyMode = HistoryMode.SUMMARIZE;

    /** Upper bound on state transitions in a single turn. */
    @Min(10)
    private int maxSteps = 100;

    /** Recent messages handed to the decision classifier. */
    @Min(1)
    private int decisionContextMessages = 10;

    /** Recent messages handed to new-visitor detection. */
    @Min(1)
    private int detectionContextMessages = 6;

    @Valid
    private Compaction compaction = new Compaction();

    public String getPreamble() {
        return preamble;
    }

    public void setPreamble(String preamble) {
        this.preamble = preamble;
    }

    public int getMaxHumanMessages() {
        return maxHumanMessages;
    }

    public void setMaxHumanMessages(int maxHumanMessages) {
        this.maxHumanMessages = maxHumanMessages;
    }

    public HistoryMode getHistoryMode() {
        return historyMode;
    }

    public void setHistoryMode(HistoryMode historyMode) {
        this.historyMode = historyMode;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(int maxSteps) {
        this.maxSteps = maxSteps;
    }

    public int getDecisionContextMessages() {
        return decisionContextMessages;
    }

    public void setDecisionContextMessages(int decisionContextMessages) {
        this.decisionContextMessages = decisionContextMessages;
    }

    public int getDetectionContextMessages() {
        return detectionContextMessages;
    }

    public void setDetectionContextMessages(int detectionContextMessages) {
        this.detectionContextMessages = detectionContextMessages;
    }

    public Compaction getCompaction() {
        return compaction;
    }

    public void setCompaction(Compaction compaction) {
        this.compaction = compaction;
    }

    /**
     * History compaction thresholds shared by both strategies.
     */
    public static class Compaction {
        /** Logs shorter than this are never compacted. */
        @Min(2)
        private int minMessages = 8;
        /** Recent messages kept by the SHORTEN strategy. */
        @Min(1)
        private int shortenKeep = 5;
        /** Recent messages kept intact by the SUMMARIZE strategy. */
        @Min(1)
        private int summarizeKeep = 4;

        public int getMinMessages() {
            return minMessages;
        }

        public void setMinMessages(int minMessages) {
            this.minMessages = minMessages;
        }

        public int getShortenKeep() {
            return shortenKeep;
        }

        public void setShortenKeep(int shortenKeep) {
            this.shortenKeep = shortenKeep;
        }

        public int getSummarizeKeep() {
            return summarizeKeep;
        }

        public void setSummarizeKeep(int summarizeKeep) {
            this.summarizeKeep = summarizeKeep;
        }

        /**
         * A compacted log is preamble + marker + kept tail, so the tail must leave at least one message
         * to drop at the threshold.
         */
        @AssertTrue(message = "shorten-keep and summarize-keep must be at most min-messages - 3")
        public boolean isKeepBelowThreshold() {
            return shortenKeep <= minMessages - 3 && summarizeKeep <= minMessages - 3;
        }
    }
}
