package com.phillippitts.gatesentry.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Complete conversational state of one gate session.
 *
 * <p>Not thread-safe. The authoritative instance lives in the session store and is only mutated under
 * the store's lock; turns work on a {@link #copy()} and hand it back for commit.
 *
 * <p>The first message of the log is always the system preamble.
 */
public final class SessionState {

    private final String sessionId;
    private final ConversationMessage preamble;
    private final Instant createdAt;
    private final List<ConversationMessage> messages = new ArrayList<>();
    private VisitorProfile profile = new VisitorProfile();
    private Decision decision = Decision.NONE;
    private double decisionConfidence;
    private String decisionReasoning;
    private VisionSchema visionSchema;
    private String userInput = "";
    private boolean invalidInput;
    private boolean sessionActive = true;
    private String cameraId;
    private long visionRevision;
    private long resetEpoch;

    public SessionState(String sessionId, String preamble) {
        this(sessionId, ConversationMessage.system(preamble), Instant.now());
    }

    private SessionState(String sessionId, ConversationMessage preamble, Instant createdAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.preamble = Objects.requireNonNull(preamble, "preamble");
        this.createdAt = createdAt;
        this.messages.add(preamble);
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public ConversationMessage getPreamble() {
        return preamble;
    }

    public List<ConversationMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public void append(ConversationMessage message) {
        messages.add(Objects.requireNonNull(message, "message"));
    }

    /** Replaces the whole log; the first entry must be the preamble. */
    public void replaceMessages(List<ConversationMessage> replacement) {
        if (replacement.isEmpty() || !replacement.get(0).equals(preamble)) {
            throw new IllegalArgumentException("Message log must start with the system preamble");
        }
        messages.clear();
        messages.addAll(replacement);
    }

    public long countMessages(MessageRole role) {
        return messages.stream().filter(m -> m.role() == role).count();
    }

    /** Last message of the log, never null (the preamble at minimum). */
    public ConversationMessage lastMessage() {
        return messages.get(messages.size() - 1);
    }

    /**
     * Clears visitor-specific state and truncates the log to the preamble followed by {@code keep}.
     *
     * @param keep message to retain after the preamble, or {@code null} for preamble only
     */
    public void resetVisitor(ConversationMessage keep) {
        messages.clear();
        messages.add(preamble);
        if (keep != null && !keep.equals(preamble)) {
            messages.add(keep);
        }
        profile.reset();
        clearDecision();
    }

    /** Full reset after a decision cycle: profile, decision and vision verdict cleared, log truncated. */
    public void resetForNextVisitor() {
        resetVisitor(null);
        visionSchema = null;
        invalidInput = false;
        userInput = "";
    }

    public void clearDecision() {
        decision = Decision.NONE;
        decisionConfidence = 0.0;
        decisionReasoning = null;
    }

    public VisitorProfile getProfile() {
        return profile;
    }

    public Decision getDecision() {
        return decision;
    }

    public void recordDecision(Decision decision, double confidence, String reasoning) {
        this.decision = Objects.requireNonNull(decision, "decision");
        this.decisionConfidence = confidence;
        this.decisionReasoning = reasoning;
    }

    public double getDecisionConfidence() {
        return decisionConfidence;
    }

    public String getDecisionReasoning() {
        return decisionReasoning;
    }

    public VisionSchema getVisionSchema() {
        return visionSchema;
    }

    public void setVisionSchema(VisionSchema visionSchema) {
        this.visionSchema = visionSchema;
    }

    public boolean isHighThreat() {
        return visionSchema != null && visionSchema.isHighThreat();
    }

    public String getUserInput() {
        return userInput;
    }

    public void setUserInput(String userInput) {
        this.userInput = userInput == null ? "" : userInput;
    }

    public boolean isInvalidInput() {
        return invalidInput;
    }

    public void setInvalidInput(boolean invalidInput) {
        this.invalidInput = invalidInput;
    }

    public boolean isSessionActive() {
        return sessionActive;
    }

    public void setSessionActive(boolean sessionActive) {
        this.sessionActive = sessionActive;
    }

    public String getCameraId() {
        return cameraId;
    }

    public void setCameraId(String cameraId) {
        this.cameraId = cameraId;
    }

    /** Incremented by every bridge-applied vision/activation update. */
    public long getVisionRevision() {
        return visionRevision;
    }

    public void bumpVisionRevision() {
        visionRevision++;
    }

    /** Incremented whenever the bridge resets the session on a deactivation edge. */
    public long getResetEpoch() {
        return resetEpoch;
    }

    public void bumpResetEpoch() {
        resetEpoch++;
    }

    /** Deep copy suitable for running a turn outside the store lock. */
    public SessionState copy() {
        SessionState c = new SessionState(sessionId, preamble, createdAt);
        c.messages.clear();
        c.messages.addAll(messages);
        c.profile = profile.copy();
        c.decision = decision;
        c.decisionConfidence = decisionConfidence;
        c.decisionReasoning = decisionReasoning;
        c.visionSchema = visionSchema;
        c.userInput = userInput;
        c.invalidInput = invalidInput;
        c.sessionActive = sessionActive;
        c.cameraId = cameraId;
        c.visionRevision = visionRevision;
        c.resetEpoch = resetEpoch;
        return c;
    }
}
