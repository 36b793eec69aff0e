package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.service.decision.DecisionResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Working data of one conversation turn.
 *
 * <p>Steps write their results here; {@link GateTransitions} reads them to pick the next state.
 * Confined to the thread running the turn.
 */
public final class TurnContext {

    private final SessionState state;
    private final String input;
    private final List<String> replies = new ArrayList<>();
    private final List<GateState> path = new ArrayList<>();
    private Route route = Route.EXTRACT;
    private boolean complete;
    private String contactCandidate;
    private DecisionResult decision;
    private boolean notifyRequired;
    private boolean profileReset;
    private boolean sessionComplete;

    public TurnContext(SessionState state, String input) {
        this.state = Objects.requireNonNull(state, "state");
        this.input = input == null ? "" : input;
    }

    public SessionState state() {
        return state;
    }

    public String input() {
        return input;
    }

    public void reply(String text) {
        replies.add(text);
    }

    public List<String> replies() {
        return Collections.unmodifiableList(replies);
    }

    void visit(GateState s) {
        path.add(s);
    }

    /** States executed this turn, in order. */
    public List<GateState> path() {
        return Collections.unmodifiableList(path);
    }

    public Route route() {
        return route;
    }

    public void setRoute(Route route) {
        this.route = route;
    }

    public boolean isComplete() {
        return complete;
    }

    public void setComplete(boolean complete) {
        this.complete = complete;
    }

    /** Contact name as extracted, before directory validation. */
    public String contactCandidate() {
        return contactCandidate;
    }

    public void setContactCandidate(String contactCandidate) {
        this.contactCandidate = contactCandidate;
    }

    public DecisionResult decision() {
        return decision;
    }

    public void setDecision(DecisionResult decision) {
        this.decision = decision;
    }

    public boolean isNotifyRequired() {
        return notifyRequired;
    }

    public void setNotifyRequired(boolean notifyRequired) {
        this.notifyRequired = notifyRequired;
    }

    public boolean isProfileReset() {
        return profileReset;
    }

    public void markProfileReset() {
        this.profileReset = true;
    }

    /** True once a decision cycle finished and the session was reset for the next visitor. */
    public boolean isSessionComplete() {
        return sessionComplete;
    }

    public void markSessionComplete() {
        this.sessionComplete = true;
    }
}
