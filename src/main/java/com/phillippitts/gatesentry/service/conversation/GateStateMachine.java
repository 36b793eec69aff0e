package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.config.properties.ConversationProperties;
import com.phillippitts.gatesentry.domain.ConversationMessage;
import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.service.compaction.HistoryCompactor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Driver loop of the conversation machine: executes the current state's step, then asks
 * {@link GateTransitions} for the next state, until {@link GateState#END}.
 *
 * <p>Steps handle collaborator failures themselves. Anything else escaping a step ends the turn with
 * an apology; the loop also stops after a fixed number of steps.
 */
@Component
public class GateStateMachine {

    private static final Logger LOG = LogManager.getLogger(GateStateMachine.class);

    static final String ERROR_REPLY = "Sorry, something went wrong on my side. Please try again.";

    private final InputScreening screening;
    private final TurnRouter router;
    private final HistoryCompactor compactor;
    private final ProfileExtractor extractor;
    private final IntakeQuestions questions;
    private final DecisionCycle decisions;
    private final int maxSteps;

    public GateStateMachine(InputScreening screening, TurnRouter router, HistoryCompactor compactor,
                            ProfileExtractor extractor, IntakeQuestions questions, DecisionCycle decisions,
                            ConversationProperties props) {
        this.screening = screening;
        this.router = router;
        this.compactor = compactor;
        this.extractor = extractor;
        this.questions = questions;
        this.decisions = decisions;
        this.maxSteps = props.getMaxSteps();
    }

    /** Runs one turn to completion. Never throws. */
    public void run(TurnContext ctx) {
        GateState current = GateState.RECEIVE_INPUT;
        int steps = 0;
        while (current != GateState.END) {
            if (++steps > maxSteps) {
                LOG.error("Turn exceeded {} steps at {}; ending turn", maxSteps, current);
                ctx.reply(ERROR_REPLY);
                break;
            }
            ctx.visit(current);
            try {
                execute(current, ctx);
            } catch (RuntimeException e) {
                LOG.error("Step {} failed; ending turn", current, e);
                ctx.reply(ERROR_REPLY);
                break;
            }
            current = GateTransitions.next(current, ctx);
        }
        ctx.visit(GateState.END);
    }

    private void execute(GateState state, TurnContext ctx) {
        switch (state) {
            case RECEIVE_INPUT -> screening.receive(ctx);
            case VALIDATE -> screening.validate(ctx);
            case ROUTE_AFTER_INPUT -> router.route(ctx);
            case RESET -> router.reset(ctx);
            case COMPACT -> compact(ctx.state());
            case EXTRACT_PROFILE -> extractor.extract(ctx);
            case VALIDATE_CONTACT -> extractor.validateContact(ctx);
            case CHECK_COMPLETENESS -> questions.checkCompleteness(ctx);
            case ASK_QUESTION -> questions.ask(ctx);
            case DECIDE -> decisions.decide(ctx);
            case NOTIFY -> decisions.notifyContact(ctx);
            case RESET_FOR_NEXT_VISITOR -> decisions.resetForNextVisitor(ctx);
            case END -> {
            }
        }
    }

    private void compact(SessionState state) {
        List<ConversationMessage> before = state.getMessages();
        List<ConversationMessage> compacted = compactor.compact(before);
        if (compacted.size() < before.size()) {
            state.replaceMessages(compacted);
            LOG.info("History compacted with {}: {} -> {} messages", compactor.name(), before.size(), compacted.size());
        }
    }
}
