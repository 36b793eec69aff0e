package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.config.properties.ConversationProperties;
import com.phillippitts.gatesentry.domain.ConversationMessage;
import com.phillippitts.gatesentry.domain.MessageRole;
import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.exception.CapabilityException;
import com.phillippitts.gatesentry.service.llm.NluClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * ROUTE_AFTER_INPUT and RESET.
 *
 * <p>Routing order: rejected input, inactive session, high visual threat, new visitor, history length,
 * normal intake.
 */
@Component
public class TurnRouter {

    private static final Logger LOG = LogManager.getLogger(TurnRouter.class);

    public static final String WELCOME = "Hello! Welcome to the gate. Please tell me your name and the purpose of "
            + "your visit.";

    private final NluClient nlu;
    private final int maxHumanMessages;
    private final int detectionContext;

    public TurnRouter(NluClient nlu, ConversationProperties props) {
        this.nlu = nlu;
        this.maxHumanMessages = props.getMaxHumanMessages();
        this.detectionContext = props.getDetectionContextMessages();
    }

    public void route(TurnContext ctx) {
        ctx.setRoute(chooseRoute(ctx.state()));
        LOG.debug("Route after input: {}", ctx.route());
    }

    Route chooseRoute(SessionState state) {
        if (state.isInvalidInput()) {
            return Route.END;
        }
        if (!state.isSessionActive()) {
            return Route.RESET;
        }
        if (state.isHighThreat()) {
            return Route.SECURITY;
        }
        if (isNewVisitor(state)) {
            return Route.RESET;
        }
        if (state.countMessages(MessageRole.HUMAN) > maxHumanMessages) {
            return Route.COMPACT;
        }
        return Route.EXTRACT;
    }

    /**
     * RESET: history becomes the preamble plus the triggering line, profile and decision cleared.
     * The welcome reply is not recorded.
     */
    public void reset(TurnContext ctx) {
        SessionState state = ctx.state();
        ConversationMessage trigger = state.lastMessage();
        state.resetVisitor(trigger.role() == MessageRole.HUMAN ? trigger : null);
        ctx.markProfileReset();
        ctx.reply(WELCOME);
        LOG.info("Session reset for a new visitor");
    }

    private boolean isNewVisitor(SessionState state) {
        List<ConversationMessage> messages = state.getMessages();
        int from = messages.size() >= detectionContext ? messages.size() - detectionContext : 1;
        String context = messages.subList(from, messages.size()).stream()
                .map(ConversationMessage::render)
                .collect(Collectors.joining("\n"));
        String answer;
        try {
            answer = nlu.detectSession(context, state.lastMessage().content()).toLowerCase(Locale.ROOT);
        } catch (CapabilityException e) {
            LOG.warn("Session detection unavailable, assuming same visitor: {}", e.getMessage());
            return false;
        }
        boolean isNew = answer.contains("new") && !answer.contains("same");
        if (isNew) {
            LOG.info("New visitor detected");
        }
        return isNew;
    }
}
