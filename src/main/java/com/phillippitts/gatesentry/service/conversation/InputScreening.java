package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.domain.ConversationMessage;
import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.exception.CapabilityException;
import com.phillippitts.gatesentry.service.llm.NluClient;
import com.phillippitts.gatesentry.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Receives and validates a visitor line.
 *
 * <p>Blank input is rejected locally. Relevance is judged by the language model; only an explicit
 * {@code unrelated} rejects, while unclear answers and failures let the line through.
 */
@Component
public class InputScreening {

    private static final Logger LOG = LogManager.getLogger(InputScreening.class);

    public static final String REPROMPT = "I didn't understand that. Please provide relevant information for your "
            + "visit. I need to know your name, purpose of visit, company/organization, and any security-related "
            + "information.";

    private final NluClient nlu;

    public InputScreening(NluClient nlu) {
        this.nlu = nlu;
    }

    /** RECEIVE_INPUT: flags blank input and touches nothing else. */
    public void receive(TurnContext ctx) {
        SessionState state = ctx.state();
        if (ctx.input().isBlank()) {
            LOG.info("Empty input rejected");
            state.setInvalidInput(true);
            ctx.reply(REPROMPT);
            return;
        }
        state.setInvalidInput(false);
        state.setUserInput(ctx.input());
    }

    /** VALIDATE: appends the line to history unless the model calls it unrelated. */
    public void validate(TurnContext ctx) {
        SessionState state = ctx.state();
        String input = ctx.input().trim();
        if (isUnrelated(input)) {
            LOG.info("Input judged unrelated: '{}'", LogSanitizer.preview(input));
            state.setInvalidInput(true);
            ctx.reply(REPROMPT);
            return;
        }
        state.append(ConversationMessage.human(input));
    }

    private boolean isUnrelated(String input) {
        String answer;
        try {
            answer = nlu.validateInput(input).toLowerCase(Locale.ROOT);
        } catch (CapabilityException e) {
            LOG.warn("Input validation unavailable, accepting input: {}", e.getMessage());
            return false;
        }
        if (answer.contains("unrelated")) {
            return true;
        }
        if (!answer.contains("valid")) {
            LOG.debug("Unclear validation answer '{}', accepting input", LogSanitizer.preview(answer));
        }
        return false;
    }
}
