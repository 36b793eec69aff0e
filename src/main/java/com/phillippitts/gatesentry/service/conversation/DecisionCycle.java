package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.domain.ConversationMessage;
import com.phillippitts.gatesentry.domain.Decision;
import com.phillippitts.gatesentry.domain.FieldValue;
import com.phillippitts.gatesentry.domain.ProfileField;
import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.domain.VisitorProfile;
import com.phillippitts.gatesentry.service.decision.DecisionEngine;
import com.phillippitts.gatesentry.service.decision.DecisionResult;
import com.phillippitts.gatesentry.service.directory.ContactDirectory;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import com.phillippitts.gatesentry.service.notification.NotificationDispatcher;
import com.phillippitts.gatesentry.service.notification.NotificationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * DECIDE, NOTIFY and RESET_FOR_NEXT_VISITOR.
 */
@Component
public class DecisionCycle {

    private static final Logger LOG = LogManager.getLogger(DecisionCycle.class);

    static final String NOTIFY_APOLOGY = "I'm sorry, I could not notify %s about your arrival. "
            + "Please check in with reception.";

    private final DecisionEngine engine;
    private final ContactDirectory contacts;
    private final NotificationDispatcher dispatcher;
    private final GateMetrics metrics;

    public DecisionCycle(DecisionEngine engine, ContactDirectory contacts, NotificationDispatcher dispatcher,
                         GateMetrics metrics) {
        this.engine = engine;
        this.contacts = contacts;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
    }

    public void decide(TurnContext ctx) {
        SessionState state = ctx.state();
        DecisionResult result = engine.decide(state);
        state.recordDecision(result.decision(), result.confidence(), result.reasoning());
        state.append(ConversationMessage.agent(result.message()));
        ctx.reply(result.message());
        ctx.setDecision(result);
        metrics.incrementDecision(result.decision());
        LOG.info("Decision: {} (confidence={})", result.decision().id(), result.confidence());

        FieldValue contact = state.getProfile().get(ProfileField.CONTACT_PERSON);
        ctx.setNotifyRequired(result.decision() == Decision.ALLOW_REQUEST
                && contact.isValue() && contacts.contains(contact.orElse(null)));
    }

    /** Tells the contact person about the visitor; failures only produce an apology. */
    public void notifyContact(TurnContext ctx) {
        VisitorProfile profile = ctx.state().getProfile();
        String contact = profile.get(ProfileField.CONTACT_PERSON).orElse("");
        String visitor = profile.get(ProfileField.NAME).orElse("Unknown visitor");

        NotificationResult result;
        try {
            result = dispatcher.send(contact, "Visitor Arrival Notification - " + visitor, body(contact, profile));
        } catch (RuntimeException e) {
            LOG.warn("Notification via {} failed", dispatcher.name(), e);
            result = NotificationResult.failed(e.getMessage());
        }
        metrics.incrementNotification(result.success());
        if (!result.success()) {
            LOG.warn("Notification not delivered: {}", result.message());
            String apology = NOTIFY_APOLOGY.formatted(contact);
            ctx.state().append(ConversationMessage.agent(apology));
            ctx.reply(apology);
        }
    }

    /** Clears the cycle so the next visitor starts from the preamble. */
    public void resetForNextVisitor(TurnContext ctx) {
        ctx.state().resetForNextVisitor();
        ctx.markProfileReset();
        ctx.markSessionComplete();
        LOG.debug("Session ready for next visitor");
    }

    static String body(String contact, VisitorProfile profile) {
        return "Hello " + contact + ",\n\n"
                + "This is an automated notification that your visitor has arrived:\n\n"
                + "Visitor Details:\n"
                + "- Name: " + profile.get(ProfileField.NAME).orElse("Unknown") + "\n"
                + "- Purpose: " + profile.get(ProfileField.PURPOSE).orElse("Unknown") + "\n"
                + "- Affiliation: " + profile.get(ProfileField.AFFILIATION).orElse("Unknown") + "\n"
                + "- Status: Access Granted\n\n"
                + "The visitor has been cleared through security and is proceeding to the main entrance.\n\n"
                + "Best regards,\nSecurity Gate System";
    }
}
