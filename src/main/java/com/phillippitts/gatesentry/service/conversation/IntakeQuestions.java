package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.domain.ConversationMessage;
import com.phillippitts.gatesentry.domain.ProfileField;
import com.phillippitts.gatesentry.domain.VisitorProfile;
import com.phillippitts.gatesentry.service.directory.ContactDirectory;
import com.phillippitts.gatesentry.service.llm.GatePrompts;
import org.springframework.stereotype.Component;

/** CHECK_COMPLETENESS and ASK_QUESTION. */
@Component
public class IntakeQuestions {

    static final String FALLBACK_QUESTION = "Can you tell me more about yourself?";

    private final ContactDirectory contacts;

    public IntakeQuestions(ContactDirectory contacts) {
        this.contacts = contacts;
    }

    public void checkCompleteness(TurnContext ctx) {
        VisitorProfile profile = ctx.state().getProfile();
        boolean complete = profile.isComplete();
        profile.setIdVerified(complete);
        ctx.setComplete(complete);
    }

    /** Asks for the first missing field in declaration order. */
    public void ask(TurnContext ctx) {
        VisitorProfile profile = ctx.state().getProfile();
        String question = FALLBACK_QUESTION;
        for (ProfileField field : ProfileField.values()) {
            if (profile.get(field).isMissing()) {
                question = GatePrompts.question(field, contacts.names());
                break;
            }
        }
        ctx.state().append(ConversationMessage.agent(question));
        ctx.reply(question);
    }
}
