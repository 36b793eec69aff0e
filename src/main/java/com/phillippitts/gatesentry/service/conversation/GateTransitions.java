package com.phillippitts.gatesentry.service.conversation;

/**
 * Transition function of the conversation machine. Reads only the flags steps have written to the
 * {@link TurnContext}; never calls collaborators or mutates anything.
 */
public final class GateTransitions {

    private GateTransitions() {
    }

    public static GateState next(GateState current, TurnContext ctx) {
        return switch (current) {
            case RECEIVE_INPUT -> ctx.state().isInvalidInput() ? GateState.END : GateState.VALIDATE;
            case VALIDATE -> GateState.ROUTE_AFTER_INPUT;
            case ROUTE_AFTER_INPUT -> switch (ctx.route()) {
                case END -> GateState.END;
                case RESET -> GateState.RESET;
                case SECURITY -> GateState.DECIDE;
                case COMPACT -> GateState.COMPACT;
                case EXTRACT -> GateState.EXTRACT_PROFILE;
            };
            case COMPACT -> GateState.EXTRACT_PROFILE;
            case EXTRACT_PROFILE -> GateState.VALIDATE_CONTACT;
            case VALIDATE_CONTACT -> GateState.CHECK_COMPLETENESS;
            case CHECK_COMPLETENESS -> ctx.isComplete() ? GateState.DECIDE : GateState.ASK_QUESTION;
            case DECIDE -> ctx.isNotifyRequired() ? GateState.NOTIFY : GateState.RESET_FOR_NEXT_VISITOR;
            case NOTIFY -> GateState.RESET_FOR_NEXT_VISITOR;
            case RESET, ASK_QUESTION, RESET_FOR_NEXT_VISITOR, END -> GateState.END;
        };
    }
}
