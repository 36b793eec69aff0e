package com.phillippitts.gatesentry.service.decision;

import com.phillippitts.gatesentry.config.properties.ConversationProperties;
import com.phillippitts.gatesentry.domain.ConversationMessage;
import com.phillippitts.gatesentry.domain.Decision;
import com.phillippitts.gatesentry.domain.ProfileField;
import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.domain.VisitorProfile;
import com.phillippitts.gatesentry.exception.CapabilityException;
import com.phillippitts.gatesentry.service.directory.EmployeeDirectory;
import com.phillippitts.gatesentry.service.llm.NluClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders the access decision for a session.
 *
 * <p>Order of precedence:
 * <ol>
 *   <li>high visual threat: call security, confidence 1.0</li>
 *   <li>authenticated employee: allow if authorized for the session's door, otherwise deny</li>
 *   <li>classifier answer; anything unusable denies with confidence 0.0</li>
 * </ol>
 */
@Service
public class DecisionEngine {

    private static final Logger LOG = LogManager.getLogger(DecisionEngine.class);

    public static final String ALLOW_MESSAGE = "Access granted. Welcome! Please proceed to the main entrance.";
    public static final String SECURITY_MESSAGE =
            "Please wait here. Security has been notified and will assist you shortly.";
    public static final String DENY_MESSAGE =
            "Access denied. Please contact the appropriate department to arrange your visit.";
    public static final String FAIL_CLOSED_MESSAGE =
            "I cannot process your request at this time. Please contact reception for assistance.";
    static final String UNAUTHORIZED_MESSAGE =
            "Sorry %s, you are not authorized to open this door. Please contact reception for assistance.";

    private final NluClient nlu;
    private final EmployeeDirectory employees;
    private final int contextMessages;

    public DecisionEngine(NluClient nlu, EmployeeDirectory employees, ConversationProperties props) {
        this.nlu = nlu;
        this.employees = employees;
        this.contextMessages = props.getDecisionContextMessages();
    }

    public DecisionResult decide(SessionState state) {
        if (state.isHighThreat()) {
            return new DecisionResult(Decision.CALL_SECURITY, 1.0,
                    "High visual threat: " + state.getVisionSchema().details(), SECURITY_MESSAGE);
        }

        VisitorProfile profile = state.getProfile();
        if (profile.isAuthenticated()) {
            return decideForEmployee(profile.get(ProfileField.NAME).orElse(""), state.getCameraId());
        }

        String raw;
        try {
            raw = nlu.classifyDecision(describe(profile), recentTranscript(state.getMessages()));
        } catch (CapabilityException e) {
            LOG.warn("Decision classification failed, denying: {}", e.getMessage());
            return failClosed("classification failed");
        }
        Optional<DecisionResponseParser.ParsedDecision> parsed = DecisionResponseParser.parse(raw);
        if (parsed.isEmpty()) {
            return failClosed("unusable classification");
        }
        DecisionResponseParser.ParsedDecision p = parsed.get();
        return new DecisionResult(p.decision(), p.confidence(), p.reasoning(), messageFor(p.decision()));
    }

    private DecisionResult decideForEmployee(String name, String cameraId) {
        if (employees.isAuthorized(name, cameraId)) {
            String greeting = employees.find(name).map(e -> e.greeting()).orElse(ALLOW_MESSAGE);
            LOG.info("Employee authorized for door {}", cameraId);
            return new DecisionResult(Decision.ALLOW_REQUEST, 1.0, "Authenticated employee", greeting);
        }
        LOG.info("Employee not authorized for door {}", cameraId);
        return new DecisionResult(Decision.DENY_REQUEST, 1.0, "Employee not authorized for door " + cameraId,
                UNAUTHORIZED_MESSAGE.formatted(name));
    }

    private static DecisionResult failClosed(String reason) {
        return new DecisionResult(Decision.DENY_REQUEST, 0.0, reason, FAIL_CLOSED_MESSAGE);
    }

    static String messageFor(Decision decision) {
        return switch (decision) {
            case ALLOW_REQUEST -> ALLOW_MESSAGE;
            case CALL_SECURITY -> SECURITY_MESSAGE;
            case DENY_REQUEST, NONE -> DENY_MESSAGE;
        };
    }

    static String describe(VisitorProfile profile) {
        return "- Name: " + profile.get(ProfileField.NAME)
                + "\n- Purpose: " + profile.get(ProfileField.PURPOSE)
                + "\n- Contact Person: " + profile.get(ProfileField.CONTACT_PERSON)
                + "\n- Threat Level: " + profile.get(ProfileField.THREAT_LEVEL)
                + "\n- Affiliation: " + profile.get(ProfileField.AFFILIATION)
                + "\n- ID Verified: " + profile.isIdVerified();
    }

    private String recentTranscript(List<ConversationMessage> messages) {
        int from = Math.max(0, messages.size() - contextMessages);
        return messages.subList(from, messages.size()).stream()
                .map(ConversationMessage::render)
                .collect(Collectors.joining("\n"));
    }
}
