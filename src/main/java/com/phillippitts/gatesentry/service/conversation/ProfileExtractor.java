package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.domain.ConversationMessage;
import com.phillippitts.gatesentry.domain.FieldValue;
import com.phillippitts.gatesentry.domain.ProfileField;
import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.domain.VisitorProfile;
import com.phillippitts.gatesentry.exception.CapabilityException;
import com.phillippitts.gatesentry.service.directory.ContactDirectory;
import com.phillippitts.gatesentry.service.directory.EmployeeDirectory;
import com.phillippitts.gatesentry.service.llm.NluClient;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * EXTRACT_PROFILE and VALIDATE_CONTACT.
 *
 * <p>Each missing field is asked for once per turn against the full transcript. Fields that already hold
 * a value are never asked for again. The contact person is only a candidate until it matches the
 * contact directory.
 */
@Component
public class ProfileExtractor {

    private static final Logger LOG = LogManager.getLogger(ProfileExtractor.class);

    private final NluClient nlu;
    private final ContactDirectory contacts;
    private final EmployeeDirectory employees;
    private final GateMetrics metrics;

    public ProfileExtractor(NluClient nlu, ContactDirectory contacts, EmployeeDirectory employees,
                            GateMetrics metrics) {
        this.nlu = nlu;
        this.contacts = contacts;
        this.employees = employees;
        this.metrics = metrics;
    }

    public void extract(TurnContext ctx) {
        SessionState state = ctx.state();
        VisitorProfile profile = state.getProfile();
        String transcript = state.getMessages().stream()
                .map(ConversationMessage::render)
                .collect(Collectors.joining("\n"));
        List<String> knownContacts = contacts.names();

        for (ProfileField field : ProfileField.values()) {
            if (profile.get(field).isValue()) {
                continue;
            }
            Optional<String> value = ask(field, transcript, knownContacts);
            if (field == ProfileField.CONTACT_PERSON) {
                ctx.setContactCandidate(value.orElse(null));
                continue;
            }
            if (value.isPresent()) {
                profile.offer(field, FieldValue.of(value.get()));
                LOG.info("Extracted {}", field.key());
            } else {
                profile.offer(field, FieldValue.unknown());
                metrics.incrementExtractionMiss(field);
            }
        }

        FieldValue name = profile.get(ProfileField.NAME);
        if (!profile.isAuthenticated() && name.isValue() && employees.authenticate(name.orElse(null))) {
            profile.setAuthenticated(true);
            LOG.info("Visitor authenticated as employee");
        }
    }

    /** Matches the extracted contact candidate against the directory and stores the canonical name. */
    public void validateContact(TurnContext ctx) {
        VisitorProfile profile = ctx.state().getProfile();
        if (profile.get(ProfileField.CONTACT_PERSON).isValue()) {
            return;
        }
        Optional<String> canonical = contacts.match(ctx.contactCandidate());
        if (canonical.isPresent()) {
            profile.offer(ProfileField.CONTACT_PERSON, FieldValue.of(canonical.get()));
            LOG.info("Contact matched: {}", canonical.get());
        } else {
            profile.offer(ProfileField.CONTACT_PERSON, FieldValue.unknown());
            metrics.incrementExtractionMiss(ProfileField.CONTACT_PERSON);
            if (ctx.contactCandidate() != null) {
                LOG.info("Contact candidate not in directory");
            }
        }
    }

    private Optional<String> ask(ProfileField field, String transcript, List<String> knownContacts) {
        try {
            return AnswerCleaner.clean(field, nlu.extractField(field, transcript, knownContacts));
        } catch (CapabilityException e) {
            LOG.warn("Extraction of {} failed: {}", field.key(), e.getMessage());
            return Optional.empty();
        }
    }
}
