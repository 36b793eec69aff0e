package com.phillippitts.gatesentry.service.llm;

import com.phillippitts.gatesentry.domain.ProfileField;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt templates sent to the language and vision models.
 */
public final class GatePrompts {

    private static final String VALIDATION = """
            You are an input validator for a security gate system. Your job is to determine if user input is \
            relevant and appropriate for a security checkpoint conversation.

            VALID inputs include:
            - Personal information (names, company names, purposes)
            - Responses to security questions
            - Regular conversation and questions about the facility or visit process
            - Descriptions of belongings, appearance or behaviour

            INVALID inputs include:
            - Complete gibberish or random characters
            - Curse words
            - Spam or repetitive nonsense
            - Completely irrelevant topics (sports, weather, unrelated subjects)

            Respond with ONLY one word:
            - "valid" if the input is appropriate for a security checkpoint
            - "unrelated" if the input is gibberish, spam, offensive, or completely irrelevant

            Input to validate: "%s"

            Response:""";

    private static final String SESSION = """
            You are a session detector for a security gate system. Determine if the latest message indicates a \
            NEW visitor has arrived or if it is the SAME visitor continuing the conversation. Unless it is \
            apparent, choose SAME.

            NEW VISITOR indicators:
            - Introductions with a different name than the previous visitor
            - Greetings that suggest a fresh start at an unexpected point
            - References to being a different person

            CONVERSATION CONTEXT:
            %s

            LATEST MESSAGE: %s

            Respond with ONLY one word:
            - "new" if this appears to be a new visitor
            - "same" if this is the same visitor continuing

            Response:""";

    private static final String EXTRACTION = """
            You are a data extraction tool. Your task is to extract ONLY the %1$s value from the conversation.

            FIELD DESCRIPTION:
            %1$s = %2$s

            STRICT RULES:
            - Respond with ONLY the %1$s value (no explanations, no sentences)
            - If you cannot clearly determine the %1$s from the conversation, respond with exactly: -1
            - Maximum 3 words for the response
            - No punctuation except necessary hyphens or periods

            Conversation:
            %3$s

            Extract %1$s:""";

    private static final String CONTACT = """
            You are a strict contact person validator. Determine if the visitor is referring to any of the \
            known contacts in our organization.

            KNOWN CONTACTS:
            %s

            STRICT MATCHING RULES:
            - ONLY match if the visitor mentions a name that is clearly the SAME PERSON as a known contact
            - Match variations such as a first name alone or a title with the last name
            - DO NOT match similar sounding but different names
            - Only respond with the EXACT name from the list if you are certain it is the same person
            - When in doubt, respond with -1

            Conversation:
            %s

            Contact person:""";

    private static final String SUMMARY = """
            Summarize the following conversation between a security gate assistant and a visitor.
            Focus ONLY on:
            1. Key visitor information (name, purpose, affiliation)
            2. Security-relevant details
            3. Important context needed to continue the conversation

            Keep the summary concise and focused on essential information.

            Conversation:
            %s

            Summary:""";

    private static final String DECISION = """
            You are a security gate decision system. Based on the visitor profile and conversation, choose the \
            most appropriate security action.

            VISITOR PROFILE:
            %s

            AVAILABLE DECISIONS:
            1. allow_request - Standard access granted, visitor approved and the contact notified
            2. call_security - Call security immediately, high threat or suspicious behavior
            3. deny_request - Access denied, insufficient credentials or policy violation

            RECENT CONVERSATION:
            %s

            Respond with ONLY a JSON object of the form
            {"decision": "<decision id>", "confidence": <number between 0 and 1>, "reasoning": "<one sentence>"}""";

    private static final String VISION = """
            You are a security camera threat detector. Analyse the image and respond with ONLY a JSON object:
            {"face_detected": true|false, "angry_face": true|false, "dangerous_object": true|false, \
            "threat_level": "low"|"medium"|"high", "details": "<short description>"}
            Use "high" only when a weapon or clearly dangerous object is visible.""";

    private GatePrompts() {
    }

    public static String validation(String userInput) {
        return VALIDATION.formatted(userInput);
    }

    public static String sessionDetection(String recentContext, String latestMessage) {
        return SESSION.formatted(recentContext, latestMessage);
    }

    /**
     * Builds the extraction prompt for one field. The contact person prompt lists the directory names.
     */
    public static String extraction(ProfileField field, String transcript, List<String> knownContacts) {
        if (field == ProfileField.CONTACT_PERSON) {
            String contacts = knownContacts.stream().map(c -> "- " + c).collect(Collectors.joining("\n"));
            return CONTACT.formatted(contacts, transcript);
        }
        return EXTRACTION.formatted(field.key(), describe(field), transcript);
    }

    public static String summary(String conversation) {
        return SUMMARY.formatted(conversation);
    }

    public static String decision(String profileSummary, String recentTranscript) {
        return DECISION.formatted(profileSummary, recentTranscript);
    }

    public static String vision() {
        return VISION;
    }

    /** Question asked when the given field is the first one still missing. */
    public static String question(ProfileField field, List<String> knownContacts) {
        return switch (field) {
            case NAME -> "What is your name?";
            case PURPOSE -> "What is the purpose of your visit today?";
            case CONTACT_PERSON -> "Who is your contact? (Known contacts include: "
                    + String.join(", ", knownContacts) + ")";
            case THREAT_LEVEL -> "Are you carrying any restricted items or have any security concerns I should know about?";
            case AFFILIATION -> "What company or organization are you with?";
        };
    }

    static String describe(ProfileField field) {
        return switch (field) {
            case NAME -> "The visitor's full name (first and last name). Examples: 'John Smith', 'Maria Garcia', '-1'";
            case PURPOSE -> "The reason for the visit. Examples: 'meeting', 'delivery', 'tour', 'interview', '-1'";
            case CONTACT_PERSON -> "The visitor's contact inside the company. Examples: 'David Smith', 'CTO', '-1'";
            case THREAT_LEVEL -> "Security risk based on items carried, behavior, or concerns mentioned. "
                    + "Examples: 'low', 'medium', 'high', '-1'";
            case AFFILIATION -> "Company, organization, or group they represent. "
                    + "Examples: 'Google', 'FedEx', 'independent contractor', '-1'";
        };
    }
}
