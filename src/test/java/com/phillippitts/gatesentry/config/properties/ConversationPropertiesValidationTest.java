package com.phillippitts.gatesentry.config.properties;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationPropertiesValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void defaultsAreValid() {
        assertThat(validator.validate(new ConversationProperties())).isEmpty();
    }

    @Test
    void shortenKeepMustLeaveRoomToShrink() {
        ConversationProperties props = new ConversationProperties();
        props.getCompaction().setShortenKeep(6);

        Set<ConstraintViolation<ConversationProperties>> violations = validator.validate(props);

        assertThat(violations).singleElement()
                .satisfies(v -> assertThat(v.getMessage()).contains("min-messages - 3"));
    }

    @Test
    void summarizeKeepMustLeaveRoomToShrink() {
        ConversationProperties props = new ConversationProperties();
        props.getCompaction().setMinMessages(6);
        props.getCompaction().setShortenKeep(3);
        props.getCompaction().setSummarizeKeep(4);

        assertThat(validator.validate(props)).hasSize(1);
    }

    @Test
    void largestAllowedKeepStillAccepted() {
        ConversationProperties props = new ConversationProperties();
        props.getCompaction().setMinMessages(10);
        props.getCompaction().setShortenKeep(7);
        props.getCompaction().setSummarizeKeep(7);

        assertThat(validator.validate(props)).isEmpty();
    }
}
