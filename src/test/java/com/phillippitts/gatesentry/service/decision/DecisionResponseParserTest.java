package com.phillippitts.gatesentry.service.decision;

import com.phillippitts.gatesentry.domain.Decision;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class DecisionResponseParserTest {

    @Test
    void parsesJsonWrappedInProseAndThinking() {
        String raw = "<think>the visitor looks fine</think>Here you go:\n```json\n"
                + "{\"decision\": \"allow_request\", \"confidence\": 0.85, \"reasoning\": \"expected\"}\n```";

        assertThat(DecisionResponseParser.parse(raw)).hasValueSatisfying(p -> {
            assertThat(p.decision()).isEqualTo(Decision.ALLOW_REQUEST);
            assertThat(p.confidence()).isEqualTo(0.85);
            assertThat(p.reasoning()).isEqualTo("expected");
        });
    }

    @Test
    void decisionIdIsCaseInsensitive() {
        assertThat(DecisionResponseParser.parse("{\"decision\": \"CALL_SECURITY\", \"confidence\": 1}"))
                .hasValueSatisfying(p -> assertThat(p.decision()).isEqualTo(Decision.CALL_SECURITY));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "allow",
            "{not json}",
            "{\"decision\": \"open_door\", \"confidence\": 0.9}",
            "{\"decision\": \"none\", \"confidence\": 0.9}",
            "{\"decision\": \"allow_request\"}",
            "{\"decision\": \"allow_request\", \"confidence\": 1.5}",
            "{\"decision\": \"allow_request\", \"confidence\": -0.1}",
            "{\"decision\": \"allow_request\", \"confidence\": \"high\"}"
    })
    void unusableAnswersYieldEmpty(String raw) {
        assertThat(DecisionResponseParser.parse(raw)).isEmpty();
    }
}
