package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.domain.ProfileField;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerCleanerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Bob Jones|Bob Jones",
            "name: Bob Jones|Bob Jones",
            "The name is Bob Jones|Bob Jones",
            "my full legal name Robert James Jones|Robert James Jones"
    })
    void cleansNameAnswers(String raw, String expected) {
        assertThat(AnswerCleaner.clean(ProfileField.NAME, raw)).contains(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"-1", " \"-1\" ", "<think>hmm</think>-1", "name:"})
    void sentinelAndEmptyAnswersYieldNothing(String raw) {
        assertThat(AnswerCleaner.clean(ProfileField.NAME, raw)).isEmpty();
    }

    @Test
    void surroundingQuotesAreRemoved() {
        assertThat(AnswerCleaner.clean(ProfileField.NAME, "\"Bob Jones\"")).contains("Bob Jones");
        assertThat(AnswerCleaner.clean(ProfileField.NAME, "Answer: 'Bob'")).contains("Bob");
    }

    @Test
    void contactPersonIsKeptVerbatim() {
        assertThat(AnswerCleaner.clean(ProfileField.CONTACT_PERSON, "contact person: Dr. Alice May Kimble"))
                .contains("Dr. Alice May Kimble");
    }

    @Test
    void thinkingSectionIsRemoved() {
        assertThat(AnswerCleaner.clean(ProfileField.PURPOSE, "<think>they said meeting</think>\nmeeting"))
                .contains("meeting");
    }
}
