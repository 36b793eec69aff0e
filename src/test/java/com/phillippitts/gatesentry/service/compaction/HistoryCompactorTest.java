package com.phillippitts.gatesentry.service.compaction;

import com.phillippitts.gatesentry.domain.ConversationMessage;
import com.phillippitts.gatesentry.domain.MessageRole;
import com.phillippitts.gatesentry.testutil.FakeNluClient;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryCompactorTest {

    private static List<ConversationMessage> history(int size) {
        List<ConversationMessage> out = new ArrayList<>();
        out.add(ConversationMessage.system("preamble"));
        for (int i = 1; i < size; i++) {
            out.add(i % 2 == 1 ? ConversationMessage.human("line " + i) : ConversationMessage.agent("reply " + i));
        }
        return out;
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 4, 7})
    void shortenIsNoOpBelowMinimum(int size) {
        List<ConversationMessage> messages = history(size);

        assertThat(new ShortenCompactor(8, 5).compact(messages)).isSameAs(messages);
    }

    @ParameterizedTest
    @ValueSource(ints = {8, 12, 30})
    void shortenStrictlyShrinksAndKeepsPreambleAndTail(int size) {
        List<ConversationMessage> messages = history(size);

        List<ConversationMessage> out = new ShortenCompactor(8, 5).compact(messages);

        assertThat(out).hasSizeLessThan(messages.size());
        assertThat(out.get(0)).isEqualTo(messages.get(0));
        assertThat(out.get(1).role()).isEqualTo(MessageRole.SYSTEM);
        assertThat(out.get(1).content()).contains((size - 6) + " messages removed");
        assertThat(out.subList(2, out.size())).isEqualTo(messages.subList(size - 5, size));
    }

    @ParameterizedTest
    @ValueSource(ints = {3, 7})
    void summarizeIsNoOpBelowMinimum(int size) {
        FakeNluClient nlu = new FakeNluClient();
        List<ConversationMessage> messages = history(size);

        assertThat(new SummarizeCompactor(nlu, 8, 4).compact(messages)).isSameAs(messages);
    }

    @Test
    void summarizeReplacesMiddleWithSummary() {
        FakeNluClient nlu = new FakeNluClient().summary("Bob from Acme is visiting David.");
        List<ConversationMessage> messages = history(10);

        List<ConversationMessage> out = new SummarizeCompactor(nlu, 8, 4).compact(messages);

        assertThat(out).hasSize(6);
        assertThat(out.get(0)).isEqualTo(messages.get(0));
        assertThat(out.get(1).content())
                .isEqualTo(SummarizeCompactor.SUMMARY_PREFIX + "Bob from Acme is visiting David.");
        assertThat(out.subList(2, 6)).isEqualTo(messages.subList(6, 10));
    }

    @Test
    void summarizeLeavesHistoryAloneWhenModelFails() {
        FakeNluClient nlu = new FakeNluClient().failing(true);
        List<ConversationMessage> messages = history(12);

        assertThat(new SummarizeCompactor(nlu, 8, 4).compact(messages)).isSameAs(messages);
    }

    @Test
    void summarizeLeavesHistoryAloneOnBlankSummary() {
        FakeNluClient nlu = new FakeNluClient().summary("  ");
        List<ConversationMessage> messages = history(12);

        assertThat(new SummarizeCompactor(nlu, 8, 4).compact(messages)).isSameAs(messages);
    }
}
