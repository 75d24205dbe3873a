package org.chatclient.service.store;

import org.chatclient.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageListsTest {

    private static Message msg(String id, String content, String ts, boolean mine) {
        return Message.builder().id(id).content(content).timestamp(ts).sentByCurrentUser(mine).build();
    }

    private static Message pending(String id, String content, String ts) {
        return msg(id, content, ts, true).withPending(true);
    }

    @Test
    void append_shouldIgnoreExistingId() {
        List<Message> list = List.of(msg("m1", "a", "2024-05-01T10:00:00Z", false));

        List<Message> out = MessageLists.append(list, msg("m1", "a", "2024-05-01T10:00:00Z", false));

        assertThat(out).isSameAs(list);
    }

    @Test
    void append_shouldInsertEarlierWhenTimestampOlder() {
        List<Message> list = List.of(
                msg("m1", "a", "2024-05-01T10:00:00Z", false),
                msg("m3", "c", "2024-05-01T10:02:00Z", false));

        List<Message> out = MessageLists.append(list, msg("m2", "b", "2024-05-01T10:01:00Z", false));

        assertThat(out).extracting(Message::getId).containsExactly("m1", "m2", "m3");
    }

    @Test
    void promote_shouldReplaceInPlace() {
        List<Message> list = List.of(
                msg("m1", "a", "2024-05-01T10:00:00Z", false),
                pending("pending_x", "b", "2024-05-01T10:01:00Z"),
                msg("m3", "c", "2024-05-01T10:02:00Z", false));

        List<Message> out = MessageLists.promote(list, "pending_x",
                msg("m2", "b", "2024-05-01T10:01:01Z", true), false);

        assertThat(out).extracting(Message::getId).containsExactly("m1", "m2", "m3");
        assertThat(out.get(1).isPending()).isFalse();
    }

    @Test
    void promote_shouldNotDuplicateWhenEchoArrived() {
        // l'écho message:new a déjà remplacé l'entrée en attente
        List<Message> list = List.of(msg("m2", "b", "2024-05-01T10:01:01Z", true));

        List<Message> out = MessageLists.promote(list, "pending_x",
                msg("m2", "b", "2024-05-01T10:01:01Z", true), true);

        assertThat(out).extracting(Message::getId).containsExactly("m2");
    }

    @Test
    void promote_shouldKeepSingleEntryAfterEchoThenConfirmation() {
        List<Message> list = List.of(
                pending("pending_x", "b", "2024-05-01T10:01:00Z"),
                msg("m2", "b", "2024-05-01T10:01:01Z", true));

        List<Message> out = MessageLists.promote(list, "pending_x",
                msg("m2", "b", "2024-05-01T10:01:01Z", true), false);

        assertThat(out).extracting(Message::getId).containsExactly("m2");
    }

    @Test
    void promote_shouldAppendMissingEntryOnlyWhenAsked() {
        List<Message> empty = List.of();
        Message confirmed = msg("m2", "b", "2024-05-01T10:01:01Z", true);

        assertThat(MessageLists.promote(empty, "pending_x", confirmed, false)).isEmpty();
        assertThat(MessageLists.promote(empty, "pending_x", confirmed, true))
                .extracting(Message::getId).containsExactly("m2");
    }

    @Test
    void remove_shouldRemoveOnlyTargetEntry() {
        List<Message> list = List.of(
                msg("m1", "a", "2024-05-01T10:00:00Z", true),
                pending("pending_x", "a", "2024-05-01T10:01:00Z"));

        List<Message> out = MessageLists.remove(list, "pending_x");

        assertThat(out).extracting(Message::getId).containsExactly("m1");
    }

    @Test
    void mergeIncoming_shouldReplaceFirstPendingWithSameContent() {
        List<Message> list = List.of(
                pending("pending_a", "salut", "2024-05-01T10:00:00Z"),
                pending("pending_b", "ça va ?", "2024-05-01T10:00:01Z"));

        List<Message> out = MessageLists.mergeIncoming(list, msg("m7", "ça va ?", "2024-05-01T10:00:02Z", true));

        assertThat(out).extracting(Message::getId).containsExactly("pending_a", "m7");
    }

    @Test
    void mergeIncoming_shouldNeverTouchPendingForReceivedMessage() {
        List<Message> list = List.of(pending("pending_a", "salut", "2024-05-01T10:00:00Z"));

        List<Message> out = MessageLists.mergeIncoming(list, msg("m8", "salut", "2024-05-01T10:00:02Z", false));

        assertThat(out).extracting(Message::getId).containsExactly("pending_a", "m8");
    }

    @Test
    void clearFresh_shouldReturnSameListForUnknownId() {
        List<Message> list = List.of(msg("m1", "a", "2024-05-01T10:00:00Z", false).withFresh(true));

        assertThat(MessageLists.clearFresh(list, "zz")).isSameAs(list);
        assertThat(MessageLists.clearFresh(list, "m1").get(0).isFresh()).isFalse();
    }
}
