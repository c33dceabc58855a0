package com.questrail.chat.message;

import com.questrail.chat.api.ChatException;
import com.questrail.chat.api.ErrorCode;
import com.questrail.chat.api.ErrorInfo;
import com.questrail.chat.api.Subscription;
import com.questrail.chat.channel.FakeChannelHandle;
import com.questrail.chat.channel.InboundMessage;
import com.questrail.chat.channel.OutboundMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.questrail.chat.api.ChatAssertions.assertFailsWith;
import static com.questrail.chat.api.ChatAssertions.assertSucceeded;
import static com.questrail.chat.api.ChatAssertions.failureOf;
import static com.questrail.chat.message.MessageFixtures.inbound;
import static com.questrail.chat.message.MessageFixtures.serial;
import static org.junit.jupiter.api.Assertions.*;

class DefaultMessagesTest {

    private final FakeChannelHandle channel = new FakeChannelHandle("room-1::$chat");
    private final DefaultMessages messages = new DefaultMessages("room-1", channel, Runnable::run);
    private final List<MessageEvent> events = new ArrayList<>();

    @Test
    void subscribesToChatMessagesOnConstruction() {
        assertEquals(1, channel.subscriberCount());
    }

    @Test
    void inboundMessageReachesListenersAndWindow() {
        messages.subscribe(events::add);

        channel.deliver(inbound(serial(100, 0), MessageAction.CREATED, serial(100, 0), "hello"));

        assertEquals(1, events.size());
        assertEquals(MessageEventType.CREATED, events.get(0).type());
        assertEquals("hello", events.get(0).message().text());
        assertEquals(1, messages.window().snapshot().size());
    }

    @Test
    void updateReachesListenersAndWindow() {
        messages.subscribe(events::add);
        channel.deliver(inbound(serial(100, 0), MessageAction.CREATED, serial(100, 0), "hello"));

        channel.deliver(inbound(serial(100, 0), MessageAction.UPDATED, serial(200, 0), "hello!"));

        assertEquals(MessageEventType.UPDATED, events.get(1).type());
        assertEquals("hello!", messages.window().snapshot().messages().get(0).text());
    }

    @Test
    void invalidInboundMessageIsDropped() {
        messages.subscribe(events::add);

        channel.deliver(new InboundMessage(MessageParser.MESSAGE_NAME, "alice", null, "message.create", null,
                Instant.EPOCH, Map.of("text", "no serial"), null));

        assertTrue(events.isEmpty());
        assertEquals(0, messages.window().snapshot().size());
    }

    @Test
    void inboundMessageKeepsNullMetadataAndHeaderValues() {
        messages.subscribe(events::add);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("reply", null);
        Map<String, Object> headers = new HashMap<>();
        headers.put("trace", null);
        Map<String, Object> data = new HashMap<>();
        data.put("text", "hello");
        data.put("metadata", metadata);

        channel.deliver(new InboundMessage(MessageParser.MESSAGE_NAME, "alice", serial(100, 0),
                "message.create", serial(100, 0), Instant.EPOCH, data, Map.of("headers", headers)));

        assertEquals(1, events.size());
        Message message = events.get(0).message();
        assertTrue(message.metadata().containsKey("reply"));
        assertNull(message.metadata().get("reply"));
        assertTrue(message.headers().containsKey("trace"));
        assertThrows(UnsupportedOperationException.class, () -> message.metadata().put("other", 1));
        assertEquals(1, messages.window().snapshot().size());
    }

    @Test
    void inboundMessageWithNullMetadataHasEmptyMetadata() {
        messages.subscribe(events::add);
        Map<String, Object> data = new HashMap<>();
        data.put("text", "hello");
        data.put("metadata", null);

        channel.deliver(new InboundMessage(MessageParser.MESSAGE_NAME, "alice", serial(100, 0),
                "message.create", serial(100, 0), Instant.EPOCH, data, null));

        assertEquals(1, events.size());
        assertTrue(events.get(0).message().metadata().isEmpty());
    }

    @Test
    void reactionSummaryReachesSummaryListenersAndWindow() {
        List<MessageReactionSummaryEvent> summaries = new ArrayList<>();
        messages.subscribeReactionSummaries(summaries::add);
        messages.subscribe(events::add);
        channel.deliver(inbound(serial(100, 0), MessageAction.CREATED, serial(100, 0), "hello"));

        channel.deliver(new InboundMessage(MessageParser.MESSAGE_NAME, null, serial(100, 0),
                MessageParser.SUMMARY_ACTION, null, Instant.EPOCH,
                Map.of("distinct", Map.of("heart", Map.of("total", 1, "clientIds", List.of("bob")))), null));

        assertEquals(1, summaries.size());
        assertEquals(1, events.size());
        assertEquals(1, messages.window().snapshot().messages().get(0).reactions().distinct().get("heart").total());
    }

    @Test
    void unsubscribedListenerStopsReceiving() {
        Subscription subscription = messages.subscribe(events::add);

        subscription.unsubscribe();
        channel.deliver(inbound(serial(100, 0), MessageAction.CREATED, serial(100, 0), "hello"));

        assertTrue(events.isEmpty());
    }

    @Test
    void sendPublishesChatMessage() {
        assertSucceeded(messages.send("hi", Map.of("mood", "happy"), Map.of("lang", "en")));

        List<OutboundMessage> published = channel.published();
        assertEquals(1, published.size());
        OutboundMessage sent = published.get(0);
        assertEquals(MessageParser.MESSAGE_NAME, sent.name());
        assertEquals("hi", sent.data().get("text"));
        assertEquals(Map.of("mood", "happy"), sent.data().get("metadata"));
        assertEquals(Map.of("headers", Map.of("lang", "en")), sent.extras());
        assertFalse(sent.ephemeral());
    }

    @Test
    void sendFailureIsPropagated() {
        channel.publishResult(CompletableFuture.failedFuture(new ChatException(new ErrorInfo("rejected", 40160, 401))));

        CompletableFuture<Void> result = messages.send("hi");

        ChatException failure = assertInstanceOf(ChatException.class, failureOf(result));
        assertEquals(40160, failure.code());
    }

    @Test
    void disposeUnsubscribesAndRejectsSends() {
        messages.subscribe(events::add);

        messages.dispose();
        messages.dispose();
        channel.deliver(inbound(serial(100, 0), MessageAction.CREATED, serial(100, 0), "hello"));

        assertEquals(0, channel.subscriberCount());
        assertTrue(events.isEmpty());
        assertFailsWith(messages.send("late"), ErrorCode.ROOM_IS_RELEASED);
    }

    @Test
    void reportsFeatureErrorCodes() {
        assertEquals("messages", messages.featureName());
        assertEquals(ErrorCode.MESSAGES_ATTACHMENT_FAILED, messages.attachmentErrorCode());
        assertEquals(ErrorCode.MESSAGES_DETACHMENT_FAILED, messages.detachmentErrorCode());
    }
}
