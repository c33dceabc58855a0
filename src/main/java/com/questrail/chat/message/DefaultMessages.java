package com.questrail.chat.message;

import com.questrail.chat.api.ChatException;
import com.questrail.chat.api.ErrorCode;
import com.questrail.chat.api.Subscription;
import com.questrail.chat.channel.ChannelHandle;
import com.questrail.chat.channel.InboundMessage;
import com.questrail.chat.channel.InboundMessageListener;
import com.questrail.chat.channel.OutboundMessage;
import com.questrail.chat.core.ContributesToRoomLifecycle;
import com.questrail.chat.core.ListenerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Messages feature: turns inbound {@code chat.message} channel messages into
 * {@link MessageEvent}s and reaction summaries, feeds them to subscribers and
 * to the room's {@link MessageWindow}.
 * <p>
 * Inbound messages that cannot be parsed are logged and dropped. Delivery
 * happens on the room event loop.
 */
public final class DefaultMessages implements Messages, ContributesToRoomLifecycle
{
    private static final Logger log = LoggerFactory.getLogger(DefaultMessages.class);

    private final String roomName;
    private final ChannelHandle channel;
    private final Executor executor;

    private final ListenerRegistry<MessageListener> messageListeners = new ListenerRegistry<>();
    private final ListenerRegistry<MessageReactionListener> summaryListeners = new ListenerRegistry<>();
    private final MessageWindow window = new MessageWindow();
    private final InboundMessageListener inboundListener;
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    public DefaultMessages(String roomName, ChannelHandle channel, Executor executor) {
        this.roomName = Objects.requireNonNull(roomName, "roomName");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.executor = Objects.requireNonNull(executor, "executor");

        this.inboundListener = inbound -> this.executor.execute(() -> onInbound(inbound));
        channel.subscribe(MessageParser.MESSAGE_NAME, inboundListener);
    }

    @Override
    public Subscription subscribe(MessageListener listener) {
        ListenerRegistry.Registration registration = messageListeners.add(listener);
        return registration::remove;
    }

    @Override
    public Subscription subscribeReactionSummaries(MessageReactionListener listener) {
        ListenerRegistry.Registration registration = summaryListeners.add(listener);
        return registration::remove;
    }

    @Override
    public CompletableFuture<Void> send(String text, Map<String, Object> metadata, Map<String, Object> headers) {
        Objects.requireNonNull(text, "text");
        if (disposed.get()) {
            return CompletableFuture.failedFuture(ChatException.of(ErrorCode.ROOM_IS_RELEASED, 400,
                    "cannot send message, room is released"));
        }

        Map<String, Object> data = new HashMap<>();
        data.put("text", text);
        data.put("metadata", metadata == null ? Map.of() : metadata);
        Map<String, Object> extras = Map.of("headers", headers == null ? Map.of() : headers);

        return channel.publish(new OutboundMessage(MessageParser.MESSAGE_NAME, data, extras, false))
                .toCompletableFuture();
    }

    @Override
    public MessageWindow window() {
        return window;
    }

    @Override
    public String featureName() {
        return "messages";
    }

    @Override
    public ErrorCode attachmentErrorCode() {
        return ErrorCode.MESSAGES_ATTACHMENT_FAILED;
    }

    @Override
    public ErrorCode detachmentErrorCode() {
        return ErrorCode.MESSAGES_DETACHMENT_FAILED;
    }

    @Override
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        channel.unsubscribe(inboundListener);
        messageListeners.clear();
        summaryListeners.clear();
        log.debug("Room {}: messages disposed", roomName);
    }

    private void onInbound(InboundMessage inbound) {
        if (disposed.get()) {
            return;
        }
        try {
            if (MessageParser.isSummary(inbound)) {
                MessageReactionSummaryEvent summary = MessageParser.parseSummary(inbound);
                window.onReactionSummary(summary);
                summaryListeners.emit(summary, MessageReactionListener::onSummary,
                        e -> log.error("Room {}: reaction listener failed", roomName, e));
                return;
            }

            MessageEvent event = MessageEvent.of(MessageParser.parse(inbound));
            window.onMessageEvent(event);
            messageListeners.emit(event, MessageListener::onMessage,
                    e -> log.error("Room {}: message listener failed", roomName, e));
        } catch (ChatException e) {
            log.warn("Room {}: dropping invalid inbound message: {}", roomName, e.errorInfo());
        } catch (RuntimeException e) {
            log.warn("Room {}: dropping inbound message that could not be applied", roomName, e);
        }
    }
}
