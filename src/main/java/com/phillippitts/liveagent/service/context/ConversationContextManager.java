package com.phillippitts.liveagent.service.context;

import com.phillippitts.liveagent.config.properties.ContextProperties;
import com.phillippitts.liveagent.service.vision.AttachmentOutcome;
import com.phillippitts.liveagent.service.vision.SnapshotAttacher;
import com.phillippitts.liveagent.service.vision.TurnAttachmentPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered message history of one session.
 *
 * <p>The system prompt is always the first message. Seeded prior-call messages, if any, follow it
 * behind a system note. The history is appended to by the user-turn and language-model stages and
 * read as an immutable snapshot per model request.
 *
 * <p>Whether a user turn carries the camera snapshot is decided by the {@link TurnAttachmentPolicy}
 * given at construction; freshness and encoding are delegated to a {@link SnapshotAttacher}.
 *
 * <p>Thread-safe.
 */
public class ConversationContextManager {

    private static final Logger LOG = LogManager.getLogger(ConversationContextManager.class);

    private final Object lock = new Object();
    private final List<ChatMessage> messages = new ArrayList<>();
    private final List<TurnListener> listeners = new CopyOnWriteArrayList<>();
    private final TurnAttachmentPolicy attachmentPolicy;
    private final SnapshotAttacher attacher;
    private final ContextProperties properties;
    private boolean seeded;

    /**
     * @param systemPrompt     first message of every request
     * @param attachmentPolicy decides per turn whether to attach the snapshot
     * @param attacher         snapshot source, or {@code null} when vision is off
     * @param properties       seeding and transcript limits
     */
    public ConversationContextManager(String systemPrompt, TurnAttachmentPolicy attachmentPolicy,
                                      SnapshotAttacher attacher, ContextProperties properties) {
        this.attachmentPolicy = Objects.requireNonNull(attachmentPolicy, "attachmentPolicy");
        this.attacher = attacher;
        this.properties = Objects.requireNonNull(properties, "properties");
        messages.add(ChatMessage.system(Objects.requireNonNull(systemPrompt, "systemPrompt")));
    }

    /**
     * Text-only context.
     */
    public static ConversationContextManager withoutVision(String systemPrompt, ContextProperties properties) {
        return new ConversationContextManager(systemPrompt, TurnAttachmentPolicy.never(), null, properties);
    }

    /**
     * Appends a plain-text turn.
     */
    public void addTurn(ChatMessage.Role role, String content) {
        add(new ChatMessage(role, content, null, null, null));
    }

    /**
     * Appends a message and notifies listeners for user and assistant text.
     */
    public void add(ChatMessage message) {
        Objects.requireNonNull(message, "message");
        synchronized (lock) {
            messages.add(message);
        }
        if (message.isConversational() && !message.text().isEmpty()) {
            notifyListeners(message);
        }
    }

    /**
     * Appends a user turn, attaching the camera snapshot when the policy and freshness allow.
     *
     * @return what happened to the snapshot
     */
    public AttachmentOutcome addUserTurn(String text) {
        if (attacher == null) {
            add(ChatMessage.user(text));
            return AttachmentOutcome.DISABLED;
        }
        if (!attachmentPolicy.shouldAttach(text)) {
            add(ChatMessage.user(text));
            return AttachmentOutcome.DECLINED;
        }
        SnapshotAttacher.Attachment attachment = attacher.resolve();
        add(attachment.attached() ? ChatMessage.userWithImage(text, attachment.imageUrl()) : ChatMessage.user(text));
        LOG.debug("User turn snapshot: {}", attachment.outcome());
        return attachment.outcome();
    }

    /**
     * Inserts prior-call messages after the system prompt. Only user and assistant messages are
     * kept, the most recent ones up to the configured count, each cut to the configured length.
     * A session is seeded at most once, before its first turn.
     *
     * @return number of messages seeded
     * @throws IllegalStateException if the session already has turns or was seeded
     */
    public int seed(List<ChatMessage> priorMessages) {
        List<ChatMessage> kept = new ArrayList<>();
        for (ChatMessage message : priorMessages) {
            if (message.isConversational() && !message.text().isBlank()) {
                kept.add(message.truncated(properties.getMemoryMaxChars()));
            }
        }
        int limit = properties.getMemoryMaxMessages();
        if (kept.size() > limit) {
            kept = kept.subList(kept.size() - limit, kept.size());
        }
        synchronized (lock) {
            if (seeded || messages.size() > 1) {
                throw new IllegalStateException("Context can only be seeded before the first turn");
            }
            seeded = true;
            if (kept.isEmpty()) {
                return 0;
            }
            messages.add(ChatMessage.system(properties.getMemoryPreamble()));
            messages.addAll(kept);
        }
        LOG.info("Seeded context with {} prior messages", kept.size());
        return kept.size();
    }

    /**
     * Immutable snapshot of the history.
     */
    public List<ChatMessage> messages() {
        synchronized (lock) {
            return List.copyOf(messages);
        }
    }

    public Optional<ChatMessage> lastUserMessage() {
        synchronized (lock) {
            for (int i = messages.size() - 1; i >= 0; i--) {
                if (messages.get(i).role() == ChatMessage.Role.USER) {
                    return Optional.of(messages.get(i));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * The last {@code count} user and assistant messages, oldest first.
     */
    public List<ChatMessage> finalTurns(int count) {
        List<ChatMessage> turns = new ArrayList<>();
        synchronized (lock) {
            for (ChatMessage message : messages) {
                if (message.isConversational() && !message.text().isEmpty()) {
                    turns.add(message);
                }
            }
        }
        return List.copyOf(turns.subList(Math.max(0, turns.size() - count), turns.size()));
    }

    public void addTurnListener(TurnListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    private void notifyListeners(ChatMessage message) {
        String text = message.textForLog(properties.getTranscriptMaxChars());
        for (TurnListener listener : listeners) {
            try {
                listener.onTurn(message.role(), text);
            } catch (RuntimeException e) {
                LOG.warn("Turn listener {} failed; transcript entry dropped", listener, e);
            }
        }
    }
}
