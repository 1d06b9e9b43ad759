package com.phillippitts.liveagent.service.vision;

import java.util.Collection;
import java.util.Objects;

/**
 * Decides whether a user turn should carry the latest camera snapshot.
 *
 * <p>Only the turn text is consulted; snapshot freshness is checked separately by the
 * conversation context.
 */
@FunctionalInterface
public interface TurnAttachmentPolicy {

    boolean shouldAttach(String turnText);

    static TurnAttachmentPolicy always() {
        return text -> true;
    }

    static TurnAttachmentPolicy never() {
        return text -> false;
    }

    static TurnAttachmentPolicy keywords(Collection<String> keywords) {
        return new KeywordAttachmentPolicy(keywords);
    }

    static TurnAttachmentPolicy forMode(AttachMode mode, Collection<String> keywords) {
        Objects.requireNonNull(mode, "mode");
        return switch (mode) {
            case ALWAYS -> always();
            case NEVER -> never();
            case AUTO -> keywords(keywords);
        };
    }
}
