package com.phillippitts.liveagent.service.vision;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Attaches when the turn text contains any configured keyword, ignoring case.
 * Keywords are substring matches, so multi-word phrases work as written.
 */
public final class KeywordAttachmentPolicy implements TurnAttachmentPolicy {

    private final List<String> keywords;

    public KeywordAttachmentPolicy(Collection<String> keywords) {
        this.keywords = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public boolean shouldAttach(String turnText) {
        if (turnText == null || turnText.isBlank()) {
            return false;
        }
        String lower = turnText.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public List<String> keywords() {
        return keywords;
    }
}
