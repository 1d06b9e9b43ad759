package com.phillippitts.liveagent.service.context;

/**
 * Observer of conversational turns, used for transcript logging.
 */
@FunctionalInterface
public interface TurnListener {

    /**
     * @param role speaker of the turn, {@code USER} or {@code ASSISTANT}
     * @param text turn text with images rendered as {@code [image]}
     */
    void onTurn(ChatMessage.Role role, String text);
}
