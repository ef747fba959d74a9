package com.novelforge.providers.tokens;

import com.novelforge.models.Message;
import com.novelforge.models.ToolCall;

import java.util.List;

/**
 * Rough local estimate: four characters per token.
 */
public class CharacterTokenEstimator implements TokenEstimator {

    @Override
    public int estimateTokens(String model, List<Message> messages) {
        long chars = 0;
        for (Message message : messages) {
            chars += length(message.getContent());
            chars += length(message.getReasoning());
            if (message.hasToolCalls()) {
                for (ToolCall call : message.getToolCalls()) {
                    chars += length(call.getFunctionName()) + length(call.getArgumentsJson());
                }
            }
        }
        return (int) Math.min(Integer.MAX_VALUE, chars / 4);
    }

    private static int length(String s) {
        return s == null ? 0 : s.length();
    }
}
