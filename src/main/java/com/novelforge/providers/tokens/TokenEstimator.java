package com.novelforge.providers.tokens;

import com.novelforge.models.Message;

import java.util.List;

/**
 * Estimates the prompt size of a conversation in tokens.
 */
public interface TokenEstimator {

    int estimateTokens(String model, List<Message> messages);
}
