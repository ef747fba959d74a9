package com.novelforge.providers.chat;

import com.novelforge.stream.ModelStream;

import java.io.IOException;

/**
 * A remote chat model. Provider-specific quirks stay behind this interface.
 */
public interface ModelProvider {

    String getProviderName();

    /**
     * Start a streamed completion. Failures to connect surface here and may be retried;
     * the returned stream is consumed once.
     */
    ModelStream openStream(ModelRequest request) throws IOException, InterruptedException;

    /**
     * Non-streamed completion returning the reply text.
     */
    String complete(ModelRequest request) throws IOException, InterruptedException;
}
