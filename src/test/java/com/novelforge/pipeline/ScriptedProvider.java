package com.novelforge.pipeline;

import com.novelforge.providers.chat.ModelProvider;
import com.novelforge.providers.chat.ModelRequest;
import com.novelforge.stream.ModelStream;
import com.novelforge.stream.StreamEvent;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Provider fake that replays queued replies and records every request.
 */
class ScriptedProvider implements ModelProvider {

    private final Deque<Object> replies = new ArrayDeque<>();
    final List<ModelRequest> streamRequests = new ArrayList<>();
    final List<ModelRequest> completeRequests = new ArrayList<>();
    String summary = "The architect planned three chunks.";
    IOException completeFailure;

    ScriptedProvider reply(StreamEvent... events) {
        replies.add(List.of(events));
        return this;
    }

    ScriptedProvider fail(IOException error) {
        replies.add(error);
        return this;
    }

    @Override
    public String getProviderName() {
        return "scripted";
    }

    @Override
    @SuppressWarnings("unchecked")
    public ModelStream openStream(ModelRequest request) throws IOException {
        streamRequests.add(request);
        Object next = replies.poll();
        if (next == null) {
            throw new IllegalStateException("No scripted reply left");
        }
        if (next instanceof IOException) {
            throw (IOException) next;
        }
        return ModelStream.of((List<StreamEvent>) next);
    }

    @Override
    public String complete(ModelRequest request) throws IOException {
        completeRequests.add(request);
        if (completeFailure != null) {
            throw completeFailure;
        }
        return summary;
    }
}
