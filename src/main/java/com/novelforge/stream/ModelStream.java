package com.novelforge.stream;

import java.io.Closeable;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * Blocking source of stream events for one model reply.
 */
public interface ModelStream extends Closeable {

    /**
     * Returns the next event, or null once the reply is exhausted.
     */
    StreamEvent nextEvent() throws IOException;

    @Override
    default void close() throws IOException {
    }

    /**
     * In-memory stream over a fixed list of events.
     */
    static ModelStream of(List<StreamEvent> events) {
        Iterator<StreamEvent> it = events.iterator();
        return () -> it.hasNext() ? it.next() : null;
    }
}
