package com.novelforge.stream;

import com.novelforge.models.Message;
import com.novelforge.models.ToolCall;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Rebuilds one assistant {@link Message} from a stream of partial events.
 *
 * Per tool-call index: id and name are overwritten when a fragment carries a non-empty
 * value, argument fragments are always appended. This is the single place where the
 * canonical {@link ToolCall} shape is produced, including ids for providers that omit them.
 */
public class StreamAssembler {

    /**
     * Receives content and reasoning fragments as they arrive.
     */
    @FunctionalInterface
    public interface FragmentListener {
        void onFragment(String text, boolean reasoning);
    }

    private final StringBuilder content = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private final Map<Integer, PartialCall> calls = new TreeMap<>();
    private final FragmentListener listener;
    private String finishReason;

    public StreamAssembler(FragmentListener listener) {
        this.listener = listener;
    }

    public StreamAssembler() {
        this(null);
    }

    /**
     * Drain the stream and return the assembled message. The stream is closed afterwards.
     */
    public Message assemble(ModelStream stream) throws IOException {
        try (ModelStream s = stream) {
            StreamEvent event;
            while ((event = s.nextEvent()) != null) {
                accept(event);
            }
        }
        return build();
    }

    public void accept(StreamEvent event) {
        if (event.getReasoning() != null && !event.getReasoning().isEmpty()) {
            reasoning.append(event.getReasoning());
            notifyListener(event.getReasoning(), true);
        }
        if (event.getContent() != null && !event.getContent().isEmpty()) {
            content.append(event.getContent());
            notifyListener(event.getContent(), false);
        }
        for (ToolCallDelta delta : event.getToolCalls()) {
            PartialCall call = calls.computeIfAbsent(delta.getIndex(), i -> new PartialCall());
            if (delta.getId() != null && !delta.getId().isEmpty()) {
                call.id = delta.getId();
            }
            if (delta.getName() != null && !delta.getName().isEmpty()) {
                call.name = delta.getName();
            }
            if (delta.getArgumentsFragment() != null) {
                call.arguments.append(delta.getArgumentsFragment());
            }
        }
        if (event.getFinishReason() != null) {
            finishReason = event.getFinishReason();
        }
    }

    public Message build() {
        List<ToolCall> toolCalls = new ArrayList<>();
        String batch = null;
        for (Map.Entry<Integer, PartialCall> entry : calls.entrySet()) {
            PartialCall call = entry.getValue();
            if (!call.isPopulated()) {
                continue;
            }
            String id = call.id;
            if (id == null) {
                if (batch == null) {
                    batch = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
                }
                id = "call_" + batch + "_" + entry.getKey();
            }
            toolCalls.add(new ToolCall(id, call.name == null ? "" : call.name, call.arguments.toString()));
        }
        return Message.assistant(
            content.length() == 0 ? null : content.toString(),
            reasoning.length() == 0 ? null : reasoning.toString(),
            toolCalls
        );
    }

    public String getFinishReason() {
        return finishReason;
    }

    private void notifyListener(String text, boolean isReasoning) {
        if (listener != null) {
            listener.onFragment(text, isReasoning);
        }
    }

    private static final class PartialCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();

        private boolean isPopulated() {
            return id != null || name != null || arguments.length() > 0;
        }
    }
}
