package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.model.Message;

import java.util.List;

/**
 * Request-time projection of conversation history.
 *
 * <p>
 * Raw history must never be mutated. Any normalization for the provider must be
 * represented as a view.
 */
public record ConversationView(List<Message> messages, List<String> diagnostics) {

    public ConversationView {
        messages = messages == null ? List.of() : List.copyOf(messages);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static ConversationView ofMessages(List<Message> messages) {
        return new ConversationView(messages, List.of());
    }
}
