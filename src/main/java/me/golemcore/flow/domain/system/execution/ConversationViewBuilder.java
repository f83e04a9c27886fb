package me.golemcore.flow.domain.system.execution;

import me.golemcore.flow.domain.model.ChatHistory;

/**
 * Builds the request-time conversation view sent to the model.
 */
public interface ConversationViewBuilder {

    ConversationView buildView(ChatHistory history);
}
