package me.golemcore.flow.domain.service;

import me.golemcore.flow.domain.model.ChatHistory;
import me.golemcore.flow.domain.model.Message;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryConversationStoreTest {

    private static ChatHistory history(int size) {
        ChatHistory history = new ChatHistory();
        for (int i = 0; i < size; i++) {
            history.append(Message.builder().role(Message.ROLE_USER).content("m" + i).build());
        }
        return history;
    }

    @Test
    void shouldReturnCopyOfStoredHistory() {
        InMemoryConversationStore store = new InMemoryConversationStore(4, 100);
        ChatHistory original = history(2);
        store.put("wf", original);

        original.append(Message.builder().role(Message.ROLE_USER).content("later").build());
        ChatHistory loaded = store.get("wf").orElseThrow();

        assertEquals(2, loaded.size());
        loaded.append(Message.builder().role(Message.ROLE_USER).content("mutation").build());
        assertEquals(2, store.get("wf").orElseThrow().size());
    }

    @Test
    void shouldKeepOnlyNewestMessages() {
        InMemoryConversationStore store = new InMemoryConversationStore(4, 3);
        store.put("wf", history(5));

        ChatHistory loaded = store.get("wf").orElseThrow();

        assertEquals(3, loaded.size());
        assertEquals("m2", loaded.messages().get(0).getContent());
    }

    @Test
    void shouldEvictLeastRecentlyUsedWorkflow() {
        InMemoryConversationStore store = new InMemoryConversationStore(2, 10);
        store.put("a", history(1));
        store.put("b", history(1));
        store.get("a");
        store.put("c", history(1));

        assertEquals(2, store.size());
        assertTrue(store.get("a").isPresent());
        assertEquals(Optional.empty(), store.get("b"));
    }

    @Test
    void shouldRemoveWorkflow() {
        InMemoryConversationStore store = new InMemoryConversationStore(2, 10);
        store.put("a", history(1));
        store.remove("a");

        assertTrue(store.get("a").isEmpty());
    }

    @Test
    void shouldRejectInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryConversationStore(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new InMemoryConversationStore(1, 0));
    }
}
