package com.sectune.dispatch.api;

import com.sectune.core.classifier.ConversationCompletionHook;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives completion notifications from the chat system.
 */
@RestController
@RequestMapping("/api/v1/conversations")
public class ConversationController {

    private final ConversationCompletionHook completionHook;

    public ConversationController(ConversationCompletionHook completionHook) {
        this.completionHook = completionHook;
    }

    /**
     * POST /api/v1/conversations/{id}/completed: Queues classification and
     * returns 202 without waiting for it.
     */
    @PostMapping("/{id}/completed")
    public ResponseEntity<Map<String, String>> completed(@PathVariable String id) {
        completionHook.onConversationCompleted(id);
        return ResponseEntity.accepted().body(Map.of("conversation_id", id, "status", "QUEUED"));
    }
}
