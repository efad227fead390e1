package com.sectune.core.classifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Entry point called by the chat system when a conversation finishes.
 * <p>
 * Returns immediately; classification runs on the {@code classificationExecutor}
 * pool. Failures are logged and never reach the caller. Repeated notifications
 * for the same conversation are harmless because classification is idempotent.
 */
@Component
public class ConversationCompletionHook {

    private static final Logger log = LoggerFactory.getLogger(ConversationCompletionHook.class);

    private final ClassificationService classificationService;
    private final TaskExecutor executor;

    public ConversationCompletionHook(ClassificationService classificationService,
                                      @Qualifier("classificationExecutor") TaskExecutor executor) {
        this.classificationService = classificationService;
        this.executor = executor;
    }

    public void onConversationCompleted(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            log.warn("Ignoring completion notification without a conversation id");
            return;
        }
        try {
            executor.execute(() -> classifyQuietly(conversationId));
        } catch (TaskRejectedException e) {
            log.warn("Classification queue full; dropped conversation {}", conversationId);
        }
    }

    private void classifyQuietly(String conversationId) {
        try {
            classificationService.classifyConversation(conversationId);
        } catch (RuntimeException e) {
            log.error("Background classification failed for conversation {}", conversationId, e);
        }
    }
}
