package com.sectune.core.dataset;

import com.sectune.core.model.ClassificationResult;
import com.sectune.core.model.Conversation;
import com.sectune.core.model.MessageRole;
import com.sectune.core.model.ThreatCategory;
import com.sectune.core.model.TrainingExample;
import org.springframework.stereotype.Component;

/**
 * Turns a classified conversation into a training example.
 * <p>
 * The system prompt comes from a fixed template whose only variable is the threat
 * category. The source conversation's own system messages are dropped.
 */
@Component
public class TrainingExampleFormatter {

    static final String SYSTEM_PROMPT_TEMPLATE =
            "You are a cybersecurity analyst assistant specializing in %s threats. "
            + "Give accurate, actionable guidance grounded in established security practice.";

    static final String GENERAL_TOPIC = "general security";

    public TrainingExample format(Conversation conversation, ClassificationResult classification) {
        ThreatCategory category = classification.threatCategory();
        return new TrainingExample(
                conversation.id(),
                systemPrompt(category),
                conversation.joinedContent(MessageRole.USER),
                conversation.joinedContent(MessageRole.ASSISTANT),
                classification.confidence(),
                category);
    }

    public static String systemPrompt(ThreatCategory category) {
        return SYSTEM_PROMPT_TEMPLATE.formatted(category == null ? GENERAL_TOPIC : category.displayName());
    }
}
