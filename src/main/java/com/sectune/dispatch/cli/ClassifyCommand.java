package com.sectune.dispatch.cli;

import com.sectune.core.classifier.ClassificationService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * CLI command: sectune classify &lt;conversationId&gt;
 * <p>
 * Classifies one conversation synchronously and prints the stored record.
 */
@Command(name = "classify", mixinStandardHelpOptions = true,
        description = "Classify a stored conversation")
@Component
public class ClassifyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Conversation ID")
    private String conversationId;

    private final ClassificationService classificationService;

    public ClassifyCommand(ClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var record = classificationService.classifyConversation(conversationId);
        if (record.isEmpty()) {
            ConsoleOutput.error("Conversation not found: " + conversationId);
            return 1;
        }
        var r = record.get();
        String summary = "%s: confidence %.2f, category %s".formatted(conversationId, r.confidence(),
                r.threatCategory() == null ? "none" : r.threatCategory().label());
        if (r.securityRelated()) {
            ConsoleOutput.success("Security-related " + summary);
        } else {
            ConsoleOutput.info("Not security-related " + summary);
        }
        if (!r.matchedKeywords().isEmpty()) {
            ConsoleOutput.info("Keywords: " + String.join(", ", new TreeSet<>(r.matchedKeywords())));
        }
        if (r.processedForTraining()) {
            ConsoleOutput.info("Claimed by job " + r.trainingJobId());
        }
        return 0;
    }
}
