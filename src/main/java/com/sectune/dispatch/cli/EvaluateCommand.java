package com.sectune.dispatch.cli;

import com.sectune.core.evaluation.PerformanceEvaluator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: sectune evaluate &lt;modelId&gt; [--history]
 */
@Command(name = "evaluate", mixinStandardHelpOptions = true,
        description = "Evaluate a fine-tuned model on held-out conversations")
@Component
public class EvaluateCommand implements Runnable {

    @Parameters(index = "0", description = "Fine-tuned model ID")
    private String modelId;

    @Option(names = {"--history"}, description = "Show stored evaluations instead of running a new one")
    private boolean history;

    private final PerformanceEvaluator evaluator;

    public EvaluateCommand(PerformanceEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (history) {
            var records = evaluator.history(modelId);
            if (records.isEmpty()) {
                ConsoleOutput.info("No evaluations recorded for " + modelId);
                return;
            }
            System.out.printf("  %-26s %-10s %-7s %s%n", "DATE", "TYPE", "SCORE", "SAMPLES");
            System.out.println("  " + "-".repeat(56));
            for (var r : records) {
                System.out.printf("  %-26s %-10s %-7.3f %d%n",
                        r.evaluationDate(), r.evaluationType(), r.score(), r.testDataSize());
            }
            return;
        }
        evaluator.evaluate(modelId).ifPresentOrElse(
                r -> ConsoleOutput.success("%s %s: %.3f over %d conversations"
                        .formatted(modelId, r.evaluationType(), r.score(), r.testDataSize())),
                () -> ConsoleOutput.info("No held-out conversations available; nothing recorded"));
    }
}
