package com.sectune.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sectune.core.model.ChatMessage;
import com.sectune.core.model.Hyperparameters;
import com.sectune.core.model.TrainingExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * {@link FineTuningProvider} for the OpenAI fine-tuning API (and compatible servers).
 *
 * <p>Training files are uploaded as JSONL to {@code /v1/files} with purpose
 * {@code fine-tune}; jobs are created and polled under {@code /v1/fine_tuning/jobs}.
 * Fine-tuned models are invoked through the Spring AI {@link ChatClient} with the
 * model overridden per call.
 */
public class OpenAiFineTuningProvider implements FineTuningProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiFineTuningProvider.class);

    private final ProviderProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TrainingFileWriter fileWriter;
    private final ChatClient chatClient;

    public OpenAiFineTuningProvider(ProviderProperties properties, HttpClient httpClient,
                                    ObjectMapper objectMapper, ChatClient chatClient) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.fileWriter = new TrainingFileWriter(objectMapper);
        this.chatClient = chatClient;
    }

    @Override
    public String submit(String fileName, List<TrainingExample> examples, String baseModel,
                         Hyperparameters hyperparameters) {
        String fileId = uploadTrainingFile(fileName, fileWriter.toJsonl(examples));

        ObjectNode body = objectMapper.createObjectNode();
        body.put("training_file", fileId);
        body.put("model", baseModel);
        if (hyperparameters != null) {
            body.putObject("hyperparameters")
                    .put("n_epochs", hyperparameters.epochs())
                    .put("batch_size", hyperparameters.batchSize())
                    .put("learning_rate_multiplier", hyperparameters.learningRateMultiplier());
        }

        var response = post("/v1/fine_tuning/jobs", body.toString(), requestTimeout());
        var jobId = response.get("id").asText();
        log.info("Created provider fine-tuning job {} (file={}, model={}, examples={})",
                jobId, fileId, baseModel, examples.size());
        return jobId;
    }

    @Override
    public ProviderJobStatus status(String providerJobId) {
        var response = get("/v1/fine_tuning/jobs/" + providerJobId,
                Duration.ofSeconds(properties.getPollTimeoutSeconds()));
        String raw = textOrNull(response, "status");
        String model = textOrNull(response, "fine_tuned_model");
        String error = null;
        var errorNode = response.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            error = errorNode.has("message") ? textOrNull(errorNode, "message") : errorNode.toString();
        }
        return new ProviderJobStatus(mapState(raw), raw, model, error);
    }

    @Override
    public String complete(String modelId, List<ChatMessage> messages) {
        requireApiKey();
        try {
            return chatClient.prompt()
                    .options(ChatOptions.builder().model(modelId).build())
                    .messages(toPromptMessages(messages))
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new FineTuningProviderException("Model invocation failed for " + modelId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "openai";
    }

    /**
     * Maps the provider's job status string to a {@link ProviderJobState}.
     */
    static ProviderJobState mapState(String raw) {
        if (raw == null) {
            return ProviderJobState.UNKNOWN;
        }
        return switch (raw.toLowerCase()) {
            case "validating_files", "queued" -> ProviderJobState.QUEUED;
            case "running" -> ProviderJobState.RUNNING;
            case "succeeded" -> ProviderJobState.SUCCEEDED;
            case "failed" -> ProviderJobState.FAILED;
            case "cancelled" -> ProviderJobState.CANCELLED;
            default -> ProviderJobState.UNKNOWN;
        };
    }

    static List<Message> toPromptMessages(List<ChatMessage> messages) {
        return messages.stream()
                .map(OpenAiFineTuningProvider::toPromptMessage)
                .toList();
    }

    private static Message toPromptMessage(ChatMessage message) {
        return switch (message.role()) {
            case SYSTEM -> new SystemMessage(message.content());
            case USER -> new UserMessage(message.content());
            case ASSISTANT -> new AssistantMessage(message.content());
        };
    }

    private String uploadTrainingFile(String fileName, String jsonl) {
        String boundary = "sectune-" + UUID.randomUUID();
        String body = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"purpose\"\r\n\r\n"
                + "fine-tune\r\n"
                + "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"" + fileName + "\"\r\n"
                + "Content-Type: application/jsonl\r\n\r\n"
                + jsonl + "\r\n"
                + "--" + boundary + "--\r\n";

        var request = baseRequest("/v1/files", requestTimeout())
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        var response = send(request, "POST /v1/files");
        var fileId = response.get("id").asText();
        log.info("Uploaded training file '{}' as {} ({} bytes)", fileName, fileId,
                jsonl.getBytes(StandardCharsets.UTF_8).length);
        return fileId;
    }

    JsonNode get(String path, Duration timeout) {
        var request = baseRequest(path, timeout).GET().build();
        return send(request, "GET " + path);
    }

    JsonNode post(String path, String body, Duration timeout) {
        var request = baseRequest(path, timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return send(request, "POST " + path);
    }

    private HttpRequest.Builder baseRequest(String path, Duration timeout) {
        requireApiKey();
        return HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + path))
                .timeout(timeout)
                .header("Authorization", "Bearer " + properties.getApiKey())
                .header("Accept", "application/json");
    }

    private JsonNode send(HttpRequest request, String description) {
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new FineTuningProviderException("Provider %s failed (HTTP %d): %s"
                        .formatted(description, response.statusCode(), response.body()));
            }
            return objectMapper.readTree(response.body());
        } catch (HttpTimeoutException e) {
            throw new ProviderTimeoutException("Provider request timed out: " + description, e);
        } catch (IOException e) {
            throw new FineTuningProviderException("Provider request failed: " + description, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FineTuningProviderException("Interrupted during provider request: " + description, e);
        }
    }

    private void requireApiKey() {
        if (!properties.hasApiKey()) {
            throw new FineTuningProviderException(
                    "Provider API key not configured. Set sectune.provider.api-key (SECTUNE_PROVIDER_API_KEY).");
        }
    }

    private Duration requestTimeout() {
        return Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }

    private static String textOrNull(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
