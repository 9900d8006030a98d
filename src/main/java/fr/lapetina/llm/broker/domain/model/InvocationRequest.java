package fr.lapetina.llm.broker.domain.model;

import fr.lapetina.llm.broker.parsing.OutputSchema;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One logical "ask the model" request.
 * Immutable and thread-safe.
 */
public record InvocationRequest(
        String requestId,
        ModelSpec model,
        String prompt,
        List<Message> messages,
        OutputSchema<?> schema,
        Double temperature,
        Integer maxOutputTokens,
        Map<String, Object> options,
        BigDecimal costCeiling,
        Instant createdAt
) {
    public InvocationRequest {
        Objects.requireNonNull(model, "Model is required");
        if (prompt == null && (messages == null || messages.isEmpty())) {
            throw new IllegalArgumentException("Either prompt or messages must be provided");
        }
        if (costCeiling != null && costCeiling.signum() < 0) {
            throw new IllegalArgumentException("Cost ceiling must be non-negative");
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        messages = messages != null ? List.copyOf(messages) : List.of();
        options = options != null ? Map.copyOf(options) : Map.of();
    }

    /**
     * Chat message for conversation-style requests.
     */
    public record Message(String role, String content) {
        public Message {
            Objects.requireNonNull(role, "Role is required");
            Objects.requireNonNull(content, "Content is required");
        }
    }

    public static InvocationRequest ofPrompt(ModelSpec model, String prompt) {
        return builder().model(model).prompt(prompt).build();
    }

    public static InvocationRequest ofChat(ModelSpec model, List<Message> messages) {
        return builder().model(model).messages(messages).build();
    }

    /**
     * All prompt text sent to the model, used for cost estimation.
     */
    public String promptText() {
        if (messages.isEmpty()) {
            return prompt;
        }
        String chat = messages.stream().map(Message::content).collect(Collectors.joining("\n"));
        return prompt != null ? prompt + "\n" + chat : chat;
    }

    public int effectiveMaxOutputTokens() {
        return maxOutputTokens != null ? maxOutputTokens : model.defaultMaxOutputTokens();
    }

    public boolean isStructured() {
        return schema != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .requestId(requestId)
                .model(model)
                .prompt(prompt)
                .messages(messages)
                .schema(schema)
                .temperature(temperature)
                .maxOutputTokens(maxOutputTokens)
                .options(options)
                .costCeiling(costCeiling)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private ModelSpec model;
        private String prompt;
        private List<Message> messages;
        private OutputSchema<?> schema;
        private Double temperature;
        private Integer maxOutputTokens;
        private Map<String, Object> options;
        private BigDecimal costCeiling;
        private Instant createdAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder model(ModelSpec model) {
            this.model = model;
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder messages(List<Message> messages) {
            this.messages = messages;
            return this;
        }

        public Builder schema(OutputSchema<?> schema) {
            this.schema = schema;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public Builder options(Map<String, Object> options) {
            this.options = options;
            return this;
        }

        public Builder costCeiling(BigDecimal costCeiling) {
            this.costCeiling = costCeiling;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public InvocationRequest build() {
            return new InvocationRequest(
                    requestId, model, prompt, messages, schema, temperature,
                    maxOutputTokens, options, costCeiling, createdAt
            );
        }
    }
}
