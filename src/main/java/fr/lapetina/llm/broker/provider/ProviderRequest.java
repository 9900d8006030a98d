package fr.lapetina.llm.broker.provider;

import fr.lapetina.llm.broker.domain.model.InvocationRequest;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized request handed to a {@link ProviderAdapter}.
 */
public record ProviderRequest(
        String requestId,
        String model,
        String prompt,
        List<InvocationRequest.Message> messages,
        Double temperature,
        int maxOutputTokens,
        Map<String, Object> options,
        int attempt
) {
    public ProviderRequest {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(model, "Model is required");
        messages = messages != null ? List.copyOf(messages) : List.of();
        options = options != null ? Map.copyOf(options) : Map.of();
    }

    public static ProviderRequest from(InvocationRequest request) {
        return new ProviderRequest(
                request.requestId(),
                request.model().name(),
                request.prompt(),
                request.messages(),
                request.temperature(),
                request.effectiveMaxOutputTokens(),
                request.options(),
                0
        );
    }

    public ProviderRequest withAttempt(int attempt) {
        return new ProviderRequest(requestId, model, prompt, messages, temperature,
                maxOutputTokens, options, attempt);
    }
}
