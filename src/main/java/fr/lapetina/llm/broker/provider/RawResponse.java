package fr.lapetina.llm.broker.provider;

import fr.lapetina.llm.broker.domain.model.TokenUsage;

import java.math.BigDecimal;

/**
 * Successful provider answer. {@code reportedCost} is null when the provider does not report one.
 */
public record RawResponse(String text, TokenUsage usage, BigDecimal reportedCost) {

    public RawResponse {
        text = text != null ? text : "";
        usage = usage != null ? usage : TokenUsage.ZERO;
    }

    public static RawResponse of(String text, TokenUsage usage) {
        return new RawResponse(text, usage, null);
    }
}
