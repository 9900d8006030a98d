package fr.lapetina.llm.broker.parsing;

import fr.lapetina.llm.broker.domain.model.InvocationResult;

import java.util.List;

/**
 * Successfully decoded structured output.
 *
 * @param rawText     the model text the value was decoded from
 * @param attempts    decode attempts, the successful one included
 * @param corrections results of the correction calls, in order
 */
public record ParsedOutput<T>(T value, String rawText, int attempts, List<InvocationResult> corrections) {

    public ParsedOutput {
        corrections = corrections != null ? List.copyOf(corrections) : List.of();
    }
}
