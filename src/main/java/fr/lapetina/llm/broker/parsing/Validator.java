package fr.lapetina.llm.broker.parsing;

import java.util.List;

/**
 * Semantic check run on a decoded value (bounds, required fields, cross-field rules).
 */
@FunctionalInterface
public interface Validator<T> {

    /**
     * @return human-readable problems, empty when the value is acceptable
     */
    List<String> validate(T value);

    static <T> Validator<T> none() {
        return value -> List.of();
    }
}
