package fr.lapetina.llm.broker.parsing;

import com.fasterxml.jackson.core.type.TypeReference;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Target type for structured output, with an optional validator and an optional field
 * description used in correction prompts (derived from the type when absent).
 */
public final class OutputSchema<T> {

    private final Type type;
    private final String description;
    private final Validator<T> validator;

    private OutputSchema(Type type, String description, Validator<T> validator) {
        this.type = Objects.requireNonNull(type, "type");
        this.description = description;
        this.validator = validator != null ? validator : Validator.none();
    }

    public static <T> OutputSchema<T> of(Class<T> type) {
        return new OutputSchema<>(type, null, null);
    }

    /**
     * Schema for generic targets, e.g. {@code new TypeReference<List<Forecast>>() {}}.
     */
    public static <T> OutputSchema<T> of(TypeReference<T> type) {
        return new OutputSchema<>(type.getType(), null, null);
    }

    public OutputSchema<T> withValidator(Validator<T> validator) {
        return new OutputSchema<>(type, description, validator);
    }

    public OutputSchema<T> withDescription(String description) {
        return new OutputSchema<>(type, description, validator);
    }

    public Type getType() {
        return type;
    }

    /**
     * @return the explicit field description, or null to derive it from the type
     */
    public String getDescription() {
        return description;
    }

    public Validator<T> getValidator() {
        return validator;
    }

    @Override
    public String toString() {
        return "OutputSchema{" + type.getTypeName() + '}';
    }
}
