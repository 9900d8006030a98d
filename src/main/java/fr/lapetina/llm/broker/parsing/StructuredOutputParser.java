package fr.lapetina.llm.broker.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llm.broker.domain.model.InvocationRequest;
import fr.lapetina.llm.broker.domain.model.InvocationResult;
import fr.lapetina.llm.broker.exception.LlmBrokerException;
import fr.lapetina.llm.broker.exception.ParseExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Decodes model text into typed values, asking the model to fix its own output when decoding
 * or validation fails.
 *
 * Correction calls go through the caller-supplied re-invoke function, so they are rate-limited,
 * retried and charged exactly like fresh requests.
 */
public final class StructuredOutputParser {

    private static final Logger log = LoggerFactory.getLogger(StructuredOutputParser.class);

    public static final int DEFAULT_MAX_PARSE_ATTEMPTS = 3;

    private final ObjectMapper objectMapper;
    private final int maxParseAttempts;

    public StructuredOutputParser() {
        this(defaultObjectMapper(), DEFAULT_MAX_PARSE_ATTEMPTS);
    }

    public StructuredOutputParser(int maxParseAttempts) {
        this(defaultObjectMapper(), maxParseAttempts);
    }

    public StructuredOutputParser(ObjectMapper objectMapper, int maxParseAttempts) {
        if (maxParseAttempts < 1) {
            throw new IllegalArgumentException("maxParseAttempts must be >= 1");
        }
        this.objectMapper = objectMapper;
        this.maxParseAttempts = maxParseAttempts;
    }

    /**
     * Lenient mapper for model output: unknown properties ignored, enums case-insensitive,
     * java.time types supported.
     */
    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
    }

    public int getMaxParseAttempts() {
        return maxParseAttempts;
    }

    /**
     * Single decode attempt: extract, bind, validate.
     *
     * @throws OutputDecodingException on any failure
     */
    public <T> T decode(String rawText, OutputSchema<T> schema) {
        String json = JsonExtractor.extract(rawText);
        JavaType type = objectMapper.constructType(schema.getType());

        T value;
        try {
            value = objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new OutputDecodingException("Invalid JSON for " + type.getRawClass().getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
        if (value == null) {
            throw new OutputDecodingException("Model output decoded to null");
        }

        List<String> problems;
        try {
            problems = schema.getValidator().validate(value);
        } catch (RuntimeException e) {
            throw new OutputDecodingException("Validation failed: " + e, e);
        }
        if (problems != null && !problems.isEmpty()) {
            throw new OutputDecodingException("Validation failed: " + String.join("; ", problems));
        }
        return value;
    }

    /**
     * Decodes {@code rawText}, re-invoking the model with a correction request on failure,
     * up to the configured number of decode attempts.
     *
     * <p>Fails with {@link ParseExhaustedException} once attempts are used up, or with whatever
     * error a correction call produced.
     */
    public <T> CompletableFuture<ParsedOutput<T>> parse(
            InvocationRequest original,
            String rawText,
            OutputSchema<T> schema,
            Function<InvocationRequest, CompletableFuture<InvocationResult>> reinvoke
    ) {
        CompletableFuture<ParsedOutput<T>> result = new CompletableFuture<>();
        attempt(original, rawText, schema, reinvoke, 1, new ArrayList<>(), result);
        return result;
    }

    private <T> void attempt(
            InvocationRequest original,
            String rawText,
            OutputSchema<T> schema,
            Function<InvocationRequest, CompletableFuture<InvocationResult>> reinvoke,
            int attempt,
            List<InvocationResult> corrections,
            CompletableFuture<ParsedOutput<T>> result
    ) {
        T value;
        try {
            value = decode(rawText, schema);
        } catch (OutputDecodingException e) {
            if (attempt >= maxParseAttempts) {
                log.warn("Structured output exhausted: requestId={}, attempts={}, error={}",
                        original.requestId(), attempt, e.getMessage());
                result.completeExceptionally(new ParseExhaustedException(attempt, rawText, e));
                return;
            }

            log.info("Structured output invalid, requesting correction: requestId={}, attempt={}, error={}",
                    original.requestId(), attempt, e.getMessage());

            InvocationRequest correction = correctionRequest(original, rawText, e.getMessage(), schema, attempt);
            CompletableFuture<InvocationResult> call;
            try {
                call = reinvoke.apply(correction);
            } catch (RuntimeException invokeError) {
                call = CompletableFuture.failedFuture(invokeError);
            }
            call.whenComplete((corrected, error) -> {
                if (error != null) {
                    result.completeExceptionally(LlmBrokerException.unwrap(error));
                    return;
                }
                corrections.add(corrected);
                try {
                    attempt(original, corrected.text(), schema, reinvoke, attempt + 1, corrections, result);
                } catch (RuntimeException unexpected) {
                    result.completeExceptionally(unexpected);
                }
            });
            return;
        } catch (RuntimeException e) {
            log.error("Structured output decoding failed: requestId={}, attempt={}", original.requestId(), attempt, e);
            result.completeExceptionally(e);
            return;
        }

        log.debug("Structured output decoded: requestId={}, attempts={}", original.requestId(), attempt);
        result.complete(new ParsedOutput<>(value, rawText, attempt, corrections));
    }

    /**
     * Follow-up request carrying the original prompt, the rejected output, the error and the
     * expected fields. Carries no schema: the parser decodes its text itself.
     */
    InvocationRequest correctionRequest(InvocationRequest original, String previousOutput,
                                        String error, OutputSchema<?> schema, int attempt) {
        String instructions = "Your previous answer could not be used.\n"
                + "Error: " + error + "\n"
                + "Respond again with only a JSON value of this shape: " + describe(schema);

        InvocationRequest.Builder builder = original.toBuilder()
                .requestId(original.requestId() + "-fix-" + attempt)
                .schema(null)
                .costCeiling(null)
                .createdAt(null);

        if (original.messages().isEmpty()) {
            builder.prompt(original.prompt()
                    + "\n\nPrevious answer:\n" + previousOutput
                    + "\n\n" + instructions);
        } else {
            List<InvocationRequest.Message> messages = new ArrayList<>(original.messages());
            messages.add(new InvocationRequest.Message("assistant", previousOutput != null ? previousOutput : ""));
            messages.add(new InvocationRequest.Message("user", instructions));
            builder.messages(messages);
        }
        return builder.build();
    }

    /**
     * Field description for correction prompts: the schema's own when set, otherwise derived
     * from the target type's properties.
     */
    public String describe(OutputSchema<?> schema) {
        if (schema.getDescription() != null) {
            return schema.getDescription();
        }
        return describe(objectMapper.constructType(schema.getType()), 0);
    }

    private String describe(JavaType type, int depth) {
        Class<?> raw = type.getRawClass();
        if (type.isArrayType() || type.isCollectionLikeType()) {
            return "array of " + describe(type.getContentType(), depth + 1);
        }
        if (type.isMapLikeType()) {
            return "object of " + describe(type.getContentType(), depth + 1);
        }
        if (raw.isEnum()) {
            return "one of " + Arrays.stream(raw.getEnumConstants())
                    .map(Object::toString)
                    .collect(Collectors.joining("|"));
        }
        if (raw.isPrimitive() || raw.getName().startsWith("java.") || depth > 3) {
            return raw.getSimpleName();
        }

        BeanDescription bean = objectMapper.getDeserializationConfig().introspect(type);
        List<BeanPropertyDefinition> properties = bean.findProperties();
        if (properties.isEmpty()) {
            return raw.getSimpleName();
        }
        return properties.stream()
                .map(property -> property.getName() + ": " + describe(property.getPrimaryType(), depth + 1))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
