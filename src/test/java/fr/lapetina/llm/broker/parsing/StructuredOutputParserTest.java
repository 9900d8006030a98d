package fr.lapetina.llm.broker.parsing;

import com.fasterxml.jackson.core.type.TypeReference;
import fr.lapetina.llm.broker.domain.model.InvocationRequest;
import fr.lapetina.llm.broker.domain.model.InvocationResult;
import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.exception.FatalProviderException;
import fr.lapetina.llm.broker.exception.ParseExhaustedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static fr.lapetina.llm.broker.TestFutures.await;
import static fr.lapetina.llm.broker.TestFutures.failureOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StructuredOutputParserTest {

    public enum Outlook { SUNNY, RAINY }

    public static class Forecast {
        public String city;
        public int high;
        public Outlook outlook;
    }

    private static final ModelSpec MODEL = ModelSpec.builder().name("stub/model").build();

    private final StructuredOutputParser parser = new StructuredOutputParser();
    private final OutputSchema<Forecast> schema = OutputSchema.of(Forecast.class);

    @Nested
    @DisplayName("Decoding")
    class Decoding {

        @Test
        @DisplayName("should bind JSON wrapped in prose, ignoring unknown fields")
        void shouldDecode() {
            Forecast forecast = parser.decode(
                    "Forecast: {\"city\":\"Lyon\",\"high\":21,\"outlook\":\"sunny\",\"humidity\":40}", schema);

            assertThat(forecast.city).isEqualTo("Lyon");
            assertThat(forecast.high).isEqualTo(21);
            assertThat(forecast.outlook).isEqualTo(Outlook.SUNNY);
        }

        @Test
        @DisplayName("should decode generic targets")
        void shouldDecodeGenericTargets() {
            List<Forecast> forecasts = parser.decode("[{\"city\":\"A\"},{\"city\":\"B\"}]",
                    OutputSchema.of(new TypeReference<List<Forecast>>() {
                    }));

            assertThat(forecasts).extracting(f -> f.city).containsExactly("A", "B");
        }

        @Test
        @DisplayName("should report mistyped fields")
        void shouldRejectMistypedFields() {
            assertThatThrownBy(() -> parser.decode("{\"high\":\"warm\"}", schema))
                    .isInstanceOf(OutputDecodingException.class)
                    .hasMessageContaining("Forecast");
        }

        @Test
        @DisplayName("should report validator problems")
        void shouldRunValidator() {
            OutputSchema<Forecast> validated = schema.withValidator(f ->
                    f.high > 60 ? List.of("high out of range: " + f.high) : List.of());

            assertThatThrownBy(() -> parser.decode("{\"city\":\"X\",\"high\":99}", validated))
                    .isInstanceOf(OutputDecodingException.class)
                    .hasMessageContaining("high out of range: 99");
        }
    }

    @Nested
    @DisplayName("Correction loop")
    class CorrectionLoop {

        @Test
        @DisplayName("should decode on the first attempt without correction calls")
        void shouldDecodeFirstTime() throws Exception {
            ScriptedReinvoke reinvoke = new ScriptedReinvoke();

            ParsedOutput<Forecast> parsed = await(parser.parse(
                    InvocationRequest.ofPrompt(MODEL, "forecast?"), "{\"city\":\"Nice\"}", schema, reinvoke));

            assertThat(parsed.attempts()).isEqualTo(1);
            assertThat(parsed.corrections()).isEmpty();
            assertThat(reinvoke.requests).isEmpty();
        }

        @Test
        @DisplayName("should succeed on the third attempt after two corrections")
        void shouldSucceedAfterCorrections() throws Exception {
            ScriptedReinvoke reinvoke = new ScriptedReinvoke("still not json", "{\"city\":\"Brest\",\"high\":14}");

            ParsedOutput<Forecast> parsed = await(parser.parse(
                    InvocationRequest.ofPrompt(MODEL, "forecast?"), "not json at all", schema, reinvoke));

            assertThat(parsed.attempts()).isEqualTo(3);
            assertThat(parsed.value().city).isEqualTo("Brest");
            assertThat(parsed.corrections()).hasSize(2);
            assertThat(reinvoke.requests).hasSize(2);
        }

        @Test
        @DisplayName("should fail with ParseExhaustedException after max attempts")
        void shouldExhaust() throws Exception {
            ScriptedReinvoke reinvoke = new ScriptedReinvoke("nope", "still nope", "never");

            Throwable failure = failureOf(parser.parse(
                    InvocationRequest.ofPrompt(MODEL, "forecast?"), "garbage", schema, reinvoke));

            assertThat(failure).isInstanceOf(ParseExhaustedException.class);
            assertThat(((ParseExhaustedException) failure).getAttempts()).isEqualTo(3);
            assertThat(((ParseExhaustedException) failure).getLastRawText()).isEqualTo("still nope");
            assertThat(reinvoke.requests).hasSize(2);
        }

        @Test
        @DisplayName("should treat a throwing validator as a decode failure and ask for another correction")
        void shouldRecoverFromThrowingValidator() throws Exception {
            OutputSchema<Forecast> validated = schema.withValidator(f ->
                    f.city.isBlank() ? List.of("city is blank") : List.of());
            ScriptedReinvoke reinvoke = new ScriptedReinvoke("{}", "{\"city\":\"Pau\"}");

            ParsedOutput<Forecast> parsed = await(parser.parse(
                    InvocationRequest.ofPrompt(MODEL, "forecast?"), "not json", validated, reinvoke));

            assertThat(parsed.value().city).isEqualTo("Pau");
            assertThat(parsed.attempts()).isEqualTo(3);
            assertThat(reinvoke.requests.get(1).prompt()).contains("NullPointerException");
        }

        @Test
        @DisplayName("should fail instead of hanging when the validator keeps throwing")
        void shouldExhaustWithThrowingValidator() throws Exception {
            OutputSchema<Forecast> validated = schema.withValidator(f ->
                    f.city.isBlank() ? List.of("city is blank") : List.of());
            ScriptedReinvoke reinvoke = new ScriptedReinvoke("{}", "{\"high\":3}");

            Throwable failure = failureOf(parser.parse(
                    InvocationRequest.ofPrompt(MODEL, "forecast?"), "not json", validated, reinvoke));

            assertThat(failure).isInstanceOf(ParseExhaustedException.class);
            assertThat(failure.getCause()).isInstanceOf(OutputDecodingException.class);
        }

        @Test
        @DisplayName("should propagate the error of a correction call")
        void shouldPropagateReinvokeError() throws Exception {
            FatalProviderException fatal = new FatalProviderException("stub/model", 1, "content policy", null);
            Function<InvocationRequest, CompletableFuture<InvocationResult>> failing =
                    request -> CompletableFuture.failedFuture(fatal);

            assertThat(failureOf(parser.parse(
                    InvocationRequest.ofPrompt(MODEL, "forecast?"), "garbage", schema, failing)))
                    .isSameAs(fatal);
        }

        @Test
        @DisplayName("should honour a single allowed attempt")
        void shouldHonourSingleAttempt() throws Exception {
            StructuredOutputParser strict = new StructuredOutputParser(1);
            ScriptedReinvoke reinvoke = new ScriptedReinvoke("{\"city\":\"X\"}");

            assertThat(failureOf(strict.parse(
                    InvocationRequest.ofPrompt(MODEL, "forecast?"), "garbage", schema, reinvoke)))
                    .isInstanceOf(ParseExhaustedException.class);
            assertThat(reinvoke.requests).isEmpty();
        }
    }

    @Nested
    @DisplayName("Correction requests")
    class CorrectionRequests {

        @Test
        @DisplayName("should append the rejected output and error to a prompt request")
        void shouldBuildPromptCorrection() {
            InvocationRequest original = InvocationRequest.builder()
                    .requestId("req-1")
                    .model(MODEL)
                    .prompt("forecast?")
                    .schema(schema)
                    .costCeiling(new BigDecimal("0.10"))
                    .build();

            InvocationRequest correction = parser.correctionRequest(original, "bad", "Invalid JSON", schema, 1);

            assertThat(correction.requestId()).isEqualTo("req-1-fix-1");
            assertThat(correction.schema()).isNull();
            assertThat(correction.costCeiling()).isNull();
            assertThat(correction.prompt()).startsWith("forecast?").contains("bad").contains("Invalid JSON");
        }

        @Test
        @DisplayName("should continue the conversation for chat requests")
        void shouldBuildChatCorrection() {
            InvocationRequest original = InvocationRequest.ofChat(MODEL,
                    List.of(new InvocationRequest.Message("user", "forecast?")));

            InvocationRequest correction = parser.correctionRequest(original, "bad", "Invalid JSON", schema, 2);

            assertThat(correction.messages()).extracting(InvocationRequest.Message::role)
                    .containsExactly("user", "assistant", "user");
            assertThat(correction.messages().get(1).content()).isEqualTo("bad");
            assertThat(correction.messages().get(2).content()).contains("Invalid JSON");
        }

        @Test
        @DisplayName("should describe the expected fields from the target type")
        void shouldDescribeType() {
            String description = parser.describe(schema);

            assertThat(description).startsWith("{").endsWith("}")
                    .contains("city: String")
                    .contains("high: int")
                    .contains("outlook: one of SUNNY|RAINY");
            assertThat(parser.describe(OutputSchema.of(new TypeReference<List<Forecast>>() {
            }))).startsWith("array of {");
        }

        @Test
        @DisplayName("should prefer an explicit description")
        void shouldPreferExplicitDescription() {
            assertThat(parser.describe(schema.withDescription("{city, high}"))).isEqualTo("{city, high}");
        }
    }

    private static final class ScriptedReinvoke implements Function<InvocationRequest, CompletableFuture<InvocationResult>> {
        private final Deque<String> replies;
        final List<InvocationRequest> requests = new ArrayList<>();

        ScriptedReinvoke(String... replies) {
            this.replies = new ArrayDeque<>(List.of(replies));
        }

        @Override
        public CompletableFuture<InvocationResult> apply(InvocationRequest request) {
            requests.add(request);
            return CompletableFuture.completedFuture(InvocationResult.builder()
                    .requestId(request.requestId())
                    .model(request.model().name())
                    .text(replies.poll())
                    .attempts(1)
                    .build());
        }
    }
}
