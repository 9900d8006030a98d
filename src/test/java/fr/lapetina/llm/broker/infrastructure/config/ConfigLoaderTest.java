package fr.lapetina.llm.broker.infrastructure.config;

import fr.lapetina.llm.broker.batch.BatchOptions;
import fr.lapetina.llm.broker.batch.DiscardedCostPolicy;
import fr.lapetina.llm.broker.domain.model.ModelCapability;
import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.retry.RetryPolicy;
import fr.lapetina.llm.broker.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    private static BrokerConfig load(String content) {
        return new ConfigLoader("unused.yaml").loadFromStream(yaml(content));
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("should load the test configuration from the classpath")
        void shouldLoadFromClasspath() {
            ConfigLoader loader = new ConfigLoader("test-config.yaml");

            BrokerConfig config = loader.load();

            assertThat(config.getModels()).extracting(BrokerConfig.ModelConfig::getName)
                    .contains("stub/fast", "stub/flat");
            assertThat(config.getAliases()).containsEntry("default", "stub/fast");
            assertThat(loader.getCurrentConfig()).isSameAs(config);
        }

        @Test
        @DisplayName("should load the bundled example configuration")
        void shouldLoadBundledExample() {
            BrokerConfig config = new ConfigLoader("broker.yaml").load();

            assertThat(ConfigLoader.toModelSpecs(config)).hasSize(3);
            assertThat(config.getAliases()).containsKeys("default", "summarizer", "parser");
            assertThat(ConfigLoader.globalCeiling(config)).isEqualByComparingTo("100.00");
        }

        @Test
        @DisplayName("should prefer a file on disk")
        void shouldLoadFromFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("broker.yaml");
            Files.writeString(file, "models:\n  - name: disk/model\n");

            BrokerConfig config = new ConfigLoader(file.toString()).load();

            assertThat(config.getModels()).extracting(BrokerConfig.ModelConfig::getName).containsExactly("disk/model");
        }

        @Test
        @DisplayName("should fail when the file exists nowhere")
        void shouldFailWhenMissing() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("should fall back to defaults for an empty document")
        void shouldUseDefaultsForEmptyDocument() {
            BrokerConfig config = load("");

            assertThat(config.getModels()).isEmpty();
            assertThat(config.getRetry().getMaxAttempts()).isEqualTo(3);
            assertThat(config.getBatch().getConcurrencyLimit()).isEqualTo(8);
            assertThat(config.getUsagePipeline().isEnabled()).isTrue();
        }

        @Test
        @DisplayName("should wrap YAML syntax errors")
        void shouldWrapYamlErrors() {
            assertThatThrownBy(() -> load("models: [unclosed"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Invalid YAML");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject duplicate model names")
        void shouldRejectDuplicates() {
            assertThatThrownBy(() -> load("models:\n  - name: a/m\n  - name: a/m\n"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Duplicate model");
        }

        @Test
        @DisplayName("should reject aliases targeting unknown models")
        void shouldRejectDanglingAlias() {
            assertThatThrownBy(() -> load("models:\n  - name: a/m\naliases:\n  default: b/m\n"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("default");
        }

        @Test
        @DisplayName("should reject malformed and negative amounts")
        void shouldRejectBadAmounts() {
            assertThatThrownBy(() -> load("models:\n  - name: a/m\n    pricing:\n      perCall: cheap\n"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("perCall");
            assertThatThrownBy(() -> load("models:\n  - name: a/m\n    pricing:\n      perCall: \"-1\"\n"))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> load("budget:\n  globalCeiling: lots\n"))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject a ring buffer size that is not a power of two")
        void shouldRejectRingBufferSize() {
            assertThatThrownBy(() -> load("usagePipeline:\n  ringBufferSize: 1000\n"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("power of 2");
        }

        @Test
        @DisplayName("should reject unknown capabilities and discarded cost policies")
        void shouldRejectUnknownEnums() {
            assertThatThrownBy(() -> load("models:\n  - name: a/m\n    capabilities: [telepathy]\n"))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> load("batch:\n  discardedCostPolicy: shred\n"))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Mapping")
    class Mapping {

        @Test
        @DisplayName("should map a model section to a spec")
        void shouldMapModel() {
            BrokerConfig config = load("""
                    models:
                      - name: openrouter/anthropic/claude
                        capabilities: [text-completion, structured-output]
                        pricing:
                          inputPerToken: "0.000003"
                          outputPerToken: "0.000015"
                        rateLimit:
                          requestsPerWindow: 50
                          windowMs: 60000
                          maxWaitMs: 5000
                        defaultMaxOutputTokens: 2048
                        chargeFailedAttempts: true
                    """);

            List<ModelSpec> specs = ConfigLoader.toModelSpecs(config);

            assertThat(specs).hasSize(1);
            ModelSpec spec = specs.get(0);
            assertThat(spec.provider()).isEqualTo("openrouter");
            assertThat(spec.capabilities()).containsExactlyInAnyOrder(
                    ModelCapability.TEXT_COMPLETION, ModelCapability.STRUCTURED_OUTPUT);
            assertThat(spec.pricing().inputPerToken()).isEqualByComparingTo("0.000003");
            assertThat(spec.pricing().outputPerToken()).isEqualByComparingTo("0.000015");
            assertThat(spec.rateLimit().requestsPerWindow()).isEqualTo(50);
            assertThat(spec.rateLimit().getMaxWait()).contains(Duration.ofSeconds(5));
            assertThat(spec.defaultMaxOutputTokens()).isEqualTo(2048);
            assertThat(spec.chargeFailedAttempts()).isTrue();
        }

        @Test
        @DisplayName("should map provider-reported pricing and an unlimited rate")
        void shouldMapProviderReported() {
            BrokerConfig config = load("""
                    models:
                      - name: local/llama
                        provider: ollama
                        pricing:
                          providerReported: true
                          estimatedPerCall: "0.02"
                    """);

            ModelSpec spec = ConfigLoader.toModelSpec(config.getModels().get(0));

            assertThat(spec.provider()).isEqualTo("ollama");
            assertThat(spec.pricing().providerReported()).isTrue();
            assertThat(spec.pricing().perCall()).isEqualByComparingTo("0.02");
            assertThat(spec.rateLimit().isUnlimited()).isTrue();
        }

        @Test
        @DisplayName("should map retry, batch and budget sections")
        void shouldMapPolicies() {
            BrokerConfig config = load("""
                    retry:
                      maxAttempts: 5
                      baseDelayMs: 100
                      jitterMs: 0
                      maxRateLimitedRetries: 4
                    batch:
                      concurrencyLimit: 2
                      failFast: true
                      discardedCostPolicy: refund
                    budget:
                      globalCeiling: "25.00"
                    """);

            RetryPolicy retry = ConfigLoader.toRetryPolicy(config.getRetry());
            BatchOptions batch = ConfigLoader.toBatchOptions(config.getBatch());

            assertThat(retry.maxAttempts()).isEqualTo(5);
            assertThat(retry.baseDelay()).isEqualTo(Duration.ofMillis(100));
            assertThat(retry.maxRateLimitedRetries()).isEqualTo(4);
            assertThat(batch).isEqualTo(new BatchOptions(2, true, DiscardedCostPolicy.REFUND));
            assertThat(ConfigLoader.globalCeiling(config)).isEqualByComparingTo("25.00");
        }

        @Test
        @DisplayName("should treat a negative rate-limited retry bound as unbounded")
        void shouldTreatNegativeBoundAsUnbounded() {
            assertThat(ConfigLoader.toRetryPolicy(ConfigLoader.createDefault().getRetry()).maxRateLimitedRetries())
                    .isEqualTo(Integer.MAX_VALUE);
            assertThat(ConfigLoader.globalCeiling(ConfigLoader.createDefault())).isNull();
        }
    }
}
