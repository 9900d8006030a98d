package fr.lapetina.llm.broker.domain.routing;

import fr.lapetina.llm.broker.domain.model.ModelCapability;
import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.exception.UnknownModelException;
import fr.lapetina.llm.broker.provider.StubProviderAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRouterTest {

    private ModelRegistry registry;
    private ModelRouter router;
    private ModelSpec sonnet;
    private ModelSpec haiku;

    @BeforeEach
    void setUp() {
        registry = new ModelRegistry();
        sonnet = ModelSpec.builder()
                .name("openrouter/anthropic/claude-sonnet")
                .capability(ModelCapability.TEXT_COMPLETION)
                .capability(ModelCapability.STRUCTURED_OUTPUT)
                .build();
        haiku = ModelSpec.builder().name("openrouter/anthropic/claude-haiku").build();
        registry.register(sonnet);
        registry.register(haiku);
        router = new ModelRouter(registry);
    }

    @Nested
    @DisplayName("Registry")
    class Registry {

        @Test
        @DisplayName("should refuse to replace a registered model")
        void shouldRefuseDuplicates() {
            assertThatThrownBy(() -> registry.register(ModelSpec.builder().name(sonnet.name()).build()))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(registry.require(sonnet.name())).isSameAs(sonnet);
            assertThat(registry.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should derive the provider from the model name")
        void shouldDeriveProvider() {
            assertThat(sonnet.provider()).isEqualTo("openrouter");
            assertThat(ModelSpec.builder().name("llama3").build().provider()).isEqualTo(ModelSpec.DEFAULT_PROVIDER);
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("should resolve exact names and aliases")
        void shouldResolveAliases() {
            router.alias("summarizer", haiku.name());
            router.alias("parser", sonnet.name());

            assertThat(router.resolve("summarizer")).isSameAs(haiku);
            assertThat(router.resolve("parser")).isSameAs(sonnet);
            assertThat(router.resolve(haiku.name())).isSameAs(haiku);
            assertThat(router.getAliases()).containsEntry("summarizer", haiku.name());
        }

        @Test
        @DisplayName("should let an alias be repointed")
        void shouldRepointAlias() {
            router.alias("default", haiku.name());
            router.alias("default", sonnet.name());

            assertThat(router.resolve("default")).isSameAs(sonnet);
        }

        @Test
        @DisplayName("should fail for unknown names and dangling aliases")
        void shouldFailForUnknownNames() {
            assertThatThrownBy(() -> router.resolve("gpt-nothing"))
                    .isInstanceOfSatisfying(UnknownModelException.class,
                            e -> assertThat(e.getName()).isEqualTo("gpt-nothing"));
            assertThatThrownBy(() -> router.alias("default", "missing/model"))
                    .isInstanceOf(UnknownModelException.class);
        }

        @Test
        @DisplayName("should check the requested capability")
        void shouldCheckCapability() {
            assertThat(router.resolve(sonnet.name(), ModelCapability.STRUCTURED_OUTPUT)).isSameAs(sonnet);
            assertThatThrownBy(() -> router.resolve(haiku.name(), ModelCapability.STRUCTURED_OUTPUT))
                    .isInstanceOf(UnknownModelException.class)
                    .hasMessageContaining("STRUCTURED_OUTPUT");
        }
    }

    @Nested
    @DisplayName("Adapters")
    class Adapters {

        @Test
        @DisplayName("should find the adapter serving the model provider")
        void shouldFindAdapter() {
            StubProviderAdapter openrouter = new StubProviderAdapter("openrouter");
            router.registerAdapter(openrouter);

            assertThat(router.adapterFor(sonnet)).isSameAs(openrouter);
        }

        @Test
        @DisplayName("should fail when no adapter serves the provider")
        void shouldFailWithoutAdapter() {
            assertThatThrownBy(() -> router.adapterFor(sonnet))
                    .isInstanceOf(UnknownModelException.class)
                    .hasMessageContaining("openrouter");
        }
    }
}
