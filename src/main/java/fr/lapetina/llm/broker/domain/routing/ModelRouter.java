package fr.lapetina.llm.broker.domain.routing;

import fr.lapetina.llm.broker.domain.model.ModelCapability;
import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.exception.UnknownModelException;
import fr.lapetina.llm.broker.provider.ProviderAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves model names and role aliases ({@code default}, {@code summarizer}, {@code parser}, ...)
 * to a {@link ModelSpec}, and a spec to the {@link ProviderAdapter} serving its provider.
 *
 * Thread-safe. Aliases and adapters may be added while the broker runs.
 */
public final class ModelRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelRouter.class);

    private final ModelRegistry registry;
    private final Map<String, String> aliases = new ConcurrentHashMap<>();
    private final Map<String, ProviderAdapter> adapters = new ConcurrentHashMap<>();

    public ModelRouter(ModelRegistry registry) {
        this.registry = registry;
    }

    /**
     * Points an alias at a registered model.
     */
    public void alias(String alias, String modelName) {
        if (!registry.contains(modelName)) {
            throw new UnknownModelException(modelName, "Alias '" + alias + "' targets unknown model: " + modelName);
        }
        String previous = aliases.put(alias, modelName);
        log.info("Model alias set: alias={}, model={}, previous={}", alias, modelName, previous);
    }

    public void registerAdapter(ProviderAdapter adapter) {
        ProviderAdapter previous = adapters.put(adapter.getName(), adapter);
        if (previous != null && previous != adapter) {
            log.warn("Provider adapter replaced: provider={}", adapter.getName());
        } else {
            log.info("Provider adapter registered: provider={}", adapter.getName());
        }
    }

    /**
     * Resolves a model name or alias. Exact model names take precedence over aliases.
     */
    public ModelSpec resolve(String nameOrAlias) {
        Optional<ModelSpec> direct = registry.find(nameOrAlias);
        if (direct.isPresent()) {
            return direct.get();
        }
        String target = aliases.get(nameOrAlias);
        if (target == null) {
            throw new UnknownModelException(nameOrAlias);
        }
        return registry.require(target);
    }

    /**
     * Resolves a model and checks it offers the requested capability.
     */
    public ModelSpec resolve(String nameOrAlias, ModelCapability capability) {
        ModelSpec spec = resolve(nameOrAlias);
        if (!spec.supports(capability)) {
            throw new UnknownModelException(nameOrAlias,
                    "Model " + spec.name() + " does not support " + capability);
        }
        return spec;
    }

    public ProviderAdapter adapterFor(ModelSpec spec) {
        ProviderAdapter adapter = adapters.get(spec.provider());
        if (adapter == null) {
            throw new UnknownModelException(spec.name(),
                    "No provider adapter registered for provider '" + spec.provider() + "' (model " + spec.name() + ")");
        }
        return adapter;
    }

    public ModelRegistry getRegistry() {
        return registry;
    }

    public Map<String, String> getAliases() {
        return Map.copyOf(aliases);
    }
}
