package fr.lapetina.llm.broker.domain.routing;

import fr.lapetina.llm.broker.domain.model.ModelSpec;
import fr.lapetina.llm.broker.exception.UnknownModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry mapping model names to their {@link ModelSpec}.
 *
 * Populated at startup. A registered spec is never replaced: its pricing and
 * rate policy are fixed for the lifetime of the registry.
 */
public final class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, ModelSpec> models = new ConcurrentHashMap<>();

    /**
     * Registers a model.
     *
     * @throws IllegalStateException if a model with the same name is already registered
     */
    public void register(ModelSpec spec) {
        ModelSpec previous = models.putIfAbsent(spec.name(), spec);
        if (previous != null) {
            throw new IllegalStateException("Model already registered: " + spec.name());
        }
        log.info("Model registered: name={}, provider={}, capabilities={}, rateLimit={}/{}ms",
                spec.name(),
                spec.provider(),
                spec.capabilities(),
                spec.rateLimit().requestsPerWindow(),
                spec.rateLimit().isUnlimited() ? 0 : spec.rateLimit().window().toMillis());
    }

    public Optional<ModelSpec> find(String name) {
        return Optional.ofNullable(models.get(name));
    }

    public ModelSpec require(String name) {
        ModelSpec spec = models.get(name);
        if (spec == null) {
            throw new UnknownModelException(name);
        }
        return spec;
    }

    public boolean contains(String name) {
        return models.containsKey(name);
    }

    public List<ModelSpec> getAll() {
        return new ArrayList<>(models.values());
    }

    public int size() {
        return models.size();
    }
}
