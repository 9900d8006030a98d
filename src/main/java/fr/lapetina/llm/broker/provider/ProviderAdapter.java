package fr.lapetina.llm.broker.provider;

import java.util.concurrent.CompletableFuture;

/**
 * Boundary to one LLM vendor. Implementations perform the network call.
 *
 * <p>Implementations must not block the calling thread: the returned future completes when the
 * provider answers. Failures complete the future exceptionally, preferably with a
 * {@link ProviderException} carrying the classification.
 */
public interface ProviderAdapter {

    /**
     * Provider name this adapter serves, matched against {@code ModelSpec.provider()}.
     */
    String getName();

    CompletableFuture<RawResponse> send(ProviderRequest request);
}
