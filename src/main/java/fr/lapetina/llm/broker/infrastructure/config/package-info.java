/**
 * Configuration loading.
 *
 * <p>This package handles YAML configuration parsing into a bean tree and its conversion into
 * the broker's immutable domain objects.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.broker.infrastructure.config.BrokerConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.llm.broker.infrastructure.config.ConfigLoader} - YAML loading, validation and conversion</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code models} - Model specs: provider, capabilities, pricing, rate limit</li>
 *   <li>{@code aliases} - Role names ({@code default}, {@code parser}, ...) pointing at models</li>
 *   <li>{@code retry} - Retry policy and per-attempt timeout</li>
 *   <li>{@code parsing} - Structured output decode attempts</li>
 *   <li>{@code batch} - Default batch options</li>
 *   <li>{@code budget} - Process-wide ceiling</li>
 *   <li>{@code scheduler} - Shared scheduler threads</li>
 *   <li>{@code usagePipeline} - Ring buffer and wait strategy settings</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.llm.broker.infrastructure.config.BrokerConfig
 * @see fr.lapetina.llm.broker.infrastructure.config.ConfigLoader
 */
package fr.lapetina.llm.broker.infrastructure.config;
