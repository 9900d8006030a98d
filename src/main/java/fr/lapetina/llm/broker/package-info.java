/**
 * LLM Broker - rate-limited, retrying, budget-enforcing dispatch layer in front of LLM providers.
 *
 * <p>Applications plug in one {@link fr.lapetina.llm.broker.provider.ProviderAdapter} per provider;
 * the broker routes requests by model name or alias, admits them under per-model rate limits,
 * retries transient failures, charges every billed call against nested budgets, decodes structured
 * output and runs large batches with bounded concurrency.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.broker.BrokerFactory} - Main entry point, wires a broker from YAML</li>
 *   <li>{@link fr.lapetina.llm.broker.LlmBroker} - Invoke, invoke structured, run batches, open budgets</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (BrokerFactory factory = BrokerFactory.create("broker.yaml", adapter).start()) {
 *     LlmBroker broker = factory.getBroker();
 *
 *     try (BudgetScope question = broker.openBudget("question-42", new BigDecimal("1.00"))) {
 *         InvocationRequest request = broker.request("summarizer").prompt("Summarize...").build();
 *         InvocationResult result = broker.invoke(request, question.stack()).join();
 *         System.out.println(result.text() + " cost=" + result.cost());
 *     }
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Fixed-window per-model rate limiting without blocking threads</li>
 *   <li>Classified retry with exponential backoff and provider retry-after hints</li>
 *   <li>Exact nested cost accounting with hard-stop ceilings</li>
 *   <li>Structured output decoding with self-correction calls</li>
 *   <li>Ordered batch execution with optional fail-fast</li>
 *   <li>Micrometer metrics with Prometheus export, fed through a Disruptor ring buffer</li>
 * </ul>
 *
 * @see fr.lapetina.llm.broker.BrokerFactory
 * @see fr.lapetina.llm.broker.LlmBroker
 */
package fr.lapetina.llm.broker;
