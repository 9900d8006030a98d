/**
 * Provider boundary: the injected adapters performing network calls, and the classification
 * of their failures into {@code RATE_LIMITED}, {@code RETRYABLE} and {@code FATAL}.
 */
package fr.lapetina.llm.broker.provider;
