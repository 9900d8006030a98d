/**
 * Micrometer metrics with Prometheus exposition, fed by the usage pipeline.
 */
package fr.lapetina.llm.broker.infrastructure.metrics;
