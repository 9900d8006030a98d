/**
 * LMAX Disruptor pipeline for usage telemetry.
 *
 * <h2>Pipeline</h2>
 * <pre>
 * publisher (invocation threads) -> MetricsHandler -> ReportHandler
 * </pre>
 *
 * <h2>Backpressure</h2>
 * Telemetry must never slow an invocation down. Publishing uses {@code tryNext()}; when the ring
 * buffer is full the event is dropped and counted instead of blocking the caller.
 */
package fr.lapetina.llm.broker.disruptor;
