/**
 * Invocation lifecycle states and the telemetry events published to the usage pipeline.
 */
package fr.lapetina.llm.broker.domain.event;
