/**
 * End-to-end orchestration of a single request.
 *
 * <pre>
 * ceiling scope -> estimate -> reserve -> retry/dispatch -> settle -> [decode -> correction calls]
 * </pre>
 */
package fr.lapetina.llm.broker.invoker;
