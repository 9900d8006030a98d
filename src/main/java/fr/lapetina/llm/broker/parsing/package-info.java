/**
 * Structured output decoding with self-correction.
 *
 * <h2>Decoding</h2>
 * The JSON payload is taken from a fenced code block or the first object/array of the text,
 * bound with Jackson to the schema's type, then checked by the schema's validator.
 *
 * <h2>Correction</h2>
 * A failed decode produces a follow-up request holding the original prompt, the rejected output,
 * the error and the expected fields. Each follow-up is a full invocation: rate-limited, retried
 * and charged. After the configured number of decode attempts the parse fails with
 * {@link fr.lapetina.llm.broker.exception.ParseExhaustedException}.
 */
package fr.lapetina.llm.broker.parsing;
