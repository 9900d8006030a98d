package fr.lapetina.llm.broker.parsing;

/**
 * Raw model text could not be turned into a valid value of the schema's type.
 */
public final class OutputDecodingException extends RuntimeException {

    public OutputDecodingException(String message) {
        super(message);
    }

    public OutputDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
