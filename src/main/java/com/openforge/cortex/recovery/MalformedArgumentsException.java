package com.openforge.cortex.recovery;

/**
 * Tool-call arguments that cannot be turned into a JSON object.
 *
 * Raised by the parsing layer and absorbed by {@link ResponseRecoveryPipeline};
 * it never escapes a recovery call.
 */
public class MalformedArgumentsException extends RuntimeException {

    public MalformedArgumentsException(String message) {
        super(message);
    }

    public MalformedArgumentsException(String message, Throwable cause) {
        super(message, cause);
    }
}
