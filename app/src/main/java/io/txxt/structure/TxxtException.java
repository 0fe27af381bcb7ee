package io.txxt.structure;

/**
 * Base runtime exception for failures raised while structuring a txxt document.
 */
public class TxxtException extends RuntimeException {

    public TxxtException(String message) {
        super(message);
    }

    public TxxtException(String message, Throwable cause) {
        super(message, cause);
    }
}
