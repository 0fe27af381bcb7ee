package io.txxt.structure.detokenize;

import io.txxt.structure.TxxtException;

/**
 * Raised when a token sequence or block tree cannot be turned back into source text.
 */
public class DetokenizeException extends TxxtException {

    public DetokenizeException(String message) {
        super(message);
    }
}
