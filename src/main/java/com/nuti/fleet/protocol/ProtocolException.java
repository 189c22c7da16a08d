package com.nuti.fleet.protocol;

import java.io.IOException;

/**
 * Reply that could not be decoded or does not match the request it answers.
 * Handled like any other transport failure of the exchange.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
