package com.coinchase.protocol;

import io.netty.handler.codec.DecoderException;

/**
 * A client sent something that is not a valid frame. Fatal to the session.
 */
public class ProtocolViolationException extends DecoderException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
