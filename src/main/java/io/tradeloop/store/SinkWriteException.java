package io.tradeloop.store;

public class SinkWriteException extends RuntimeException {
    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
