package com.statecraft.core.domain.result;

/**
 * Raised inside a transaction to abort it. Never escapes the engine: {@link Result#attempt} turns it into a failed result.
 */
public class EngineException extends RuntimeException {

    private final EngineError error;

    public EngineException(EngineError error) {
        super(error.message());
        this.error = error;
    }

    public EngineError getError() {
        return error;
    }
}
