package com.statecraft.core.domain.result;

import com.statecraft.core.domain.ledger.Resource;

/**
 * Structured failure returned across the engine boundary.
 * {@code resource} is set only for INSUFFICIENT_RESOURCE; {@code shortfall} is 0 when not meaningful.
 */
public record EngineError(ErrorKind kind, String message, Resource resource, double shortfall) {

    public static EngineError notFound(String message) {
        return new EngineError(ErrorKind.NOT_FOUND, message, null, 0.0);
    }

    public static EngineError unauthorized(String message) {
        return new EngineError(ErrorKind.UNAUTHORIZED, message, null, 0.0);
    }

    public static EngineError insufficientResource(Resource resource, double shortfall) {
        return new EngineError(ErrorKind.INSUFFICIENT_RESOURCE,
                "Insufficient " + resource.displayName() + " (short " + fmt(shortfall) + ")",
                resource, shortfall);
    }

    public static EngineError insufficientCash(double shortfall) {
        return new EngineError(ErrorKind.INSUFFICIENT_CASH,
                "Insufficient cash (short " + fmt(shortfall) + ")", null, shortfall);
    }

    public static EngineError insufficientManpower(double shortfall) {
        return new EngineError(ErrorKind.INSUFFICIENT_MANPOWER,
                "Insufficient recruitable manpower (short " + fmt(shortfall) + ")", null, shortfall);
    }

    public static EngineError invalidState(String message) {
        return new EngineError(ErrorKind.INVALID_STATE, message, null, 0.0);
    }

    public static EngineError admissionLimit(int limit) {
        return new EngineError(ErrorKind.ADMISSION_LIMIT_EXCEEDED,
                "Already " + limit + " outstanding offers; cancel or wait for one to resolve", null, 0.0);
    }

    public static EngineError invalidArgument(String message) {
        return new EngineError(ErrorKind.INVALID_ARGUMENT, message, null, 0.0);
    }

    public static EngineError storeError(String operation) {
        return new EngineError(ErrorKind.STORE_ERROR,
                operation + " failed: storage error, nothing was applied", null, 0.0);
    }

    private static String fmt(double v) {
        return String.format(java.util.Locale.US, "%.2f", v);
    }
}
