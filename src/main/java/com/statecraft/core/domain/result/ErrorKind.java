package com.statecraft.core.domain.result;

public enum ErrorKind {
    NOT_FOUND,
    UNAUTHORIZED,
    INSUFFICIENT_RESOURCE,
    INSUFFICIENT_CASH,
    INSUFFICIENT_MANPOWER,
    INVALID_STATE,
    ADMISSION_LIMIT_EXCEEDED,
    INVALID_ARGUMENT,
    STORE_ERROR
}
