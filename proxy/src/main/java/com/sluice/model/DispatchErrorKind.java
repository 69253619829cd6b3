package com.sluice.model;

public enum DispatchErrorKind {
    ALL_ATTEMPTS_EXHAUSTED,
    DEADLINE_EXCEEDED,
    CANCELLED,
    INVALID_REQUEST
}
