package com.sluice.model;

public enum AttemptFailure {
    TIMEOUT,
    CONNECTION_ERROR,
    NON_SUCCESS_STATUS,
    INVALID_REQUEST
}
