package com.sluice.dispatch;

import com.sluice.model.DispatchErrorKind;
import com.sluice.model.DispatchResult;
import lombok.Getter;

@Getter
public class DispatchFailedException extends RuntimeException {

    private final DispatchResult result;

    public DispatchFailedException(DispatchResult result) {
        super(String.format("Dispatch failed (%s) after %d attempts: %s",
                result.getErrorKind(), result.getAttempts(), result.getErrorMessage()), result.getLastCause());
        this.result = result;
    }

    public DispatchErrorKind getErrorKind() {
        return result.getErrorKind();
    }
}
