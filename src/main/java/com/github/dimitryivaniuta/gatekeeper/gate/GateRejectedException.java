package com.github.dimitryivaniuta.gatekeeper.gate;

import lombok.Getter;

@Getter
public class GateRejectedException extends RuntimeException {

    private final GateFailure failure;

    public GateRejectedException(GateFailure failure) {
        super(failure.code() + ": " + failure.detail());
        this.failure = failure;
    }
}
