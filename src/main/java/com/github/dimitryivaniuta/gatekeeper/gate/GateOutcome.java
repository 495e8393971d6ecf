package com.github.dimitryivaniuta.gatekeeper.gate;

public record GateOutcome(GateContext context, GateFailure failure) {

    public static GateOutcome admitted(GateContext context) {
        return new GateOutcome(context, null);
    }

    public static GateOutcome rejected(GateFailure failure) {
        return new GateOutcome(null, failure);
    }

    public boolean isAdmitted() {
        return failure == null;
    }
}
