package com.github.dimitryivaniuta.gatekeeper.identity;

public enum PrincipalKind {
    API_CREDENTIAL("apiKey"),
    SESSION_TOKEN("session");

    private final String tag;

    PrincipalKind(String tag) { this.tag = tag; }

    public String tag() { return tag; }
}
