package com.github.dimitryivaniuta.gatekeeper.keystore;

public class KeyStoreUnavailableException extends RuntimeException {

    public KeyStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
