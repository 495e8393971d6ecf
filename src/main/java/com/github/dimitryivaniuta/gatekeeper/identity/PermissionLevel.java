package com.github.dimitryivaniuta.gatekeeper.identity;

import java.util.Locale;
import java.util.Optional;

/**
 * Permission levels, ordered by ordinal: READ(0) &lt; WRITE(1) &lt; ADMIN(2) &lt; MASTER(3).
 *
 * <p>Declaration order is load-bearing; {@link #atLeast(PermissionLevel)} compares ordinals.
 */
public enum PermissionLevel {
    READ,
    WRITE,
    ADMIN,
    MASTER;

    public boolean atLeast(PermissionLevel required) {
        return ordinal() >= required.ordinal();
    }

    /** Parses a role claim or stored value, case-insensitively. Blank or unknown values yield empty. */
    public static Optional<PermissionLevel> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
