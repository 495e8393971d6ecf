package com.github.dimitryivaniuta.gatekeeper.identity;

import java.util.Objects;

/**
 * Either a resolved {@link Principal} or the reason resolution failed; never both.
 */
public record IdentityResult(Principal principal, AuthFailureKind failure, String detail) {

    public static IdentityResult resolved(Principal principal) {
        return new IdentityResult(Objects.requireNonNull(principal, "principal"), null, null);
    }

    public static IdentityResult failed(AuthFailureKind failure) {
        return failed(failure, failure.defaultDetail());
    }

    public static IdentityResult failed(AuthFailureKind failure, String detail) {
        return new IdentityResult(null, Objects.requireNonNull(failure, "failure"), detail);
    }

    public boolean isResolved() {
        return principal != null;
    }
}
