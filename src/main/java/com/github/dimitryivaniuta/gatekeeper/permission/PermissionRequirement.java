package com.github.dimitryivaniuta.gatekeeper.permission;

import com.github.dimitryivaniuta.gatekeeper.identity.PermissionLevel;

import java.util.Objects;

public record PermissionRequirement(PermissionLevel minLevel, boolean tenantScopeRequired) {

    private static final PermissionRequirement DEFAULT = new PermissionRequirement(PermissionLevel.READ, false);

    public PermissionRequirement {
        Objects.requireNonNull(minLevel, "minLevel");
    }

    public static PermissionRequirement defaults() {
        return DEFAULT;
    }

    public static PermissionRequirement of(RequiresPermission ann) {
        return ann == null ? DEFAULT : new PermissionRequirement(ann.value(), ann.tenantScoped());
    }
}
