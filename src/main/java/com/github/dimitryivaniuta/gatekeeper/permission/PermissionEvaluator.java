package com.github.dimitryivaniuta.gatekeeper.permission;

import com.github.dimitryivaniuta.gatekeeper.identity.Principal;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Pure allow/deny check. Level first, then tenant confinement for non-master principals.
 */
@Component
public class PermissionEvaluator {

    public boolean isAllowed(Principal principal, PermissionRequirement requirement, UUID requestedSite) {
        if (!principal.permissionLevel().atLeast(requirement.minLevel())) {
            return false;
        }
        if (!requirement.tenantScopeRequired() || principal.isMaster()) {
            return true;
        }
        return principal.tenantScope().covers(requestedSite);
    }

    public String denialDetail(Principal principal, PermissionRequirement requirement, UUID requestedSite) {
        if (!principal.permissionLevel().atLeast(requirement.minLevel())) {
            return "Insufficient permission: " + requirement.minLevel() + " required, credential has "
                    + principal.permissionLevel();
        }
        if (requestedSite == null) {
            return "A valid site id is required for this operation";
        }
        return "Credential is not authorised for site " + requestedSite;
    }
}
