package com.github.dimitryivaniuta.gatekeeper.permission;

import com.github.dimitryivaniuta.gatekeeper.identity.PermissionLevel;

import java.lang.annotation.*;

/**
 * Declares the minimum permission a handler needs. May be placed on the controller class or the method;
 * the method wins.
 *
 * Handlers without the annotation require {@link PermissionLevel#READ} and are not tenant-scoped.
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequiresPermission {

    PermissionLevel value() default PermissionLevel.READ;

    /** When true, a non-master principal must be scoped to the requested site. */
    boolean tenantScoped() default true;

    /** URI template variable holding the requested site id. Falls back to the X-Site-Id header. */
    String siteVariable() default "siteId";
}
