package com.github.dimitryivaniuta.gatekeeper.gate;

import com.github.dimitryivaniuta.gatekeeper.identity.PresentedCredential;
import com.github.dimitryivaniuta.gatekeeper.permission.PermissionRequirement;
import com.github.dimitryivaniuta.gatekeeper.permission.RequiresPermission;
import com.github.dimitryivaniuta.gatekeeper.web.ClientIpResolver;
import com.github.dimitryivaniuta.gatekeeper.web.RequestContextKeys;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Gates every handler method under the protected paths. Rejections are thrown as
 * {@link GateRejectedException} and rendered by the global exception handler.
 */
@RequiredArgsConstructor
public class GatekeeperInterceptor implements HandlerInterceptor {

    private final Gatekeeper gatekeeper;
    private final ClientIpResolver clientIpResolver;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod hm) || CorsUtils.isPreFlightRequest(request)) {
            return true;
        }

        RequiresPermission ann = find(hm);
        GateRequest gateRequest = new GateRequest(
                request.getHeader(PresentedCredential.API_KEY_HEADER),
                request.getHeader(PresentedCredential.AUTHORIZATION_HEADER),
                clientIpResolver.resolve(request),
                PermissionRequirement.of(ann),
                requestedSite(request, ann == null ? "siteId" : ann.siteVariable())
        );

        GateOutcome outcome;
        try {
            outcome = gatekeeper.admit(gateRequest).join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException re) throw re;
            throw ex;
        }

        if (!outcome.isAdmitted()) {
            throw new GateRejectedException(outcome.failure());
        }

        GateContext context = outcome.context();
        context.headers().ifPresent(h -> h.asMap().forEach(response::setHeader));
        request.setAttribute(GateContext.REQUEST_ATTRIBUTE, context);
        return true;
    }

    private static RequiresPermission find(HandlerMethod hm) {
        RequiresPermission onMethod = AnnotatedElementUtils.findMergedAnnotation(hm.getMethod(), RequiresPermission.class);
        return onMethod != null ? onMethod : AnnotatedElementUtils.findMergedAnnotation(hm.getBeanType(), RequiresPermission.class);
    }

    @SuppressWarnings("unchecked")
    private static UUID requestedSite(HttpServletRequest request, String variable) {
        String raw = null;
        Object vars = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (vars instanceof Map<?, ?> m) {
            raw = ((Map<String, String>) m).get(variable);
        }
        if (raw == null || raw.isBlank()) {
            raw = request.getHeader(RequestContextKeys.SITE_ID_HEADER);
        }
        if (raw == null || raw.isBlank()) return null;
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
