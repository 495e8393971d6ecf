package com.github.dimitryivaniuta.gatekeeper.gate;

import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Injects the {@link GateContext} of an admitted request into handler parameters.
 */
public class GateContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return GateContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        Object ctx = webRequest.getAttribute(GateContext.REQUEST_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (ctx == null) {
            throw new IllegalStateException("No gate context: handler is not under a protected path");
        }
        return ctx;
    }
}
