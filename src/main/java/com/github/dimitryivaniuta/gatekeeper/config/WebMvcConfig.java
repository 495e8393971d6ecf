package com.github.dimitryivaniuta.gatekeeper.config;

import com.github.dimitryivaniuta.gatekeeper.gate.GateContextArgumentResolver;
import com.github.dimitryivaniuta.gatekeeper.gate.Gatekeeper;
import com.github.dimitryivaniuta.gatekeeper.gate.GatekeeperInterceptor;
import com.github.dimitryivaniuta.gatekeeper.web.ClientIpResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final GatekeeperProperties properties;
    private final Gatekeeper gatekeeper;
    private final ClientIpResolver clientIpResolver;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (!properties.isEnabled()) return;
        registry.addInterceptor(new GatekeeperInterceptor(gatekeeper, clientIpResolver))
                .addPathPatterns(properties.getProtectedPaths())
                .excludePathPatterns("/actuator/**", "/error");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new GateContextArgumentResolver());
    }
}
