package com.example.emobility.config;

import com.example.emobility.security.resolver.CallerContextArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.result.method.annotation.ArgumentResolverConfigurer;

/**
 * Registers the {@link CallerContextArgumentResolver} so controllers can take a
 * {@link com.example.emobility.security.context.CallerContext} parameter.
 */
@Configuration
@RequiredArgsConstructor
public class WebFluxConfig implements WebFluxConfigurer {

    private final CallerContextArgumentResolver callerContextArgumentResolver;

    @Override
    public void configureArgumentResolvers(ArgumentResolverConfigurer configurer) {
        configurer.addCustomResolver(callerContextArgumentResolver);
    }
}
