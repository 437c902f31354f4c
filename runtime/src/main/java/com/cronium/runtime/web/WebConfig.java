package com.cronium.runtime.web;

import com.cronium.runtime.auth.ExecutionClaimsArgumentResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * MVC wiring: claims injection into controllers and CORS for the configured origins.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ExecutionClaimsArgumentResolver claimsResolver;
    private final List<String>                    allowedOrigins;

    public WebConfig(ExecutionClaimsArgumentResolver claimsResolver,
                     @Value("${runtime.cors.allowed-origins:}") List<String> allowedOrigins) {
        this.claimsResolver = claimsResolver;
        this.allowedOrigins = allowedOrigins.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(claimsResolver);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (allowedOrigins.isEmpty()) {
            return;
        }
        registry.addMapping("/**")
                .allowedOrigins(allowedOrigins.toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "OPTIONS")
                .allowedHeaders("Authorization", "Content-Type", RequestIdFilter.REQUEST_ID_HEADER)
                .exposedHeaders("Retry-After", RequestIdFilter.REQUEST_ID_HEADER);
    }
}
