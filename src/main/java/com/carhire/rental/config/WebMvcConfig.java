package com.carhire.rental.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * WebMvcConfig: registers the AuthInterceptor on the REST API.
 *
 * Protected: /api/**
 *
 * Excluded (always public):
 *   /api/auth/register, /api/auth/login, /api/auth/token/refresh
 *   /api/auth/check-username, /api/auth/check-email
 *   /ws/**, /swagger-ui/**, /v3/api-docs/**, /h2-console/**, /error
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private AuthInterceptor authInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(authInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns(
                        "/api/auth/register",
                        "/api/auth/login",
                        "/api/auth/token/refresh",
                        "/api/auth/check-username",
                        "/api/auth/check-email"
                );
    }
}
