package com.platform.scaffold.security;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Registers bearer credential resolution with Spring MVC.
 */
@Configuration
public class AuthWebConfig implements WebMvcConfigurer {
    
    private final Authorizer authorizer;
    
    public AuthWebConfig(Authorizer authorizer) {
        this.authorizer = authorizer;
    }
    
    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new BearerCredentialArgumentResolver(authorizer));
    }
}
