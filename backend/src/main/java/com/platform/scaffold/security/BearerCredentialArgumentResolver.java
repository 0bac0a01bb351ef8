package com.platform.scaffold.security;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Optional;

/**
 * Supplies {@link BearerCredential} handler parameters.
 * 
 * The {@code Authorization} header is parsed and handed to the {@link Authorizer}; a handler
 * declaring a {@code BearerCredential} parameter only runs for an authorized request.
 */
public class BearerCredentialArgumentResolver implements HandlerMethodArgumentResolver {
    
    private static final String BEARER_SCHEME = "bearer";
    
    private final Authorizer authorizer;
    
    public BearerCredentialArgumentResolver(Authorizer authorizer) {
        this.authorizer = authorizer;
    }
    
    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return BearerCredential.class.equals(parameter.getParameterType());
    }
    
    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String header = webRequest.getHeader(HttpHeaders.AUTHORIZATION);
        String clientIp = null;
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (request != null) {
            clientIp = ClientAddress.of(request);
        }
        return authorizer.authorize(extractToken(header), clientIp);
    }
    
    /**
     * A header without the Bearer scheme, or with an empty token, counts as no credential.
     */
    static Optional<String> extractToken(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        
        String trimmed = header.trim();
        int space = trimmed.indexOf(' ');
        if (space <= 0) {
            return Optional.empty();
        }
        
        String scheme = trimmed.substring(0, space);
        String token = trimmed.substring(space + 1).trim();
        if (!scheme.equalsIgnoreCase(BEARER_SCHEME) || token.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
