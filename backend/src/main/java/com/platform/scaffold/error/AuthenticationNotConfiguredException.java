package com.platform.scaffold.error;

/**
 * A protected route was reached while no bearer tokens are configured.
 */
public class AuthenticationNotConfiguredException extends ConfigurationException {
    
    public AuthenticationNotConfiguredException() {
        super(ErrorCode.AUTH_NOT_CONFIGURED, ErrorCode.AUTH_NOT_CONFIGURED.getDefaultMessage());
    }
}
