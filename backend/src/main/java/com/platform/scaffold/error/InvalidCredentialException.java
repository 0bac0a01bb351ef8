package com.platform.scaffold.error;

/**
 * A bearer credential was supplied but is not one of the configured tokens.
 */
public class InvalidCredentialException extends ScaffoldException {
    
    public InvalidCredentialException() {
        super(ErrorCode.FORBIDDEN);
    }
}
