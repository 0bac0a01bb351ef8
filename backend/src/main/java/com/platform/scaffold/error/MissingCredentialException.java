package com.platform.scaffold.error;

/**
 * No bearer credential was supplied. Mapped to 401 with a
 * {@code WWW-Authenticate: Bearer} challenge.
 */
public class MissingCredentialException extends ScaffoldException {
    
    public MissingCredentialException() {
        super(ErrorCode.UNAUTHORIZED);
    }
}
