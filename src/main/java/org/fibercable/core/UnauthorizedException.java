package org.fibercable.core;

/**
 * Raised by connect callbacks or channel subscribe hooks to refuse the client.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException() {
        super("Unauthorized");
    }

    public UnauthorizedException(String message) {
        super(message);
    }
}
