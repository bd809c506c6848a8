package com.upstage.api.exception;

/**
 * Upstage 基础异常
 *
 * @author Upstage
 */
public class UpstageException extends RuntimeException {

    public UpstageException(String message) {
        super(message);
    }

    public UpstageException(String message, Throwable cause) {
        super(message, cause);
    }
}
