package com.upstage.api.exception;

/**
 * 暂存目录写入失败
 *
 * @author Upstage
 */
public class StagingException extends UpstageException {

    public StagingException(String message) {
        super(message);
    }

    public StagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
