package com.upstage.api.exception;

/**
 * 插件包无法读取，或缺少合法的 plugin.yml
 *
 * @author Upstage
 */
public class DescriptorParseException extends UpstageException {

    public DescriptorParseException(String message) {
        super(message);
    }

    public DescriptorParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
