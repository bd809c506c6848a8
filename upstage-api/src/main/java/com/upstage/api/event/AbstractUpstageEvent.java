package com.upstage.api.event;

import lombok.Getter;

import java.io.Serializable;

/**
 * 事件基类
 * <p>
 * 记录事件产生时刻；子类通过 {@link #describe()} 补充 toString 中的内容。
 */
@Getter
public abstract class AbstractUpstageEvent implements UpstageEvent, Serializable {

    private final long timestamp;

    protected AbstractUpstageEvent() {
        this(System.currentTimeMillis());
    }

    protected AbstractUpstageEvent(long timestamp) {
        this.timestamp = timestamp;
    }

    protected String describe() {
        return "";
    }

    @Override
    public String toString() {
        String detail = describe();
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('[');
        if (!detail.isEmpty()) {
            sb.append(detail).append(", ");
        }
        return sb.append("timestamp=").append(timestamp).append(']').toString();
    }
}
