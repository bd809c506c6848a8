package com.upstage.api.event;

/**
 * 框架事件标记接口
 */
public interface UpstageEvent {

    long getTimestamp();
}
