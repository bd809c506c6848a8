package com.upstage.api.event;

/**
 * 事件监听器接口
 *
 * @param <E> 监听的事件类型
 * @author Upstage
 */
@FunctionalInterface
public interface UpstageEventListener<E extends UpstageEvent> {

    /**
     * 处理事件
     * @param event 事件对象
     */
    void onEvent(E event);
}
