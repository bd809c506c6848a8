package com.upstage.core.event;

import com.upstage.api.event.UpstageEvent;
import com.upstage.api.event.UpstageEventListener;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 进程内事件总线
 * <p>
 * 按事件类型及其父类型分发；监听器异常只记录日志，不影响发布方。
 */
@Slf4j
public class EventBus {

    private final Map<Class<? extends UpstageEvent>, List<UpstageEventListener<? extends UpstageEvent>>> listeners =
            new ConcurrentHashMap<>();

    public <E extends UpstageEvent> void subscribe(Class<E> eventType, UpstageEventListener<E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(listener);
    }

    public <E extends UpstageEvent> void unsubscribe(Class<E> eventType, UpstageEventListener<E> listener) {
        List<UpstageEventListener<? extends UpstageEvent>> eventListeners = listeners.get(eventType);
        if (eventListeners != null) {
            eventListeners.remove(listener);
        }
    }

    public void publish(UpstageEvent event) {
        for (Map.Entry<Class<? extends UpstageEvent>, List<UpstageEventListener<? extends UpstageEvent>>> entry
                : listeners.entrySet()) {
            // 订阅父类型的监听器同样收到子类型事件
            if (!entry.getKey().isInstance(event)) {
                continue;
            }
            for (UpstageEventListener<? extends UpstageEvent> listener : entry.getValue()) {
                try {
                    @SuppressWarnings("unchecked")
                    UpstageEventListener<UpstageEvent> castListener = (UpstageEventListener<UpstageEvent>) listener;
                    castListener.onEvent(event);
                } catch (Exception e) {
                    log.error("Error processing event {}", event, e);
                }
            }
        }
    }
}
