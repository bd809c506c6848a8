package com.upstage.api.event.update;

import com.upstage.api.plugin.PluginId;
import lombok.Getter;

/**
 * 更新通过校验但解包失败
 */
@Getter
public class PluginUpdateFailedEvent extends PluginUpdateEvent {
    private final Throwable cause;

    public PluginUpdateFailedEvent(PluginId pluginId, Throwable cause) {
        super(pluginId);
        this.cause = cause;
    }
}
