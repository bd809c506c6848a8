package com.upstage.api.event.update;

import com.upstage.api.event.AbstractUpstageEvent;
import com.upstage.api.plugin.PluginId;
import lombok.Getter;

/**
 * 单个插件更新事件基类
 */
@Getter
public abstract class PluginUpdateEvent extends AbstractUpstageEvent {
    private final PluginId pluginId;

    protected PluginUpdateEvent(PluginId pluginId) {
        this.pluginId = pluginId;
    }

    @Override
    protected String describe() {
        return "pluginId=" + pluginId;
    }
}
