package com.upstage.api.event.update;

import com.upstage.api.plugin.PluginId;
import lombok.Getter;
import org.jspecify.annotations.Nullable;

/**
 * 更新已解包到插件目录
 * 场景：记录审计日志
 */
@Getter
public class PluginUpdatedEvent extends PluginUpdateEvent {
    @Nullable
    private final String oldVersion;
    private final String newVersion;

    public PluginUpdatedEvent(PluginId pluginId, @Nullable String oldVersion, String newVersion) {
        super(pluginId);
        this.oldVersion = oldVersion;
        this.newVersion = newVersion;
    }
}
