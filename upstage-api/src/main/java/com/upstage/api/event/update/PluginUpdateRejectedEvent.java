package com.upstage.api.event.update;

import com.upstage.api.plugin.PluginId;
import lombok.Getter;

/**
 * 更新未通过校验
 */
@Getter
public class PluginUpdateRejectedEvent extends PluginUpdateEvent {
    private final String reason;

    public PluginUpdateRejectedEvent(PluginId pluginId, String reason) {
        super(pluginId);
        this.reason = reason;
    }
}
