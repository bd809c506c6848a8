package com.upstage.core.spi;

import com.upstage.api.plugin.PluginId;

/**
 * 插件启用状态存储
 */
public interface PluginEnablementStore {

    boolean isDisabled(PluginId id);
}
