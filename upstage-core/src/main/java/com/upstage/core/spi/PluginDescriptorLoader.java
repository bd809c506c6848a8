package com.upstage.core.spi;

import com.upstage.core.loader.PluginLoadingResult;

/**
 * 当前插件清单加载器
 */
public interface PluginDescriptorLoader {

    /**
     * 加载宿主当前配置下的插件描述符快照
     */
    PluginLoadingResult loadCurrentDescriptors();
}
