package com.upstage.core.update;

import com.upstage.api.config.PluginDescriptor;
import com.upstage.api.plugin.PluginId;
import com.upstage.core.loader.PluginLoadingResult;
import org.jspecify.annotations.Nullable;

/**
 * 单个待校验更新的上下文
 *
 * @param id       插件 ID
 * @param update   更新包描述符
 * @param existing 已安装描述符，未安装时为 null
 * @param current  当前插件清单
 */
public record UpdateCandidate(PluginId id,
                              PluginDescriptor update,
                              @Nullable PluginDescriptor existing,
                              PluginLoadingResult current) {
}
