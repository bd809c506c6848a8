package com.upstage.api.update;

import java.io.Serializable;

/**
 * 单次启动的自动更新统计
 *
 * @param updatesPrepared 通过暂存预检的更新数量
 * @param pluginsUpdated  成功解包的插件数量
 */
public record PluginAutoUpdateStatistics(int updatesPrepared, int pluginsUpdated) implements Serializable {
}
