package com.upstage.core.spi;

import com.upstage.api.plugin.PluginId;
import com.upstage.api.update.PluginUpdateInfo;

import java.nio.file.Path;
import java.util.Map;

/**
 * 暂存更新仓库
 * <p>
 * 生产方在两次启动之间写入，自动更新流程在启动时消费并整体清空。
 */
public interface StagedUpdateRepository {

    /**
     * 读取所有暂存更新，按 PluginId 自然顺序排列
     * <p>
     * 清单无法读取时返回空表，不抛出异常。
     */
    Map<PluginId, PluginUpdateInfo> listStagedUpdates();

    /**
     * 暂存一个更新包，供下次启动时应用
     *
     * @param id         目标插件
     * @param pluginPath 当前已安装插件的位置
     * @param artifact   更新包文件，将被复制到暂存目录
     * @throws com.upstage.api.exception.StagingException 写入失败
     */
    PluginUpdateInfo stageUpdate(PluginId id, Path pluginPath, Path artifact);

    /**
     * 清空暂存目录及清单
     */
    void clearStagedUpdates();

    Path getAutoUpdateDirPath();
}
