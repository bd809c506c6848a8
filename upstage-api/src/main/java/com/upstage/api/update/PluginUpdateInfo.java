package com.upstage.api.update;

import java.io.Serializable;

/**
 * 暂存的插件更新
 *
 * @param pluginPath     当前已安装插件的位置（仅用于存在性预检）
 * @param updateFilename 自动更新目录中的更新包文件名
 */
public record PluginUpdateInfo(String pluginPath, String updateFilename) implements Serializable {
}
