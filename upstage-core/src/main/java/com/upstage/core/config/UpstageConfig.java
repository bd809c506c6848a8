package com.upstage.core.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Upstage Core 全局配置对象 (Immutable)
 * <p>
 * 职责：作为 Core 层的唯一配置入口，屏蔽 Spring Boot 或其他外部环境的差异。
 * 由 Native 启动器或 Starter 构建一次后显式传递，不做静态持有。
 */
@Data
@Builder
@ToString
public class UpstageConfig {

    // ================= 目录 =================

    /**
     * 插件安装目录
     */
    @Builder.Default
    private String pluginHome = "plugins";

    /**
     * 宿主配置目录 (存放 disabled_plugins.txt)
     */
    @Builder.Default
    private String configHome = "config";

    /**
     * 自动更新暂存目录
     */
    @Builder.Default
    private String autoUpdateDir = "plugin-auto-update";

    // ================= 宿主信息 =================

    /**
     * 当前宿主构建号，例如 241.14494
     * 为空时不做兼容性范围检查
     */
    private String hostBuild;

    /**
     * 随宿主发行的插件 ID，不允许单独更新
     */
    @Builder.Default
    private List<String> essentialPlugins = Collections.emptyList();

    /**
     * 已知损坏的插件版本：Key=PluginId, Value=版本列表
     */
    @Builder.Default
    private Map<String, List<String>> brokenPlugins = Collections.emptyMap();

    // ================= 自动更新 =================

    /**
     * 启动时是否应用暂存的插件更新
     */
    @Builder.Default
    private boolean autoUpdateEnabled = true;

    /**
     * 并行解析更新包描述符的线程数
     */
    @Builder.Default
    private int descriptorLoaderThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    public Path pluginHomePath() {
        return Path.of(pluginHome);
    }

    public Path configHomePath() {
        return Path.of(configHome);
    }

    public Path autoUpdateDirPath() {
        return Path.of(autoUpdateDir);
    }
}
