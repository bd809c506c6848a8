package com.upstage.starter.config;

import com.upstage.core.config.UpstageConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * upstage.* 配置项
 * <p>
 * 插件 ID 含点号，broken-plugins 的 Key 需使用方括号写法，例如
 * {@code upstage.broken-plugins[com.example.foo]=1.3,1.4}
 */
@Setter
@Getter
@ConfigurationProperties(prefix = "upstage")
public class UpstageProperties {

    /**
     * 总开关
     */
    private boolean enabled = true;

    private String pluginHome = "plugins";

    private String configHome = "config";

    private String autoUpdateDir = "plugin-auto-update";

    /**
     * 当前宿主构建号，为空时不检查插件声明的构建范围
     */
    private String hostBuild;

    private List<String> essentialPlugins = new ArrayList<>();

    // 格式: <pluginId, [version...]>
    private Map<String, List<String>> brokenPlugins = new HashMap<>();

    /**
     * 容器启动时是否应用暂存的插件更新
     */
    private boolean autoUpdateEnabled = true;

    private int descriptorLoaderThreads = Math.max(2, Runtime.getRuntime().availableProcessors());

    public UpstageConfig toConfig() {
        return UpstageConfig.builder()
                .pluginHome(pluginHome)
                .configHome(configHome)
                .autoUpdateDir(autoUpdateDir)
                .hostBuild(hostBuild)
                .essentialPlugins(List.copyOf(essentialPlugins))
                .brokenPlugins(Map.copyOf(brokenPlugins))
                .autoUpdateEnabled(autoUpdateEnabled)
                .descriptorLoaderThreads(descriptorLoaderThreads)
                .build();
    }
}
