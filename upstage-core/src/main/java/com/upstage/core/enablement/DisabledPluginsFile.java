package com.upstage.core.enablement;

import com.upstage.api.plugin.PluginId;
import com.upstage.core.spi.PluginEnablementStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 基于 disabled_plugins.txt 的启用状态存储
 * <p>
 * 每行一个插件 ID，忽略空行与 # 注释。文件不存在表示没有禁用任何插件。
 * 首次查询时读取一次，之后保持不变。
 */
@Slf4j
public class DisabledPluginsFile implements PluginEnablementStore {

    public static final String FILE_NAME = "disabled_plugins.txt";

    private final Path file;
    private volatile Set<PluginId> disabled;

    public DisabledPluginsFile(Path configHome) {
        this.file = configHome.resolve(FILE_NAME);
    }

    @Override
    public boolean isDisabled(PluginId id) {
        return getDisabledPlugins().contains(id);
    }

    public Set<PluginId> getDisabledPlugins() {
        Set<PluginId> snapshot = disabled;
        if (snapshot == null) {
            synchronized (this) {
                if (disabled == null) {
                    disabled = read();
                }
                snapshot = disabled;
            }
        }
        return snapshot;
    }

    private Set<PluginId> read() {
        if (!Files.isRegularFile(file)) {
            return Collections.emptySet();
        }
        Set<PluginId> ids = new LinkedHashSet<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                ids.add(PluginId.of(trimmed));
            }
        } catch (IOException e) {
            // 读不到就当没有禁用，不阻断启动
            log.warn("Failed to read {}, treating all plugins as enabled", file, e);
            return Collections.emptySet();
        }
        log.debug("Disabled plugins: {}", ids);
        return Collections.unmodifiableSet(ids);
    }
}
