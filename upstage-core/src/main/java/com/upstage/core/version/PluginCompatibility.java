package com.upstage.core.version;

import com.upstage.api.config.PluginDescriptor;
import com.upstage.api.plugin.PluginId;
import com.upstage.core.config.UpstageConfig;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 宿主兼容性判定
 * <p>
 * 汇总三类宿主侧信息：当前构建号、已知损坏版本列表、随宿主发行的插件列表。
 */
@Slf4j
public class PluginCompatibility {

    @Nullable
    private final BuildNumber hostBuild;
    private final Map<PluginId, Set<String>> brokenVersions;
    private final Set<PluginId> essentialPlugins;

    public PluginCompatibility(@Nullable BuildNumber hostBuild,
                               Map<PluginId, Set<String>> brokenVersions,
                               Collection<PluginId> essentialPlugins) {
        this.hostBuild = hostBuild;
        Map<PluginId, Set<String>> broken = new HashMap<>();
        brokenVersions.forEach((id, versions) -> broken.put(id, Set.copyOf(versions)));
        this.brokenVersions = Collections.unmodifiableMap(broken);
        this.essentialPlugins = Set.copyOf(essentialPlugins);
    }

    public static PluginCompatibility from(UpstageConfig config) {
        BuildNumber host = config.getHostBuild() == null || config.getHostBuild().isBlank()
                ? null : BuildNumber.parse(config.getHostBuild());

        Map<PluginId, Set<String>> broken = new HashMap<>();
        if (config.getBrokenPlugins() != null) {
            for (Map.Entry<String, List<String>> entry : config.getBrokenPlugins().entrySet()) {
                List<String> versions = entry.getValue() != null ? entry.getValue() : List.of();
                broken.computeIfAbsent(PluginId.of(entry.getKey()), k -> new HashSet<>()).addAll(versions);
            }
        }

        Set<PluginId> essential = new HashSet<>();
        if (config.getEssentialPlugins() != null) {
            config.getEssentialPlugins().forEach(id -> essential.add(PluginId.of(id)));
        }
        return new PluginCompatibility(host, broken, essential);
    }

    /**
     * 描述符声明的构建范围是否排除了当前宿主
     * <p>
     * 未配置宿主构建号时一律视为兼容；构建号格式非法的描述符视为不兼容。
     */
    public boolean isIncompatible(PluginDescriptor descriptor) {
        if (hostBuild == null) {
            return false;
        }
        try {
            String since = descriptor.getSinceBuild();
            if (since != null && !since.isBlank() && BuildNumber.parse(since).compareTo(hostBuild) > 0) {
                return true;
            }
            String until = descriptor.getUntilBuild();
            return until != null && !until.isBlank() && BuildNumber.parse(until).compareTo(hostBuild) < 0;
        } catch (IllegalArgumentException e) {
            log.warn("Plugin {} declares an invalid build range [{}, {}]",
                    descriptor.getId(), descriptor.getSinceBuild(), descriptor.getUntilBuild());
            return true;
        }
    }

    /**
     * 该版本是否在已知损坏列表中
     */
    public boolean isBroken(PluginDescriptor descriptor) {
        Set<String> versions = brokenVersions.get(descriptor.pluginId());
        return versions != null && versions.contains(descriptor.getVersion());
    }

    /**
     * 已安装插件是否随宿主发行
     */
    public boolean isEssential(PluginId id, @Nullable PluginDescriptor existing) {
        return essentialPlugins.contains(id) || (existing != null && existing.isEssential());
    }

    /**
     * 比较更新版本与已安装版本
     * <p>
     * 已安装版本损坏或不兼容时，任何不同的版本都视为更新 (返回 1)；版本相同仍返回 0。
     */
    public int compareSkipBrokenAndIncompatible(String updateVersion, PluginDescriptor existing) {
        int state = PluginVersionComparator.INSTANCE.compare(updateVersion, existing.getVersion());
        if (state < 0 && (isBroken(existing) || isIncompatible(existing))) {
            state = 1;
        }
        return state;
    }
}
