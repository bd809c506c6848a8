package com.upstage.core.loader;

import com.upstage.api.config.PluginDescriptor;
import com.upstage.api.exception.DescriptorParseException;
import com.upstage.api.plugin.PluginId;
import com.upstage.core.spi.ArtifactDescriptorParser;
import com.upstage.core.spi.PluginDescriptorLoader;
import com.upstage.core.spi.PluginEnablementStore;
import com.upstage.core.version.PluginCompatibility;
import com.upstage.core.version.PluginVersionComparator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基于插件目录的清单加载器
 * <p>
 * 职责：
 * 1. 扫描插件目录下的子目录与 jar/zip
 * 2. 解析每个插件的 plugin.yml
 * 3. 已禁用或不兼容的插件归入 incomplete，其余归入 loaded
 * 4. 同 ID 重复出现时保留较新的版本
 */
@Slf4j
@RequiredArgsConstructor
public class FileSystemPluginDescriptorLoader implements PluginDescriptorLoader {

    private final Path pluginHome;
    private final ArtifactDescriptorParser parser;
    private final PluginEnablementStore enablementStore;
    private final PluginCompatibility compatibility;

    @Override
    public PluginLoadingResult loadCurrentDescriptors() {
        if (!Files.isDirectory(pluginHome)) {
            log.info("Plugin home {} does not exist, no plugins installed", pluginHome.toAbsolutePath());
            return PluginLoadingResult.empty();
        }

        List<Path> candidates;
        try (Stream<Path> files = Files.list(pluginHome)) {
            candidates = files.filter(this::isPluginCandidate).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list plugin home {}", pluginHome.toAbsolutePath(), e);
            return PluginLoadingResult.empty();
        }

        Map<PluginId, PluginDescriptor> newest = new HashMap<>();
        for (Path candidate : candidates) {
            try {
                PluginDescriptor descriptor = parser.parseDescriptor(candidate);
                newest.merge(descriptor.pluginId(), descriptor, this::pickNewer);
            } catch (DescriptorParseException e) {
                // 单个插件损坏不影响整体清单
                log.warn("Skipping plugin at {}: {}", candidate, e.getMessage());
            }
        }

        PluginLoadingResult.Builder builder = PluginLoadingResult.builder();
        for (PluginDescriptor descriptor : newest.values()) {
            PluginId id = descriptor.pluginId();
            if (enablementStore.isDisabled(id)) {
                log.debug("Plugin {} is disabled", id);
                builder.addIncomplete(descriptor);
            } else if (compatibility.isIncompatible(descriptor)) {
                log.debug("Plugin {} v{} is incompatible with current build", id, descriptor.getVersion());
                builder.addIncomplete(descriptor);
            } else {
                builder.addLoaded(descriptor);
            }
        }
        PluginLoadingResult result = builder.build();
        log.info("Loaded plugin descriptors from {}: {} loaded, {} incomplete",
                pluginHome, result.getIdMap().size(), result.getIncompleteIdMap().size());
        return result;
    }

    private PluginDescriptor pickNewer(PluginDescriptor existing, PluginDescriptor other) {
        PluginDescriptor winner = PluginVersionComparator.INSTANCE.compare(other.getVersion(), existing.getVersion()) > 0
                ? other : existing;
        PluginDescriptor loser = winner == existing ? other : existing;
        log.warn("Plugin {} is installed twice ({} and {}), using version {}",
                winner.getId(), winner.getPath(), loser.getPath(), winner.getVersion());
        return winner;
    }

    private boolean isPluginCandidate(Path path) {
        String name = path.getFileName().toString();
        if (name.startsWith(".")) {
            return false;
        }
        return Files.isDirectory(path) || name.endsWith(".jar") || name.endsWith(".zip");
    }
}
