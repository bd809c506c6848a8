package com.upstage.core.staging;

import com.upstage.api.exception.StagingException;
import com.upstage.api.plugin.PluginId;
import com.upstage.api.update.PluginUpdateInfo;
import com.upstage.core.spi.StagedUpdateRepository;
import com.upstage.core.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 基于目录的暂存更新仓库
 * <p>
 * 目录结构：
 * <pre>
 * plugin-auto-update/
 *   updates.yml      # PluginId -> {pluginPath, updateFilename}
 *   foo-2.0.zip      # 每个待应用更新一个插件包
 * </pre>
 */
@Slf4j
public class FileStagedUpdateRepository implements StagedUpdateRepository {

    public static final String MANIFEST_NAME = "updates.yml";

    private static final String KEY_PLUGIN_PATH = "pluginPath";
    private static final String KEY_UPDATE_FILENAME = "updateFilename";

    private final Path autoUpdateDir;

    public FileStagedUpdateRepository(Path autoUpdateDir) {
        this.autoUpdateDir = autoUpdateDir;
    }

    @Override
    public Path getAutoUpdateDirPath() {
        return autoUpdateDir;
    }

    @Override
    public synchronized Map<PluginId, PluginUpdateInfo> listStagedUpdates() {
        try {
            return Collections.unmodifiableMap(readManifest());
        } catch (IOException | YAMLException | IllegalArgumentException | ClassCastException e) {
            log.warn("Failed to read staged plugin updates from {}", manifestPath(), e);
            return Collections.emptyMap();
        }
    }

    @Override
    public synchronized PluginUpdateInfo stageUpdate(PluginId id, Path pluginPath, Path artifact) {
        if (!Files.isRegularFile(artifact)) {
            throw new StagingException("Update artifact does not exist: " + artifact);
        }
        try {
            Files.createDirectories(autoUpdateDir);
            Map<PluginId, PluginUpdateInfo> updates = readManifest();

            String filename = artifact.getFileName().toString();
            for (Map.Entry<PluginId, PluginUpdateInfo> entry : updates.entrySet()) {
                if (!entry.getKey().equals(id) && entry.getValue().updateFilename().equals(filename)) {
                    throw new StagingException("Artifact " + filename + " is already staged for plugin " + entry.getKey());
                }
            }

            // 同一插件只保留最新暂存的更新包
            PluginUpdateInfo previous = updates.get(id);
            if (previous != null && !previous.updateFilename().equals(filename)) {
                Files.deleteIfExists(autoUpdateDir.resolve(previous.updateFilename()));
            }

            Path target = autoUpdateDir.resolve(filename);
            if (!artifact.toAbsolutePath().normalize().equals(target.toAbsolutePath().normalize())) {
                Files.copy(artifact, target, StandardCopyOption.REPLACE_EXISTING);
            }

            PluginUpdateInfo info = new PluginUpdateInfo(pluginPath.toAbsolutePath().toString(), filename);
            updates.put(id, info);
            writeManifest(updates);
            log.info("Staged update {} for plugin {}", filename, id);
            return info;
        } catch (IOException e) {
            throw new StagingException("Failed to stage update for plugin " + id, e);
        }
    }

    @Override
    public synchronized void clearStagedUpdates() {
        if (!Files.exists(autoUpdateDir)) {
            return;
        }
        try {
            PathUtils.deleteRecursively(autoUpdateDir);
        } catch (IOException e) {
            throw new StagingException("Failed to clear plugin auto update directory " + autoUpdateDir, e);
        }
        log.debug("Cleared plugin auto update directory {}", autoUpdateDir);
    }

    // ==================== 清单读写 ====================

    private Path manifestPath() {
        return autoUpdateDir.resolve(MANIFEST_NAME);
    }

    private Map<PluginId, PluginUpdateInfo> readManifest() throws IOException {
        Map<PluginId, PluginUpdateInfo> updates = new TreeMap<>();
        Path manifest = manifestPath();
        if (!Files.isRegularFile(manifest)) {
            return updates;
        }
        Object root;
        try (InputStream in = Files.newInputStream(manifest)) {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        }
        if (root == null) {
            return updates;
        }
        if (!(root instanceof Map<?, ?> entries)) {
            throw new IOException("Unexpected content of " + manifest);
        }
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            if (!(entry.getValue() instanceof Map<?, ?> value)) {
                throw new IOException("Unexpected entry for plugin " + entry.getKey() + " in " + manifest);
            }
            Object pluginPath = value.get(KEY_PLUGIN_PATH);
            Object updateFilename = value.get(KEY_UPDATE_FILENAME);
            if (pluginPath == null || updateFilename == null) {
                throw new IOException("Incomplete entry for plugin " + entry.getKey() + " in " + manifest);
            }
            updates.put(PluginId.of(String.valueOf(entry.getKey())),
                    new PluginUpdateInfo(String.valueOf(pluginPath), String.valueOf(updateFilename)));
        }
        return updates;
    }

    private void writeManifest(Map<PluginId, PluginUpdateInfo> updates) throws IOException {
        Map<String, Map<String, String>> root = new LinkedHashMap<>();
        updates.forEach((id, info) -> {
            Map<String, String> value = new LinkedHashMap<>();
            value.put(KEY_PLUGIN_PATH, info.pluginPath());
            value.put(KEY_UPDATE_FILENAME, info.updateFilename());
            root.put(id.idString(), value);
        });

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);

        // 先写临时文件再替换，避免半截清单
        Path temp = autoUpdateDir.resolve(MANIFEST_NAME + ".tmp");
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            new Yaml(options).dump(root, writer);
        }
        Files.move(temp, manifestPath(), StandardCopyOption.REPLACE_EXISTING);
    }
}
