package com.upstage.starter.controller;

import com.upstage.api.config.PluginDescriptor;
import com.upstage.api.plugin.PluginId;
import com.upstage.api.update.PluginAutoUpdateStatistics;
import com.upstage.api.update.PluginUpdateInfo;
import com.upstage.core.spi.ArtifactDescriptorParser;
import com.upstage.core.spi.PluginDescriptorLoader;
import com.upstage.core.spi.StagedUpdateRepository;
import com.upstage.core.update.AutoUpdateOutcome;
import com.upstage.core.update.AutoUpdateResultHolder;
import com.upstage.core.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Upstage 内置运维接口
 * 路径前缀: /upstage/ops
 */
@Slf4j
@RestController
@RequestMapping("/upstage/ops")
@RequiredArgsConstructor
public class UpstageOpsController {

    private final AutoUpdateResultHolder resultHolder;
    private final StagedUpdateRepository repository;
    private final PluginDescriptorLoader descriptorLoader;
    private final ArtifactDescriptorParser descriptorParser;

    /**
     * 本次启动的自动更新结果
     */
    @GetMapping("/auto-update")
    public Map<String, Object> autoUpdate() {
        Map<String, Object> info = new LinkedHashMap<>();
        AutoUpdateOutcome outcome = resultHolder.get().orElse(null);
        if (outcome == null) {
            info.put("status", "PENDING");
        } else if (outcome instanceof AutoUpdateOutcome.Success success) {
            PluginAutoUpdateStatistics statistics = success.statistics();
            info.put("status", "SUCCESS");
            info.put("updatesPrepared", statistics.updatesPrepared());
            info.put("pluginsUpdated", statistics.pluginsUpdated());
        } else if (outcome instanceof AutoUpdateOutcome.Failure failure) {
            info.put("status", "FAILED");
            info.put("message", String.valueOf(failure.cause().getMessage()));
        }
        return info;
    }

    /**
     * 等待下次启动应用的更新
     */
    @GetMapping("/staged")
    public Map<String, PluginUpdateInfo> staged() {
        Map<String, PluginUpdateInfo> result = new LinkedHashMap<>();
        repository.listStagedUpdates().forEach((id, info) -> result.put(id.idString(), info));
        return result;
    }

    /**
     * 为已安装插件暂存更新包 (jar 或 zip)，下次启动时生效
     */
    @PostMapping("/stage")
    public String stage(@RequestParam("pluginId") String pluginId, @RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return "Error: File is empty.";
        }
        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || originalFilename.isBlank()) {
            return "Error: File name is null.";
        }
        String filename = Path.of(originalFilename).getFileName().toString();
        if (!filename.endsWith(".jar") && !filename.endsWith(".zip")) {
            return "Error: File must be a JAR or ZIP package.";
        }

        Path uploadDir = null;
        try {
            PluginId id = PluginId.of(pluginId);
            PluginDescriptor installed = descriptorLoader.loadCurrentDescriptors().findExisting(id);
            if (installed == null || installed.getPath() == null) {
                return "Error: Plugin " + id + " is not installed.";
            }

            uploadDir = Files.createTempDirectory("upstage-upload-");
            Path artifact = uploadDir.resolve(filename);
            file.transferTo(artifact);

            PluginDescriptor update = descriptorParser.parseDescriptor(artifact);
            if (!id.equals(update.pluginId())) {
                return "Error: Artifact declares plugin " + update.getId() + " instead of " + id + ".";
            }

            repository.stageUpdate(id, installed.getPath(), artifact);
            return "Success: " + id + " " + update.getVersion() + " staged, it will be applied on next start.";
        } catch (Exception e) {
            log.error("Stage failed", e);
            return "Error: " + e.getMessage();
        } finally {
            if (uploadDir != null) {
                try {
                    PathUtils.deleteRecursively(uploadDir);
                } catch (IOException e) {
                    log.warn("Failed to delete upload directory {}", uploadDir, e);
                }
            }
        }
    }
}
