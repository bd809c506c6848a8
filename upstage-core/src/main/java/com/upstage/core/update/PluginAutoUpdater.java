package com.upstage.core.update;

import com.upstage.api.config.PluginDescriptor;
import com.upstage.api.event.update.AutoUpdateFinishedEvent;
import com.upstage.api.event.update.PluginUpdateFailedEvent;
import com.upstage.api.event.update.PluginUpdateRejectedEvent;
import com.upstage.api.event.update.PluginUpdatedEvent;
import com.upstage.api.exception.DescriptorParseException;
import com.upstage.api.exception.UpstageException;
import com.upstage.api.plugin.PluginId;
import com.upstage.api.update.PluginAutoUpdateStatistics;
import com.upstage.api.update.PluginUpdateInfo;
import com.upstage.core.event.EventBus;
import com.upstage.core.loader.PluginLoadingResult;
import com.upstage.core.spi.ArtifactDescriptorParser;
import com.upstage.core.spi.PluginDescriptorLoader;
import com.upstage.core.spi.PluginEnablementStore;
import com.upstage.core.spi.PluginInstaller;
import com.upstage.core.spi.StagedUpdateRepository;
import com.upstage.core.util.PathUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 插件自动更新器
 * <p>
 * 在宿主加载插件之前执行一次：
 * 1. 过滤掉原插件或更新包已不存在的暂存项
 * 2. 加载当前插件清单，丢弃已禁用或不会被加载的插件
 * 3. 并行解析每个更新包的描述符
 * 4. 按规则校验，解包通过的更新
 * 5. 无论成败都清空暂存目录，并一次性发布统计结果
 * <p>
 * 单个插件的任何错误都只记录日志，不会中断整批更新。
 */
@Slf4j
public class PluginAutoUpdater {

    private final StagedUpdateRepository repository;
    private final PluginDescriptorLoader descriptorLoader;
    private final PluginEnablementStore enablementStore;
    private final ArtifactDescriptorParser descriptorParser;
    private final PluginInstaller installer;
    private final UpdateReconciler reconciler;
    private final Path pluginsDir;
    private final EventBus eventBus;
    private final AutoUpdateResultHolder resultHolder;
    private final int loaderThreads;

    // 用于生成线程名的计数器
    private final AtomicInteger threadNumber = new AtomicInteger(1);

    public PluginAutoUpdater(StagedUpdateRepository repository,
                             PluginDescriptorLoader descriptorLoader,
                             PluginEnablementStore enablementStore,
                             ArtifactDescriptorParser descriptorParser,
                             PluginInstaller installer,
                             UpdateReconciler reconciler,
                             Path pluginsDir,
                             EventBus eventBus,
                             AutoUpdateResultHolder resultHolder,
                             int loaderThreads) {
        this.repository = repository;
        this.descriptorLoader = descriptorLoader;
        this.enablementStore = enablementStore;
        this.descriptorParser = descriptorParser;
        this.installer = installer;
        this.reconciler = reconciler;
        this.pluginsDir = pluginsDir;
        this.eventBus = eventBus != null ? eventBus : new EventBus();
        this.resultHolder = resultHolder;
        this.loaderThreads = Math.max(1, loaderThreads);
    }

    public AutoUpdateResultHolder getResultHolder() {
        return resultHolder;
    }

    /**
     * 应用暂存的插件更新，结果同时发布到 {@link AutoUpdateResultHolder}
     */
    public AutoUpdateOutcome applyPluginUpdates() {
        AutoUpdateOutcome outcome = null;
        try {
            Map<PluginId, PluginUpdateInfo> updates = filterExisting(repository.listStagedUpdates());
            int updatesApplied = applyPluginUpdates(updates);
            outcome = new AutoUpdateOutcome.Success(new PluginAutoUpdateStatistics(updates.size(), updatesApplied));
        } catch (Exception e) {
            log.error("Error occurred during application of plugin updates", e);
            outcome = new AutoUpdateOutcome.Failure(e);
        } finally {
            clearStagedUpdates();
            if (outcome == null) {
                // Error 穿透时也要让观察者拿到结果
                outcome = new AutoUpdateOutcome.Failure(new UpstageException("Plugin auto update was aborted"));
            }
            publish(outcome);
        }
        return outcome;
    }

    // ==================== 主流程 ====================

    /**
     * @return 成功应用的更新数量
     */
    private int applyPluginUpdates(Map<PluginId, PluginUpdateInfo> updates) {
        if (updates.isEmpty()) {
            return 0;
        }
        log.info("There are {} prepared updates for plugins. Applying...", updates.size());
        Path autoUpdateDir = repository.getAutoUpdateDirPath();

        long start = System.currentTimeMillis();
        PluginLoadingResult currentDescriptors = descriptorLoader.loadCurrentDescriptors();
        log.debug("Loaded existing descriptors in {} ms", System.currentTimeMillis() - start);

        Map<PluginId, PluginUpdateInfo> loadable = new TreeMap<>();
        updates.forEach((id, info) -> {
            boolean pluginForUpdateExists = !enablementStore.isDisabled(id) && currentDescriptors.contains(id);
            if (pluginForUpdateExists) {
                loadable.put(id, info);
            } else {
                log.warn("Update for plugin {} is declined since the plugin is not going to be loaded", id);
            }
        });

        Map<PluginId, PluginDescriptor> updateDescriptors = loadUpdateDescriptors(loadable, autoUpdateDir);

        UpdateCheckResult updateCheck = reconciler.reconcile(currentDescriptors, updateDescriptors);
        updateCheck.rejectedUpdates().forEach((id, reason) -> {
            log.warn("Update for plugin {} has been rejected: {}", id, reason);
            eventBus.publish(new PluginUpdateRejectedEvent(id, reason));
        });

        int updatesApplied = 0;
        for (PluginId id : updateCheck.updatesToApply()) {
            PluginUpdateInfo update = loadable.get(id);
            PluginDescriptor existing = currentDescriptors.findExisting(id);
            String oldVersion = existing != null ? existing.getVersion() : null;
            String newVersion = updateDescriptors.get(id).getVersion();
            try {
                Path installed = installer.unpack(autoUpdateDir.resolve(update.updateFilename()), pluginsDir);
                removePreviousInstallation(id, update, installed);
                log.info("Plugin {} has been successfully updated: version {} -> {}", id, oldVersion, newVersion);
                updatesApplied++;
                eventBus.publish(new PluginUpdatedEvent(id, oldVersion, newVersion));
            } catch (Exception e) {
                log.warn("Failed to apply update for plugin {}", id, e);
                eventBus.publish(new PluginUpdateFailedEvent(id, e));
            }
        }
        return updatesApplied;
    }

    /**
     * 只保留原插件与更新包都存在的暂存项，检查出错按不存在处理
     */
    private Map<PluginId, PluginUpdateInfo> filterExisting(Map<PluginId, PluginUpdateInfo> staged) {
        Map<PluginId, PluginUpdateInfo> result = new TreeMap<>();
        staged.forEach((id, info) -> {
            try {
                boolean pluginExists = Files.exists(Path.of(info.pluginPath()));
                boolean updateExists = Files.exists(repository.getAutoUpdateDirPath().resolve(info.updateFilename()));
                if (pluginExists && updateExists) {
                    result.put(id, info);
                } else {
                    log.debug("Skipping staged update for plugin {}: plugin exists={}, update exists={}",
                            id, pluginExists, updateExists);
                }
            } catch (Exception e) {
                log.warn("Failed to check staged update for plugin {}", id, e);
            }
        });
        return result;
    }

    /**
     * 并行解析更新包描述符，按 PluginId 顺序汇总；解析失败的更新被排除
     */
    private Map<PluginId, PluginDescriptor> loadUpdateDescriptors(Map<PluginId, PluginUpdateInfo> updates,
                                                                  Path autoUpdateDir) {
        Map<PluginId, PluginDescriptor> result = new TreeMap<>();
        if (updates.isEmpty()) {
            return result;
        }
        ExecutorService executor = createLoaderExecutor(updates.size());
        try {
            // 全部提交后再逐个等待
            Map<PluginId, Future<PluginDescriptor>> futures = new LinkedHashMap<>();
            updates.forEach((id, info) -> {
                Path updateFile = autoUpdateDir.resolve(info.updateFilename());
                futures.put(id, executor.submit(() -> loadUpdateDescriptor(id, updateFile)));
            });

            for (Map.Entry<PluginId, Future<PluginDescriptor>> entry : futures.entrySet()) {
                try {
                    result.put(entry.getKey(), entry.getValue().get());
                } catch (ExecutionException e) {
                    log.warn("Update for plugin {} has failed to load", entry.getKey(), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstageException("Interrupted while loading plugin update descriptors", e);
        } finally {
            executor.shutdownNow();
        }
        return result;
    }

    private PluginDescriptor loadUpdateDescriptor(PluginId id, Path updateFile) {
        PluginDescriptor descriptor = descriptorParser.parseDescriptor(updateFile);
        if (!id.equals(descriptor.pluginId())) {
            throw new DescriptorParseException("Update artifact " + updateFile.getFileName()
                    + " declares plugin " + descriptor.getId() + " instead of " + id);
        }
        return descriptor;
    }

    private ExecutorService createLoaderExecutor(int tasks) {
        int threads = Math.min(loaderThreads, tasks);
        return new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(tasks),
                r -> {
                    Thread t = new Thread(r);
                    t.setName("upstage-descriptor-loader-" + threadNumber.getAndIncrement());
                    t.setDaemon(true);
                    return t;
                }
        );
    }

    /**
     * 新版本解包到不同位置时 (例如 jar 文件名带版本号)，删除插件目录内的旧版本
     */
    private void removePreviousInstallation(PluginId id, PluginUpdateInfo update, Path installed) {
        Path previous = Path.of(update.pluginPath()).toAbsolutePath().normalize();
        Path pluginsRoot = pluginsDir.toAbsolutePath().normalize();
        if (previous.equals(installed.toAbsolutePath().normalize()) || !previous.startsWith(pluginsRoot)
                || previous.equals(pluginsRoot)) {
            return;
        }
        try {
            PathUtils.deleteRecursively(previous);
            log.debug("Removed previous installation of plugin {} at {}", id, previous);
        } catch (IOException e) {
            log.warn("Failed to remove previous installation of plugin {} at {}", id, previous, e);
        }
    }

    // ==================== 收尾 ====================

    private void clearStagedUpdates() {
        try {
            repository.clearStagedUpdates();
        } catch (Exception e) {
            log.warn("Failed to clear plugin auto update directory", e);
        }
    }

    private void publish(AutoUpdateOutcome outcome) {
        if (!resultHolder.publish(outcome)) {
            log.warn("Plugin auto update result has already been published, ignoring {}", outcome);
            return;
        }
        if (outcome instanceof AutoUpdateOutcome.Success success) {
            log.info("Plugin auto update finished: {} prepared, {} applied",
                    success.statistics().updatesPrepared(), success.statistics().pluginsUpdated());
            eventBus.publish(new AutoUpdateFinishedEvent(success.statistics()));
        }
    }
}
