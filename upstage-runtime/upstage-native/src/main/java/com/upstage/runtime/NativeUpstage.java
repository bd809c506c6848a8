package com.upstage.runtime;

import com.upstage.core.config.UpstageConfig;
import com.upstage.core.enablement.DisabledPluginsFile;
import com.upstage.core.event.EventBus;
import com.upstage.core.install.ArchivePluginInstaller;
import com.upstage.core.loader.FileSystemPluginDescriptorLoader;
import com.upstage.core.loader.YamlDescriptorParser;
import com.upstage.core.staging.FileStagedUpdateRepository;
import com.upstage.core.update.AutoUpdateResultHolder;
import com.upstage.core.update.PluginAutoUpdater;
import com.upstage.core.update.UpdateReconciler;
import com.upstage.core.version.PluginCompatibility;
import lombok.extern.slf4j.Slf4j;

/**
 * Upstage Native 启动器
 * 宿主应用在加载插件之前调用一次，应用上次运行期间暂存的插件更新
 */
@Slf4j
public final class NativeUpstage {

    private NativeUpstage() {
    }

    /**
     * 使用默认配置启动
     */
    public static UpstageRuntime start() {
        return start(UpstageConfig.builder().build());
    }

    /**
     * 使用自定义配置启动
     */
    public static UpstageRuntime start(UpstageConfig config) {
        return start(config, new EventBus());
    }

    /**
     * 使用自定义配置与事件总线启动 (便于宿主提前订阅更新事件)
     */
    public static UpstageRuntime start(UpstageConfig config, EventBus eventBus) {
        long start = System.currentTimeMillis();
        log.info("Starting Upstage Native Runtime...");

        // 准备基础设施
        PluginCompatibility compatibility = PluginCompatibility.from(config);
        YamlDescriptorParser parser = new YamlDescriptorParser();
        DisabledPluginsFile enablementStore = new DisabledPluginsFile(config.configHomePath());
        FileStagedUpdateRepository repository = new FileStagedUpdateRepository(config.autoUpdateDirPath());
        AutoUpdateResultHolder resultHolder = new AutoUpdateResultHolder();

        if (config.isAutoUpdateEnabled()) {
            PluginAutoUpdater updater = new PluginAutoUpdater(
                    repository,
                    new FileSystemPluginDescriptorLoader(config.pluginHomePath(), parser, enablementStore, compatibility),
                    enablementStore,
                    parser,
                    new ArchivePluginInstaller(),
                    new UpdateReconciler(compatibility),
                    config.pluginHomePath(),
                    eventBus,
                    resultHolder,
                    config.getDescriptorLoaderThreads()
            );
            updater.applyPluginUpdates();
        } else {
            log.info("Plugin auto update is disabled, staged updates are kept for the next start");
        }

        log.info("Upstage Native started in {} ms", System.currentTimeMillis() - start);
        return new UpstageRuntime(config, eventBus, repository, resultHolder);
    }
}
