package com.upstage.starter.configuration;

import com.upstage.core.config.UpstageConfig;
import com.upstage.core.enablement.DisabledPluginsFile;
import com.upstage.core.event.EventBus;
import com.upstage.core.install.ArchivePluginInstaller;
import com.upstage.core.loader.FileSystemPluginDescriptorLoader;
import com.upstage.core.loader.YamlDescriptorParser;
import com.upstage.core.spi.ArtifactDescriptorParser;
import com.upstage.core.spi.PluginDescriptorLoader;
import com.upstage.core.spi.PluginEnablementStore;
import com.upstage.core.spi.PluginInstaller;
import com.upstage.core.spi.StagedUpdateRepository;
import com.upstage.core.staging.FileStagedUpdateRepository;
import com.upstage.core.update.AutoUpdateResultHolder;
import com.upstage.core.update.PluginAutoUpdater;
import com.upstage.core.update.UpdateReconciler;
import com.upstage.core.version.PluginCompatibility;
import com.upstage.starter.config.UpstageProperties;
import com.upstage.starter.controller.UpstageOpsController;
import com.upstage.starter.runner.PluginAutoUpdateRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(UpstageProperties.class)
@ConditionalOnProperty(prefix = "upstage", name = "enabled", havingValue = "true", matchIfMissing = true)
public class UpstageAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public UpstageConfig upstageConfig(UpstageProperties properties) {
        UpstageConfig config = properties.toConfig();
        log.debug("Upstage config: {}", config);
        return config;
    }

    // 将事件总线注册为 Bean，宿主可直接订阅更新事件
    @Bean
    @ConditionalOnMissingBean
    public EventBus upstageEventBus() {
        return new EventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public PluginCompatibility pluginCompatibility(UpstageConfig config) {
        return PluginCompatibility.from(config);
    }

    @Bean
    @ConditionalOnMissingBean(ArtifactDescriptorParser.class)
    public ArtifactDescriptorParser artifactDescriptorParser() {
        return new YamlDescriptorParser();
    }

    @Bean
    @ConditionalOnMissingBean(PluginEnablementStore.class)
    public PluginEnablementStore pluginEnablementStore(UpstageConfig config) {
        return new DisabledPluginsFile(config.configHomePath());
    }

    @Bean
    @ConditionalOnMissingBean(StagedUpdateRepository.class)
    public StagedUpdateRepository stagedUpdateRepository(UpstageConfig config) {
        return new FileStagedUpdateRepository(config.autoUpdateDirPath());
    }

    @Bean
    @ConditionalOnMissingBean(PluginDescriptorLoader.class)
    public PluginDescriptorLoader pluginDescriptorLoader(UpstageConfig config,
                                                         ArtifactDescriptorParser parser,
                                                         PluginEnablementStore enablementStore,
                                                         PluginCompatibility compatibility) {
        return new FileSystemPluginDescriptorLoader(config.pluginHomePath(), parser, enablementStore, compatibility);
    }

    @Bean
    @ConditionalOnMissingBean(PluginInstaller.class)
    public PluginInstaller pluginInstaller() {
        return new ArchivePluginInstaller();
    }

    @Bean
    @ConditionalOnMissingBean
    public UpdateReconciler updateReconciler(PluginCompatibility compatibility) {
        return new UpdateReconciler(compatibility);
    }

    @Bean
    @ConditionalOnMissingBean
    public AutoUpdateResultHolder autoUpdateResultHolder() {
        return new AutoUpdateResultHolder();
    }

    @Bean
    @ConditionalOnMissingBean
    public PluginAutoUpdater pluginAutoUpdater(UpstageConfig config,
                                               StagedUpdateRepository repository,
                                               PluginDescriptorLoader descriptorLoader,
                                               PluginEnablementStore enablementStore,
                                               ArtifactDescriptorParser parser,
                                               PluginInstaller installer,
                                               UpdateReconciler reconciler,
                                               EventBus eventBus,
                                               AutoUpdateResultHolder resultHolder) {
        return new PluginAutoUpdater(repository, descriptorLoader, enablementStore, parser, installer, reconciler,
                config.pluginHomePath(), eventBus, resultHolder, config.getDescriptorLoaderThreads());
    }

    @Bean
    @ConditionalOnProperty(prefix = "upstage", name = "auto-update-enabled", havingValue = "true", matchIfMissing = true)
    public PluginAutoUpdateRunner pluginAutoUpdateRunner(PluginAutoUpdater updater) {
        return new PluginAutoUpdateRunner(updater);
    }

    @Bean
    @ConditionalOnWebApplication
    public UpstageOpsController upstageOpsController(AutoUpdateResultHolder resultHolder,
                                                     StagedUpdateRepository repository,
                                                     PluginDescriptorLoader descriptorLoader,
                                                     ArtifactDescriptorParser parser) {
        return new UpstageOpsController(resultHolder, repository, descriptorLoader, parser);
    }
}
