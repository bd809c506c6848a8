package com.upstage.starter.runner;

import com.upstage.core.update.AutoUpdateOutcome;
import com.upstage.core.update.PluginAutoUpdater;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;

/**
 * 单例全部就绪后应用一次暂存的插件更新
 * 宿主的插件加载逻辑应晚于此阶段执行
 */
@Slf4j
@RequiredArgsConstructor
public class PluginAutoUpdateRunner implements SmartInitializingSingleton {

    private final PluginAutoUpdater updater;

    @Override
    public void afterSingletonsInstantiated() {
        if (updater.getResultHolder().isPublished()) {
            log.debug("Plugin auto update has already run, skipping");
            return;
        }
        AutoUpdateOutcome outcome = updater.applyPluginUpdates();
        log.debug("Plugin auto update outcome: {}", outcome);
    }
}
