package com.upstage.runtime;

import com.upstage.core.config.UpstageConfig;
import com.upstage.core.event.EventBus;
import com.upstage.core.spi.StagedUpdateRepository;
import com.upstage.core.update.AutoUpdateResultHolder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 启动后交给宿主的句柄
 * 宿主后续阶段通过它读取自动更新结果或暂存新的更新
 */
@Getter
@RequiredArgsConstructor
public class UpstageRuntime {

    private final UpstageConfig config;
    private final EventBus eventBus;
    private final StagedUpdateRepository stagedUpdateRepository;
    private final AutoUpdateResultHolder autoUpdateResult;
}
