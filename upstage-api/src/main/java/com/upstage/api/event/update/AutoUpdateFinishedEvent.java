package com.upstage.api.event.update;

import com.upstage.api.event.AbstractUpstageEvent;
import com.upstage.api.update.PluginAutoUpdateStatistics;
import lombok.Getter;

/**
 * 本次启动的自动更新已结束
 */
@Getter
public class AutoUpdateFinishedEvent extends AbstractUpstageEvent {
    private final PluginAutoUpdateStatistics statistics;

    public AutoUpdateFinishedEvent(PluginAutoUpdateStatistics statistics) {
        super();
        this.statistics = statistics;
    }
}
