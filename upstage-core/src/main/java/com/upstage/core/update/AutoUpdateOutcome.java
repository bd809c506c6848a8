package com.upstage.core.update;

import com.upstage.api.update.PluginAutoUpdateStatistics;

import java.util.Optional;

/**
 * 一次自动更新的最终结果
 */
public sealed interface AutoUpdateOutcome {

    boolean isSuccess();

    Optional<PluginAutoUpdateStatistics> getStatistics();

    /**
     * 流程正常结束 (单个插件的失败不影响该结果)
     */
    record Success(PluginAutoUpdateStatistics statistics) implements AutoUpdateOutcome {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<PluginAutoUpdateStatistics> getStatistics() {
            return Optional.of(statistics);
        }
    }

    /**
     * 流程被意外异常中断
     */
    record Failure(Throwable cause) implements AutoUpdateOutcome {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<PluginAutoUpdateStatistics> getStatistics() {
            return Optional.empty();
        }
    }
}
