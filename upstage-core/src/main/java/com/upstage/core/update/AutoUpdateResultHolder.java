package com.upstage.core.update;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 自动更新结果的一次性写入槽
 * <p>
 * 首个写入者生效；读取方从不阻塞，发布前读取得到空值。
 * 由启动器创建并显式传递给需要统计信息的组件。
 */
public class AutoUpdateResultHolder {

    private final CompletableFuture<AutoUpdateOutcome> result = new CompletableFuture<>();

    /**
     * 发布结果
     *
     * @return 本次写入是否生效
     */
    public boolean publish(AutoUpdateOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("Outcome cannot be null");
        }
        return result.complete(outcome);
    }

    /**
     * 非阻塞读取，未发布时返回空
     */
    public Optional<AutoUpdateOutcome> get() {
        return Optional.ofNullable(result.getNow(null));
    }

    public boolean isPublished() {
        return result.isDone();
    }

    /**
     * 供需要在结果发布后执行回调的组件使用，调用方无法借此写入结果
     */
    public CompletionStage<AutoUpdateOutcome> whenPublished() {
        return result.minimalCompletionStage();
    }
}
