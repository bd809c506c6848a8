package com.upstage.core.update;

import com.upstage.api.plugin.PluginId;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 更新校验结果
 *
 * @param updatesToApply  通过校验的插件
 * @param rejectedUpdates 被拒绝的插件及原因
 */
public record UpdateCheckResult(Set<PluginId> updatesToApply, Map<PluginId, String> rejectedUpdates) {

    public UpdateCheckResult {
        updatesToApply = Collections.unmodifiableSet(new TreeSet<>(updatesToApply));
        rejectedUpdates = Collections.unmodifiableMap(new TreeMap<>(rejectedUpdates));
    }

    public boolean isApproved(PluginId id) {
        return updatesToApply.contains(id);
    }
}
