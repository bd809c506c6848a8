package com.upstage.core.loader;

import com.upstage.api.config.PluginDescriptor;
import com.upstage.api.plugin.PluginId;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 当前插件清单的只读快照
 * <p>
 * idMap 为将被完整加载的插件，incompleteIdMap 为存在但不会被加载的插件 (已禁用、不兼容)。
 * 同一 ID 至多出现在其中一个表中。
 */
public final class PluginLoadingResult {

    private final Map<PluginId, PluginDescriptor> idMap;
    private final Map<PluginId, PluginDescriptor> incompleteIdMap;

    private PluginLoadingResult(Map<PluginId, PluginDescriptor> idMap,
                                Map<PluginId, PluginDescriptor> incompleteIdMap) {
        this.idMap = Collections.unmodifiableMap(new TreeMap<>(idMap));
        this.incompleteIdMap = Collections.unmodifiableMap(new TreeMap<>(incompleteIdMap));
    }

    public static PluginLoadingResult empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<PluginId, PluginDescriptor> getIdMap() {
        return idMap;
    }

    public Map<PluginId, PluginDescriptor> getIncompleteIdMap() {
        return incompleteIdMap;
    }

    /**
     * 优先返回完整加载的描述符
     */
    @Nullable
    public PluginDescriptor findExisting(PluginId id) {
        PluginDescriptor loaded = idMap.get(id);
        return loaded != null ? loaded : incompleteIdMap.get(id);
    }

    public boolean contains(PluginId id) {
        return idMap.containsKey(id) || incompleteIdMap.containsKey(id);
    }

    @Override
    public String toString() {
        return "PluginLoadingResult{loaded=" + idMap.keySet() + ", incomplete=" + incompleteIdMap.keySet() + "}";
    }

    // ==================== 构建器 ====================

    public static final class Builder {

        private final Map<PluginId, PluginDescriptor> idMap = new TreeMap<>();
        private final Map<PluginId, PluginDescriptor> incompleteIdMap = new TreeMap<>();

        private Builder() {
        }

        /**
         * 添加完整加载的插件，同时移除同 ID 的不完整记录
         */
        public Builder addLoaded(PluginDescriptor descriptor) {
            PluginId id = descriptor.pluginId();
            incompleteIdMap.remove(id);
            idMap.put(id, descriptor);
            return this;
        }

        /**
         * 添加不完整插件；若同 ID 已完整加载则忽略
         */
        public Builder addIncomplete(PluginDescriptor descriptor) {
            PluginId id = descriptor.pluginId();
            if (!idMap.containsKey(id)) {
                incompleteIdMap.put(id, descriptor);
            }
            return this;
        }

        public PluginLoadingResult build() {
            return new PluginLoadingResult(idMap, incompleteIdMap);
        }
    }
}
