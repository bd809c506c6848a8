package com.upstage.api.plugin;

import java.io.Serializable;

/**
 * 插件唯一标识
 * <p>
 * 作为插件清单、暂存清单与更新校验结果中的统一 Key，按 id 字符串自然排序。
 */
public record PluginId(String idString) implements Comparable<PluginId>, Serializable {

    public PluginId {
        if (idString == null || idString.isBlank()) {
            throw new IllegalArgumentException("Plugin id cannot be blank");
        }
        idString = idString.trim();
    }

    public static PluginId of(String idString) {
        return new PluginId(idString);
    }

    @Override
    public int compareTo(PluginId other) {
        return idString.compareTo(other.idString);
    }

    @Override
    public String toString() {
        return idString;
    }
}
