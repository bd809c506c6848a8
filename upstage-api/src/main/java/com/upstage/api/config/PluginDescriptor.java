package com.upstage.api.config;

import com.upstage.api.plugin.PluginId;
import lombok.Getter;
import lombok.Setter;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 对应 plugin.yml 的根节点
 * 既描述已安装插件，也描述暂存的更新包
 */
@Getter
@Setter
public class PluginDescriptor implements Serializable {

    // === 基础元数据 ===
    private String id;
    private String name;
    private String version;
    private String vendor;
    private String description;

    // === 宿主兼容范围 (空表示不限制) ===
    private String sinceBuild;
    private String untilBuild;

    // 随宿主发行，不能单独更新
    private boolean essential;

    // 依赖列表，保持声明顺序
    private List<PluginDependency> dependencies = new ArrayList<>();

    // 插件所在位置，由加载器填充，不来自 yml
    private transient Path path;

    public PluginId pluginId() {
        return PluginId.of(id);
    }

    /**
     * 深拷贝
     */
    public PluginDescriptor copy() {
        PluginDescriptor copy = new PluginDescriptor();
        copy.id = this.id;
        copy.name = this.name;
        copy.version = this.version;
        copy.vendor = this.vendor;
        copy.description = this.description;
        copy.sinceBuild = this.sinceBuild;
        copy.untilBuild = this.untilBuild;
        copy.essential = this.essential;
        copy.path = this.path;

        if (this.dependencies != null) {
            copy.dependencies = this.dependencies.stream()
                    .map(PluginDependency::copy)
                    .collect(Collectors.toCollection(ArrayList::new));
        }
        return copy;
    }

    /**
     * 验证
     */
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Plugin id cannot be blank");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Plugin version cannot be blank");
        }
        if (dependencies != null) {
            for (PluginDependency dependency : dependencies) {
                if (dependency == null || dependency.getId() == null || dependency.getId().isBlank()) {
                    throw new IllegalArgumentException("Plugin " + id + " declares a dependency without id");
                }
            }
        }
    }

    @Override
    public String toString() {
        return String.format("PluginDescriptor{id='%s', version='%s'}", id, version);
    }

    // ==================== 嵌套类 ====================

    /**
     * 插件依赖
     */
    @Getter
    @Setter
    public static class PluginDependency implements Serializable {

        private String id;
        private boolean optional;

        public PluginDependency() {
        }

        public PluginDependency(String id, boolean optional) {
            this.id = id;
            this.optional = optional;
        }

        public PluginId pluginId() {
            return PluginId.of(id);
        }

        public PluginDependency copy() {
            return new PluginDependency(id, optional);
        }
    }
}
