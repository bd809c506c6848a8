package com.upstage.core.update;

import com.upstage.api.config.PluginDescriptor;
import com.upstage.api.plugin.PluginId;
import com.upstage.core.loader.PluginLoadingResult;
import com.upstage.core.version.PluginCompatibility;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 更新校验器
 * <p>
 * 对每个候选更新按固定顺序执行规则，首个命中的规则决定拒绝原因：
 * <ol>
 *     <li>未安装</li>
 *     <li>与当前宿主构建不兼容</li>
 *     <li>已知损坏</li>
 *     <li>随宿主发行</li>
 *     <li>不比已安装版本新</li>
 *     <li>存在未满足的必需依赖</li>
 * </ol>
 * 无状态，可重复调用。
 */
@Slf4j
public class UpdateReconciler {

    private final List<UpdateRule> rules;

    public UpdateReconciler(PluginCompatibility compatibility) {
        this.rules = List.of(
                new UpdateRule("not-installed",
                        c -> c.existing() == null,
                        c -> "plugin " + c.id() + " is not installed"),
                new UpdateRule("incompatible",
                        c -> compatibility.isIncompatible(c.update()),
                        c -> "plugin " + c.id() + " of version " + c.update().getVersion()
                                + " is not compatible with current IDE build"),
                new UpdateRule("broken",
                        c -> compatibility.isBroken(c.update()),
                        c -> "plugin " + c.id() + " of version " + c.update().getVersion() + " is known to be broken"),
                new UpdateRule("essential",
                        c -> compatibility.isEssential(c.id(), c.existing()),
                        c -> "plugin " + c.id() + " is part of the IDE distribution and cannot be updated without IDE update"),
                new UpdateRule("not-newer",
                        c -> compatibility.compareSkipBrokenAndIncompatible(c.update().getVersion(), c.existing()) <= 0,
                        c -> "plugin " + c.id() + " has same or newer version installed ("
                                + c.existing().getVersion() + " vs update version " + c.update().getVersion() + ")"),
                new UpdateRule("unmet-dependencies",
                        c -> !findUnmetDependencies(c.update(), c.current()).isEmpty(),
                        c -> "plugin " + c.id() + " of version " + c.update().getVersion()
                                + " has unmet dependencies (plugin ids): "
                                + findUnmetDependencies(c.update(), c.current()).stream()
                                .map(PluginId::idString)
                                .collect(Collectors.joining(", ")))
        );
    }

    public List<UpdateRule> getRules() {
        return rules;
    }

    /**
     * 校验候选更新
     *
     * @param current    当前插件清单
     * @param candidates 候选更新描述符
     * @return 每个候选恰好出现在通过集合或拒绝表之一
     */
    public UpdateCheckResult reconcile(PluginLoadingResult current, Map<PluginId, PluginDescriptor> candidates) {
        Set<PluginId> updatesToApply = new HashSet<>();
        Map<PluginId, String> rejectedUpdates = new HashMap<>();

        for (Map.Entry<PluginId, PluginDescriptor> entry : candidates.entrySet()) {
            PluginId id = entry.getKey();
            try {
                Optional<String> rejection = evaluate(new UpdateCandidate(id, entry.getValue(), current.findExisting(id), current));
                if (rejection.isPresent()) {
                    rejectedUpdates.put(id, rejection.get());
                } else {
                    updatesToApply.add(id);
                }
            } catch (Exception e) {
                // 单个候选出错按拒绝处理，不影响其他候选
                log.warn("Failed to validate update for plugin {}", id, e);
                rejectedUpdates.put(id, "plugin " + id + " could not be validated: " + e.getMessage());
            }
        }
        return new UpdateCheckResult(updatesToApply, rejectedUpdates);
    }

    private Optional<String> evaluate(UpdateCandidate candidate) {
        for (UpdateRule rule : rules) {
            Optional<String> reason = rule.check(candidate);
            if (reason.isPresent()) {
                log.debug("Update for plugin {} hit rule '{}'", candidate.id(), rule.name());
                return reason;
            }
        }
        return Optional.empty();
    }

    /**
     * 返回两个清单中都不存在的必需依赖，保持声明顺序 (重复声明照原样列出)
     */
    static List<PluginId> findUnmetDependencies(PluginDescriptor update, PluginLoadingResult current) {
        if (update.getDependencies() == null) {
            return List.of();
        }
        return update.getDependencies().stream()
                .filter(dep -> !dep.isOptional())
                .map(PluginDescriptor.PluginDependency::pluginId)
                .filter(depId -> !current.contains(depId))
                .collect(Collectors.toList());
    }
}
