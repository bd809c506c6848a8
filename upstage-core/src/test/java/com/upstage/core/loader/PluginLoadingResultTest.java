package com.upstage.core.loader;

import com.upstage.api.plugin.PluginId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.upstage.core.support.PluginArtifacts.descriptor;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginLoadingResult 单元测试")
class PluginLoadingResultTest {

    @Test
    @DisplayName("完整加载的描述符覆盖不完整记录")
    void loadedShouldReplaceIncomplete() {
        PluginLoadingResult result = PluginLoadingResult.builder()
                .addIncomplete(descriptor("foo", "1.0"))
                .addLoaded(descriptor("foo", "1.1"))
                .build();

        assertTrue(result.getIncompleteIdMap().isEmpty());
        assertEquals("1.1", result.getIdMap().get(PluginId.of("foo")).getVersion());
    }

    @Test
    @DisplayName("已完整加载时忽略不完整记录")
    void incompleteShouldNotShadowLoaded() {
        PluginLoadingResult result = PluginLoadingResult.builder()
                .addLoaded(descriptor("foo", "1.0"))
                .addIncomplete(descriptor("foo", "0.9"))
                .build();

        assertEquals("1.0", result.findExisting(PluginId.of("foo")).getVersion());
        assertFalse(result.getIncompleteIdMap().containsKey(PluginId.of("foo")));
    }

    @Test
    @DisplayName("两张表都能被查到")
    void shouldFindInEitherMap() {
        PluginLoadingResult result = PluginLoadingResult.builder()
                .addLoaded(descriptor("foo", "1.0"))
                .addIncomplete(descriptor("bar", "2.0"))
                .build();

        assertTrue(result.contains(PluginId.of("foo")));
        assertTrue(result.contains(PluginId.of("bar")));
        assertFalse(result.contains(PluginId.of("baz")));
        assertEquals("2.0", result.findExisting(PluginId.of("bar")).getVersion());
        assertNull(result.findExisting(PluginId.of("baz")));
    }

    @Test
    @DisplayName("快照不可修改")
    void snapshotShouldBeReadOnly() {
        PluginLoadingResult result = PluginLoadingResult.empty();
        assertThrows(UnsupportedOperationException.class,
                () -> result.getIdMap().put(PluginId.of("foo"), descriptor("foo", "1.0")));
    }
}
