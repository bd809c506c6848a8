package com.upstage.api.event;

import com.upstage.api.event.update.PluginUpdateRejectedEvent;
import com.upstage.api.plugin.PluginId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("更新事件单元测试")
class UpdateEventTest {

    @Test
    @DisplayName("toString 包含插件 ID 与时间戳")
    void toStringShouldDescribePlugin() {
        PluginUpdateRejectedEvent event = new PluginUpdateRejectedEvent(PluginId.of("com.example.foo"), "nope");

        String text = event.toString();
        assertTrue(text.startsWith("PluginUpdateRejectedEvent[pluginId=com.example.foo, timestamp="), text);
        assertTrue(text.endsWith(event.getTimestamp() + "]"), text);
    }

    @Test
    @DisplayName("事件时间戳取创建时刻")
    void timestampShouldBeCreationTime() {
        long before = System.currentTimeMillis();
        PluginUpdateRejectedEvent event = new PluginUpdateRejectedEvent(PluginId.of("com.example.foo"), "nope");
        long after = System.currentTimeMillis();

        assertTrue(event.getTimestamp() >= before && event.getTimestamp() <= after);
    }
}
