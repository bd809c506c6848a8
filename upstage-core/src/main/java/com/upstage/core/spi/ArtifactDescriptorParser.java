package com.upstage.core.spi;

import com.upstage.api.config.PluginDescriptor;
import com.upstage.api.exception.DescriptorParseException;

import java.nio.file.Path;

/**
 * 插件包描述符解析器
 */
public interface ArtifactDescriptorParser {

    /**
     * 从插件包 (目录、jar 或 zip) 中解析 plugin.yml
     *
     * @throws DescriptorParseException 无法读取或描述符非法
     */
    PluginDescriptor parseDescriptor(Path artifact) throws DescriptorParseException;
}
