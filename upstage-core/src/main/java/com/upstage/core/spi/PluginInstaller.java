package com.upstage.core.spi;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 插件安装器
 */
public interface PluginInstaller {

    /**
     * 将插件包解包到插件目录，覆盖同名旧版本
     *
     * @return 解包后的插件位置
     */
    Path unpack(Path artifact, Path pluginsDir) throws IOException;
}
