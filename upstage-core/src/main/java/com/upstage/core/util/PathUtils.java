package com.upstage.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 文件系统辅助方法
 */
public final class PathUtils {

    private PathUtils() {
    }

    /**
     * 递归删除文件或目录，不存在时直接返回
     */
    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(path)) {
            // 先删子项再删目录
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path p : paths) {
            Files.deleteIfExists(p);
        }
    }

    /**
     * 是否可作为插件目录下的单层目录名：非空、不是 . 或 ..、不含分隔符或根
     */
    public static boolean isPlainDirectoryName(String name) {
        if (name == null || name.isEmpty() || ".".equals(name) || "..".equals(name)
                || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0) {
            return false;
        }
        try {
            Path path = Path.of(name);
            return !path.isAbsolute() && path.getNameCount() == 1 && path.normalize().equals(path);
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
