package com.upstage.core.install;

import com.upstage.core.spi.PluginInstaller;
import com.upstage.core.util.PathUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * 插件包安装器
 * <p>
 * jar：复制到插件目录，覆盖同名文件；
 * zip：必须只有一个顶层目录，先解压到插件目录下的临时目录，再整体替换同名插件目录。
 */
@Slf4j
public class ArchivePluginInstaller implements PluginInstaller {

    @Override
    public Path unpack(Path artifact, Path pluginsDir) throws IOException {
        String name = artifact.getFileName().toString();
        Files.createDirectories(pluginsDir);
        if (name.endsWith(".jar")) {
            Path target = pluginsDir.resolve(name);
            Files.copy(artifact, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Copied {} to {}", artifact, target);
            return target;
        }
        if (name.endsWith(".zip")) {
            return unzip(artifact, pluginsDir);
        }
        throw new IOException("Unsupported plugin artifact: " + name);
    }

    private Path unzip(Path artifact, Path pluginsDir) throws IOException {
        String root;
        try (ZipFile zip = new ZipFile(artifact.toFile())) {
            root = topLevelDirectory(zip, artifact);
        }
        Path pluginsRoot = pluginsDir.toAbsolutePath().normalize();
        Path target = pluginsRoot.resolve(root).normalize();
        if (!pluginsRoot.equals(target.getParent())) {
            throw new IOException("Plugin archive root " + root + " does not resolve inside " + pluginsRoot);
        }

        Path tempDir = Files.createTempDirectory(pluginsRoot, ".upstage-unpack-");
        try {
            Path staging = Files.createDirectory(tempDir.resolve("new"));
            try (ZipFile zip = new ZipFile(artifact.toFile())) {
                extract(zip, staging);
            }
            replace(staging.resolve(root), target, tempDir.resolve("previous"));
            log.debug("Unpacked {} to {}", artifact, target);
            return target;
        } finally {
            PathUtils.deleteRecursively(tempDir);
        }
    }

    /**
     * 用新目录替换旧目录；旧目录先移到备份位置，替换失败时还原
     */
    private void replace(Path extracted, Path target, Path backup) throws IOException {
        boolean hadPrevious = Files.exists(target, LinkOption.NOFOLLOW_LINKS);
        if (hadPrevious) {
            Files.move(target, backup);
        }
        try {
            moveIntoPlace(extracted, target);
        } catch (IOException | RuntimeException e) {
            if (hadPrevious) {
                try {
                    PathUtils.deleteRecursively(target);
                    Files.move(backup, target);
                } catch (IOException restoreError) {
                    log.error("Failed to restore previous installation at {}", target, restoreError);
                    e.addSuppressed(restoreError);
                }
            }
            throw e;
        }
    }

    void moveIntoPlace(Path source, Path target) throws IOException {
        Files.move(source, target);
    }

    private void extract(ZipFile zip, Path destination) throws IOException {
        Path normalizedRoot = destination.toAbsolutePath().normalize();
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            String name = entry.getName().replace('\\', '/');
            Path target = normalizedRoot.resolve(name).normalize();
            // 拒绝 zip-slip
            if (!target.startsWith(normalizedRoot)) {
                throw new IOException("Entry is outside of the target directory: " + entry.getName());
            }
            if (entry.isDirectory()) {
                Files.createDirectories(target);
                continue;
            }
            Files.createDirectories(target.getParent());
            try (InputStream in = zip.getInputStream(entry)) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }

    private String topLevelDirectory(ZipFile zip, Path artifact) throws IOException {
        String root = null;
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            String name = entries.nextElement().getName().replace('\\', '/');
            int slash = name.indexOf('/');
            String top = slash > 0 ? name.substring(0, slash) : null;
            if (top == null || (root != null && !root.equals(top))) {
                throw new IOException("Plugin archive must contain a single top-level directory: " + artifact);
            }
            root = top;
        }
        if (root == null) {
            throw new IOException("Plugin archive is empty: " + artifact);
        }
        // 拒绝 ./ 或 ../ 之类的顶层目录，否则会替换整个插件目录
        if (!PathUtils.isPlainDirectoryName(root)) {
            throw new IOException("Invalid top-level directory '" + root + "' in plugin archive: " + artifact);
        }
        return root;
    }
}
