package com.upstage.core.loader;

import com.upstage.api.config.PluginDescriptor;
import com.upstage.api.exception.DescriptorParseException;
import com.upstage.core.spi.ArtifactDescriptorParser;
import com.upstage.core.util.PathUtils;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipInputStream;

/**
 * plugin.yml 解析器
 * <p>
 * 支持三种插件包形态：
 * <ul>
 *     <li>目录：根目录或 META-INF 下的 plugin.yml，或 lib 下某个 jar 内的 plugin.yml</li>
 *     <li>jar：根目录或 META-INF 下的 plugin.yml</li>
 *     <li>zip：唯一顶层目录下的 plugin.yml，或该目录 lib 下某个 jar 内的 plugin.yml</li>
 * </ul>
 */
@Slf4j
public class YamlDescriptorParser implements ArtifactDescriptorParser {

    public static final String DESCRIPTOR_NAME = "plugin.yml";
    private static final List<String> DESCRIPTOR_LOCATIONS = List.of(DESCRIPTOR_NAME, "META-INF/" + DESCRIPTOR_NAME);

    public static PluginDescriptor load(InputStream inputStream) {
        // SnakeYAML 2.x 建议显式传入 LoaderOptions
        LoaderOptions options = new LoaderOptions();

        // 只允许映射到 PluginDescriptor，忽略未知字段以兼容新版本描述符
        Constructor constructor = new Constructor(PluginDescriptor.class, options);
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        constructor.setPropertyUtils(propertyUtils);

        Yaml yaml = new Yaml(constructor);
        return yaml.load(inputStream);
    }

    @Override
    public PluginDescriptor parseDescriptor(Path artifact) throws DescriptorParseException {
        if (artifact == null || !Files.exists(artifact)) {
            throw new DescriptorParseException("Plugin artifact does not exist: " + artifact);
        }
        PluginDescriptor descriptor;
        try {
            descriptor = Files.isDirectory(artifact) ? parseDirectory(artifact) : parseArchive(artifact);
        } catch (IOException | YAMLException e) {
            throw new DescriptorParseException("Failed to read " + DESCRIPTOR_NAME + " from " + artifact, e);
        }
        if (descriptor == null) {
            throw new DescriptorParseException("No " + DESCRIPTOR_NAME + " found in " + artifact);
        }
        try {
            descriptor.validate();
        } catch (IllegalArgumentException e) {
            throw new DescriptorParseException("Invalid " + DESCRIPTOR_NAME + " in " + artifact + ": " + e.getMessage(), e);
        }
        descriptor.setPath(artifact);
        return descriptor;
    }

    // ==================== 目录 ====================

    private PluginDescriptor parseDirectory(Path dir) throws IOException {
        for (String location : DESCRIPTOR_LOCATIONS) {
            Path file = dir.resolve(location);
            if (Files.isRegularFile(file)) {
                try (InputStream in = Files.newInputStream(file)) {
                    return load(in);
                }
            }
        }

        Path lib = dir.resolve("lib");
        if (!Files.isDirectory(lib)) {
            return null;
        }
        List<Path> jars;
        try (Stream<Path> files = Files.list(lib)) {
            jars = files.filter(p -> p.getFileName().toString().endsWith(".jar"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        for (Path jar : jars) {
            PluginDescriptor descriptor = parseArchive(jar);
            if (descriptor != null) {
                return descriptor;
            }
        }
        return null;
    }

    // ==================== jar / zip ====================

    private PluginDescriptor parseArchive(Path archive) throws IOException {
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            for (String location : DESCRIPTOR_LOCATIONS) {
                ZipEntry entry = zip.getEntry(location);
                if (entry != null && !entry.isDirectory()) {
                    try (InputStream in = zip.getInputStream(entry)) {
                        return load(in);
                    }
                }
            }

            String root = singleTopLevelDirectory(zip);
            if (root == null) {
                return null;
            }
            for (String location : DESCRIPTOR_LOCATIONS) {
                ZipEntry entry = zip.getEntry(root + location);
                if (entry != null && !entry.isDirectory()) {
                    try (InputStream in = zip.getInputStream(entry)) {
                        return load(in);
                    }
                }
            }

            String libPrefix = root + "lib/";
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                String name = entry.getName();
                if (entry.isDirectory() || !name.startsWith(libPrefix) || !name.endsWith(".jar")
                        || name.indexOf('/', libPrefix.length()) >= 0) {
                    continue;
                }
                try (ZipInputStream nested = new ZipInputStream(zip.getInputStream(entry))) {
                    PluginDescriptor descriptor = findInStream(nested);
                    if (descriptor != null) {
                        return descriptor;
                    }
                }
            }
        }
        return null;
    }

    private PluginDescriptor findInStream(ZipInputStream nested) throws IOException {
        ZipEntry entry;
        while ((entry = nested.getNextEntry()) != null) {
            if (!entry.isDirectory() && DESCRIPTOR_LOCATIONS.contains(entry.getName())) {
                return load(nested);
            }
        }
        return null;
    }

    /**
     * 返回唯一顶层目录名 (以 / 结尾)，不存在或不唯一时返回 null
     */
    static String singleTopLevelDirectory(ZipFile zip) {
        String root = null;
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            String name = entries.nextElement().getName().replace('\\', '/');
            int slash = name.indexOf('/');
            if (slash <= 0) {
                // 顶层存在普通文件
                return null;
            }
            String top = name.substring(0, slash + 1);
            if (!PathUtils.isPlainDirectoryName(top.substring(0, slash))) {
                return null;
            }
            if (root == null) {
                root = top;
            } else if (!root.equals(top)) {
                return null;
            }
        }
        return root;
    }
}
