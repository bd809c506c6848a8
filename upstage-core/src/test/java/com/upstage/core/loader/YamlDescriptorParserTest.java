package com.upstage.core.loader;

import com.upstage.api.config.PluginDescriptor;
import com.upstage.api.exception.DescriptorParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.upstage.core.support.PluginArtifacts.directory;
import static com.upstage.core.support.PluginArtifacts.jar;
import static com.upstage.core.support.PluginArtifacts.yaml;
import static com.upstage.core.support.PluginArtifacts.zip;
import static com.upstage.core.support.PluginArtifacts.zipBytes;
import static com.upstage.core.support.PluginArtifacts.zipWithNestedJar;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("YamlDescriptorParser 单元测试")
class YamlDescriptorParserTest {

    @TempDir
    Path tempDir;

    private final YamlDescriptorParser parser = new YamlDescriptorParser();

    @Nested
    @DisplayName("插件包形态")
    class LayoutTests {

        @Test
        @DisplayName("目录形态")
        void shouldParseDirectory() throws IOException {
            Path dir = directory(tempDir.resolve("foo"), yaml("com.example.foo", "1.2.0",
                    "name: Foo",
                    "sinceBuild: '233'",
                    "dependencies:",
                    "  - id: com.example.bar",
                    "  - id: com.example.baz",
                    "    optional: true"));

            PluginDescriptor descriptor = parser.parseDescriptor(dir);

            assertEquals("com.example.foo", descriptor.getId());
            assertEquals("1.2.0", descriptor.getVersion());
            assertEquals("Foo", descriptor.getName());
            assertEquals("233", descriptor.getSinceBuild());
            assertEquals(2, descriptor.getDependencies().size());
            assertFalse(descriptor.getDependencies().get(0).isOptional());
            assertTrue(descriptor.getDependencies().get(1).isOptional());
            assertEquals(dir, descriptor.getPath());
        }

        @Test
        @DisplayName("jar 根目录的 plugin.yml")
        void shouldParseJar() throws IOException {
            Path file = jar(tempDir.resolve("foo-1.0.jar"), yaml("com.example.foo", "1.0"));
            assertEquals("1.0", parser.parseDescriptor(file).getVersion());
        }

        @Test
        @DisplayName("zip 顶层目录下的 plugin.yml")
        void shouldParseZip() throws IOException {
            Path file = zip(tempDir.resolve("foo-2.0.zip"), "foo", yaml("com.example.foo", "2.0"));
            assertEquals("2.0", parser.parseDescriptor(file).getVersion());
        }

        @Test
        @DisplayName("zip 中 lib 下 jar 内的 plugin.yml")
        void shouldParseNestedJar() throws IOException {
            Path file = zipWithNestedJar(tempDir.resolve("foo-3.0.zip"), "foo", yaml("com.example.foo", "3.0"));
            assertEquals("3.0", parser.parseDescriptor(file).getVersion());
        }

        @Test
        @DisplayName("目录中 lib 下 jar 内的 plugin.yml")
        void shouldParseDirectoryWithLibJar() throws IOException {
            Path dir = tempDir.resolve("foo");
            jar(dir.resolve("lib/foo.jar"), yaml("com.example.foo", "4.0"));
            assertEquals("4.0", parser.parseDescriptor(dir).getVersion());
        }
    }

    @Nested
    @DisplayName("异常情况")
    class FailureTests {

        @Test
        @DisplayName("缺少 plugin.yml")
        void missingDescriptorShouldFail() throws IOException {
            Path file = tempDir.resolve("empty.jar");
            Files.write(file, zipBytes(new String[]{"readme.txt", "hello"}));

            DescriptorParseException e = assertThrows(DescriptorParseException.class, () -> parser.parseDescriptor(file));
            assertTrue(e.getMessage().contains("No plugin.yml"));
        }

        @Test
        @DisplayName("缺少版本号")
        void missingVersionShouldFail() throws IOException {
            Path dir = tempDir.resolve("foo");
            Files.createDirectories(dir);
            Files.writeString(dir.resolve("plugin.yml"), "id: com.example.foo\n", StandardCharsets.UTF_8);

            assertThrows(DescriptorParseException.class, () -> parser.parseDescriptor(dir));
        }

        @Test
        @DisplayName("YAML 语法错误")
        void malformedYamlShouldFail() throws IOException {
            Path dir = directory(tempDir.resolve("foo"), "id: [unclosed\n");
            assertThrows(DescriptorParseException.class, () -> parser.parseDescriptor(dir));
        }

        @Test
        @DisplayName("不是 zip 的文件")
        void corruptArchiveShouldFail() throws IOException {
            Path file = tempDir.resolve("foo.zip");
            Files.writeString(file, "garbage");
            assertThrows(DescriptorParseException.class, () -> parser.parseDescriptor(file));
        }

        @Test
        @DisplayName("顶层目录为 . 的 zip 不被识别")
        void dotRootZipShouldFail() throws IOException {
            Path file = tempDir.resolve("foo-2.0.zip");
            Files.write(file, zipBytes(new String[]{"./plugin.yml", yaml("com.example.foo", "2.0")}));

            assertThrows(DescriptorParseException.class, () -> parser.parseDescriptor(file));
        }

        @Test
        @DisplayName("路径不存在")
        void missingPathShouldFail() {
            assertThrows(DescriptorParseException.class, () -> parser.parseDescriptor(tempDir.resolve("nope")));
        }
    }

    @Test
    @DisplayName("未知字段被忽略")
    void unknownPropertiesShouldBeIgnored() throws IOException {
        Path dir = directory(tempDir.resolve("foo"), yaml("com.example.foo", "1.0", "mainClass: com.example.Main"));
        assertEquals("com.example.foo", parser.parseDescriptor(dir).getId());
    }
}
