package com.upstage.starter.controller;

import com.upstage.api.plugin.PluginId;
import com.upstage.api.update.PluginAutoUpdateStatistics;
import com.upstage.api.update.PluginUpdateInfo;
import com.upstage.core.loader.FileSystemPluginDescriptorLoader;
import com.upstage.core.loader.YamlDescriptorParser;
import com.upstage.core.staging.FileStagedUpdateRepository;
import com.upstage.core.update.AutoUpdateOutcome;
import com.upstage.core.update.AutoUpdateResultHolder;
import com.upstage.core.version.PluginCompatibility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UpstageOpsController 单元测试")
class UpstageOpsControllerTest {

    @TempDir
    Path tempDir;

    private AutoUpdateResultHolder resultHolder;
    private FileStagedUpdateRepository repository;
    private UpstageOpsController controller;

    @BeforeEach
    void setUp() throws IOException {
        Path pluginHome = tempDir.resolve("plugins");
        Path installed = Files.createDirectories(pluginHome.resolve("foo"));
        Files.writeString(installed.resolve("plugin.yml"), "id: com.example.foo\nversion: '1.0'\n");

        YamlDescriptorParser parser = new YamlDescriptorParser();
        resultHolder = new AutoUpdateResultHolder();
        repository = new FileStagedUpdateRepository(tempDir.resolve("plugin-auto-update"));
        controller = new UpstageOpsController(resultHolder, repository,
                new FileSystemPluginDescriptorLoader(pluginHome, parser, id -> false,
                        new PluginCompatibility(null, Map.of(), Set.of())),
                parser);
    }

    private static byte[] pluginJar(String id, String version) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            zip.putNextEntry(new ZipEntry("plugin.yml"));
            zip.write(("id: " + id + "\nversion: '" + version + "'\n").getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
        return bytes.toByteArray();
    }

    @Nested
    @DisplayName("自动更新状态")
    class AutoUpdateTests {

        @Test
        @DisplayName("未执行时为 PENDING")
        void shouldReportPending() {
            assertEquals("PENDING", controller.autoUpdate().get("status"));
        }

        @Test
        @DisplayName("成功时返回统计")
        void shouldReportSuccess() {
            resultHolder.publish(new AutoUpdateOutcome.Success(new PluginAutoUpdateStatistics(2, 1)));

            Map<String, Object> info = controller.autoUpdate();
            assertEquals("SUCCESS", info.get("status"));
            assertEquals(2, info.get("updatesPrepared"));
            assertEquals(1, info.get("pluginsUpdated"));
        }

        @Test
        @DisplayName("失败时返回原因")
        void shouldReportFailure() {
            resultHolder.publish(new AutoUpdateOutcome.Failure(new IllegalStateException("disk full")));

            Map<String, Object> info = controller.autoUpdate();
            assertEquals("FAILED", info.get("status"));
            assertEquals("disk full", info.get("message"));
        }
    }

    @Nested
    @DisplayName("暂存更新")
    class StageTests {

        @Test
        @DisplayName("为已安装插件暂存更新")
        void shouldStageUpdate() throws IOException {
            MockMultipartFile file = new MockMultipartFile("file", "foo-2.0.jar", "application/java-archive",
                    pluginJar("com.example.foo", "2.0"));

            String result = controller.stage("com.example.foo", file);

            assertTrue(result.startsWith("Success"), result);
            Map<String, PluginUpdateInfo> staged = controller.staged();
            assertEquals("foo-2.0.jar", staged.get("com.example.foo").updateFilename());
            assertTrue(repository.listStagedUpdates().containsKey(PluginId.of("com.example.foo")));
        }

        @Test
        @DisplayName("未安装的插件不能暂存")
        void shouldRejectUnknownPlugin() throws IOException {
            MockMultipartFile file = new MockMultipartFile("file", "bar-2.0.jar", "application/java-archive",
                    pluginJar("com.example.bar", "2.0"));

            assertTrue(controller.stage("com.example.bar", file).startsWith("Error"));
            assertTrue(controller.staged().isEmpty());
        }

        @Test
        @DisplayName("更新包 ID 不一致时拒绝")
        void shouldRejectMismatchedId() throws IOException {
            MockMultipartFile file = new MockMultipartFile("file", "foo-2.0.jar", "application/java-archive",
                    pluginJar("com.example.bar", "2.0"));

            assertTrue(controller.stage("com.example.foo", file).contains("instead of"));
            assertTrue(controller.staged().isEmpty());
        }

        @Test
        @DisplayName("拒绝不支持的文件类型")
        void shouldRejectUnsupportedFile() {
            MockMultipartFile file = new MockMultipartFile("file", "foo.txt", "text/plain", new byte[]{1});
            assertEquals("Error: File must be a JAR or ZIP package.", controller.stage("com.example.foo", file));
        }
    }
}
