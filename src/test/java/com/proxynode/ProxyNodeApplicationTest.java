package com.proxynode;

import com.proxynode.config.NodeProperties;
import com.proxynode.core.engine.memory.MemoryEngineProvider;
import com.proxynode.core.exceptions.ConfigException;
import com.proxynode.core.node.IpBlockService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ProxyNodeApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void main_withHelpOption_returnsZero() {
        int exitCode = new CommandLine(new ProxyNodeApplication()).execute("--help");
        assertThat(exitCode).isZero();
    }

    @Test
    void main_withVersionOption_returnsZero() {
        int exitCode = new CommandLine(new ProxyNodeApplication()).execute("--version");
        assertThat(exitCode).isZero();
    }

    @Test
    void loadConfig_fromClasspath_usesShippedDefaults() {
        NodeProperties props = ProxyNodeApplication.loadConfig("node.yml");

        assertThat(props.getEngine().getApiPort()).isEqualTo(61012);
        assertThat(props.getAdmin().getPort()).isEqualTo(9090);
    }

    @Test
    void loadConfig_emptyFile_yieldsDefaults() throws Exception {
        Path config = Files.writeString(tempDir.resolve("empty.yml"), "");

        NodeProperties props = ProxyNodeApplication.loadConfig(config.toString());

        assertThat(props.getEngine()).isNotNull();
        assertThat(props.getAdmin()).isNotNull();
    }

    @Test
    void loadConfig_missingFile_throwsConfigException() {
        assertThatThrownBy(() -> ProxyNodeApplication.loadConfig(tempDir.resolve("nope.yml").toString()))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Configuration file not found");
    }

    @Test
    void call_withInvalidConfig_returnsError() throws Exception {
        Path config = Files.writeString(tempDir.resolve("bad.yml"), "invalid yaml content: !!!");

        int exitCode = new CommandLine(new ProxyNodeApplication()).execute("-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withUnknownProvider_returnsError() throws Exception {
        Path config = Files.writeString(tempDir.resolve("node.yml"),
                "engine:\n  provider: nonexistent\nadmin:\n  enabled: false\n");

        int exitCode = new CommandLine(new ProxyNodeApplication()).execute("-c", config.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withStartRequest_startsEngineAndStops() throws Exception {
        Path request = tempDir.resolve("start.json");
        try (InputStream fixture = getClass().getClassLoader().getResourceAsStream("start-request.json")) {
            Files.copy(fixture, request, StandardCopyOption.REPLACE_EXISTING);
        }
        Path config = Files.writeString(tempDir.resolve("node.yml"),
                "engine:\n" +
                "  provider: memory\n" +
                "  assetPath: " + tempDir + "\n" +
                "  apiPort: 0\n" +
                "  startRequestPath: " + request + "\n" +
                "  watchStartRequest: false\n" +
                "admin:\n" +
                "  enabled: false\n");

        ProxyNodeApplication app = new ProxyNodeApplication();
        CommandLine cmd = new CommandLine(app);
        Thread appThread = new Thread(() -> cmd.execute("-c", config.toString()));
        appThread.setDaemon(true);
        appThread.start();

        await().atMost(Duration.ofSeconds(10)).until(() -> app.getNodeController() != null
                && app.getNodeController().status().engineRunning());
        assertThat(app.getNodeController().status().engineVersion()).isEqualTo(MemoryEngineProvider.VERSION);

        app.processCommand("block 198.51.100.9");
        IpBlockService blocks = app.getIpBlockService();
        assertThat(blocks.isBlocked("198.51.100.9")).isTrue();

        app.processCommand("stats reset");
        assertThat(app.getStatsService().allInboundsStats(false)).extracting(t -> t.name())
                .contains("vless-in", "trojan-in");

        app.processCommand("engine-stop");
        assertThat(app.getNodeController().status().engineRunning()).isFalse();

        app.reload();
        assertThat(app.getNodeController().status().engineRunning()).isTrue();

        app.stop();
        await().atMost(Duration.ofSeconds(10)).until(() -> !appThread.isAlive());
        assertThat(app.isRunning()).isFalse();
    }
}
