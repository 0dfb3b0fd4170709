package com.proxynode.config;

import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import static org.assertj.core.api.Assertions.assertThat;

class NodePropertiesTest {

    @Test
    void defaults_matchShippedConfiguration() {
        NodeProperties props = new NodeProperties();

        assertThat(props.getEngine().getProvider()).isNull();
        assertThat(props.getEngine().getApiPort()).isEqualTo(61012);
        assertThat(props.getEngine().isWatchStartRequest()).isTrue();
        assertThat(props.getAdmin().isEnabled()).isTrue();
        assertThat(props.getAdmin().getPort()).isEqualTo(9090);
        assertThat(props.getAdmin().getBindAddress()).isEqualTo("127.0.0.1");
    }

    @Test
    void yaml_bindsNestedSections() {
        String yaml = "engine:\n" +
                "  provider: memory\n" +
                "  assetPath: /opt/xray\n" +
                "  apiPort: 62000\n" +
                "  startRequestPath: /etc/node/start.json\n" +
                "  watchStartRequest: false\n" +
                "admin:\n" +
                "  enabled: false\n" +
                "  port: 9191\n";

        NodeProperties props = new Yaml(new Constructor(NodeProperties.class, new LoaderOptions())).load(yaml);

        EngineSettings engine = props.getEngine();
        assertThat(engine.getProvider()).isEqualTo("memory");
        assertThat(engine.getAssetPath()).isEqualTo("/opt/xray");
        assertThat(engine.getApiPort()).isEqualTo(62000);
        assertThat(engine.getStartRequestPath()).isEqualTo("/etc/node/start.json");
        assertThat(engine.isWatchStartRequest()).isFalse();
        assertThat(props.getAdmin().isEnabled()).isFalse();
        assertThat(props.getAdmin().getPort()).isEqualTo(9191);
    }

    @Test
    void engineSettings_equalityCoversAllFields() {
        EngineSettings a = new EngineSettings();
        EngineSettings b = new EngineSettings();
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);

        b.setApiPort(1);
        assertThat(a).isNotEqualTo(b);

        b.setApiPort(a.getApiPort());
        b.setStartRequestPath("x");
        assertThat(a).isNotEqualTo(b);
    }
}
