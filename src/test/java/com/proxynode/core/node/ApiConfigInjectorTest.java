package com.proxynode.core.node;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiConfigInjectorTest {

    @Test
    void inject_emptyConfig_addsApiSections() {
        Map<String, Object> result = ApiConfigInjector.inject(new LinkedHashMap<>(), 61012);

        List<?> inbounds = (List<?>) result.get("inbounds");
        assertThat(inbounds).hasSize(1);
        Map<?, ?> api = (Map<?, ?>) inbounds.get(0);
        assertThat(api.get("tag")).isEqualTo("api");
        assertThat(api.get("port")).isEqualTo(61012);
        assertThat(api.get("listen")).isEqualTo("127.0.0.1");
        assertThat(api.get("protocol")).isEqualTo("dokodemo-door");

        Map<?, ?> routing = (Map<?, ?>) result.get("routing");
        Map<?, ?> rule = (Map<?, ?>) ((List<?>) routing.get("rules")).get(0);
        assertThat(rule.get("outboundTag")).isEqualTo("api");
        assertThat(rule.get("inboundTag")).isEqualTo(List.of("api"));

        Map<?, ?> apiSection = (Map<?, ?>) result.get("api");
        assertThat(apiSection.get("services")).isEqualTo(List.of("HandlerService", "LoggerService", "StatsService"));
        assertThat(result.get("stats")).isEqualTo(Map.of());
    }

    @Test
    void inject_prependsApiRuleBeforeUserRules() {
        Map<String, Object> config = new LinkedHashMap<>();
        Map<String, Object> userRule = Map.of("type", "field", "outboundTag", "BLOCK");
        config.put("routing", new LinkedHashMap<>(Map.of("rules", new ArrayList<>(List.of(userRule)))));

        Map<String, Object> result = ApiConfigInjector.inject(config, 61012);

        List<?> rules = (List<?>) ((Map<?, ?>) result.get("routing")).get("rules");
        assertThat(rules).hasSize(2);
        assertThat(((Map<?, ?>) rules.get(0)).get("outboundTag")).isEqualTo("api");
        assertThat(rules.get(1)).isEqualTo(userRule);
    }

    @Test
    void inject_existingApiSections_areLeftAlone() {
        Map<String, Object> config = new LinkedHashMap<>();
        Map<String, Object> customInbound = Map.of("tag", "api", "port", 10085, "protocol", "dokodemo-door");
        Map<String, Object> customRule = Map.of("outboundTag", "api", "inboundTag", List.of("api"));
        config.put("inbounds", List.of(customInbound));
        config.put("routing", Map.of("rules", List.of(customRule)));
        config.put("api", Map.of("tag", "api", "services", List.of("StatsService")));
        config.put("stats", Map.of("custom", true));

        Map<String, Object> result = ApiConfigInjector.inject(config, 61012);

        assertThat(result).isEqualTo(config);
    }

    @Test
    void inject_doesNotModifyInput() {
        Map<String, Object> config = new LinkedHashMap<>();
        List<Object> inbounds = new ArrayList<>();
        inbounds.add(Map.of("tag", "vless-in", "protocol", "vless"));
        config.put("inbounds", inbounds);

        Map<String, Object> result = ApiConfigInjector.inject(config, 62000);

        assertThat(inbounds).hasSize(1);
        assertThat(config).containsOnlyKeys("inbounds");
        assertThat((List<?>) result.get("inbounds")).hasSize(2);
    }
}
