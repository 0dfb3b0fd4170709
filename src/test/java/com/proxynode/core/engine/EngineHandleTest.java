package com.proxynode.core.engine;

import com.proxynode.core.engine.memory.MemoryEngine;
import com.proxynode.core.engine.memory.MemoryEngineProvider;
import com.proxynode.core.engine.memory.TestConfigs;
import com.proxynode.core.exceptions.ConfigException;
import com.proxynode.core.exceptions.EngineLifecycleException;
import com.proxynode.core.exceptions.RegistryException;
import com.proxynode.spi.EngineProvider;
import org.junit.jupiter.api.Test;

import java.net.Inet6Address;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EngineHandleTest {

    @Test
    void start_validConfig_isRunning() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());

        handle.start(TestConfigs.standard());

        assertThat(handle.isRunning()).isTrue();
        assertThat(handle.instance()).isPresent();
        assertThat(handle.feature(InboundManager.class)).isPresent();
    }

    @Test
    void version_isAvailableWhenNotRunning() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());

        assertThat(handle.isRunning()).isFalse();
        assertThat(handle.version()).isEqualTo(MemoryEngineProvider.VERSION);
        assertThat(handle.feature(InboundManager.class)).isEmpty();
    }

    @Test
    void start_whileRunning_replacesInstance() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());
        handle.start(TestConfigs.standard());
        MemoryEngine first = (MemoryEngine) handle.instance().orElseThrow();

        handle.restart(TestConfigs.standard());

        assertThat(first.isStarted()).isFalse();
        assertThat(handle.instance()).get().isNotSameAs(first);
        assertThat(handle.isRunning()).isTrue();
    }

    @Test
    void start_invalidConfig_throwsConfigExceptionAndStaysStopped() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());
        handle.start(TestConfigs.standard());
        Map<String, Object> bad = TestConfigs.standard();
        bad.put("inbounds", "nope");

        assertThatThrownBy(() -> handle.start(bad)).isInstanceOf(ConfigException.class);
        assertThat(handle.isRunning()).isFalse();
    }

    @Test
    void start_createFails_wrapsInLifecycleException() {
        EngineProvider provider = mock(EngineProvider.class);
        EngineConfig config = mock(EngineConfig.class);
        when(provider.loadConfig(any())).thenReturn(config);
        when(provider.create(config)).thenThrow(new IllegalStateException("boom"));
        EngineHandle handle = new EngineHandle(provider);

        assertThatThrownBy(() -> handle.start(Map.of()))
                .isInstanceOf(EngineLifecycleException.class)
                .hasMessageContaining("failed to create engine instance: boom");
        assertThat(handle.isRunning()).isFalse();
    }

    @Test
    void start_instanceStartFails_closesPartialInstance() {
        EngineProvider provider = mock(EngineProvider.class);
        EngineConfig config = mock(EngineConfig.class);
        ProxyEngine engine = mock(ProxyEngine.class);
        when(provider.loadConfig(any())).thenReturn(config);
        when(provider.create(config)).thenReturn(engine);
        doThrow(new IllegalStateException("port in use")).when(engine).start();
        EngineHandle handle = new EngineHandle(provider);

        assertThatThrownBy(() -> handle.start(Map.of()))
                .isInstanceOf(EngineLifecycleException.class)
                .hasMessageContaining("failed to start engine: port in use");
        verify(engine).close();
        assertThat(handle.isRunning()).isFalse();
        assertThat(handle.instance()).isEmpty();
    }

    @Test
    void start_previousInstanceFailsToStop_abortsAndCanRetry() {
        EngineProvider provider = mock(EngineProvider.class);
        EngineConfig config = mock(EngineConfig.class);
        ProxyEngine stuck = mock(ProxyEngine.class);
        ProxyEngine fresh = mock(ProxyEngine.class);
        when(provider.loadConfig(any())).thenReturn(config);
        when(provider.create(config)).thenReturn(stuck, fresh);
        doThrow(new IllegalStateException("busy")).when(stuck).close();
        EngineHandle handle = new EngineHandle(provider);
        handle.start(Map.of());

        assertThatThrownBy(() -> handle.start(Map.of()))
                .isInstanceOf(EngineLifecycleException.class)
                .hasMessageContaining("failed to stop existing instance");
        assertThat(handle.isRunning()).isFalse();

        handle.start(Map.of());
        assertThat(handle.instance()).containsSame(fresh);
    }

    @Test
    void stop_whenNotRunning_isNoOp() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());

        handle.stop();

        assertThat(handle.isRunning()).isFalse();
    }

    @Test
    void stop_closesInstance() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());
        handle.start(TestConfigs.standard());
        MemoryEngine engine = (MemoryEngine) handle.instance().orElseThrow();

        handle.stop();

        assertThat(engine.isStarted()).isFalse();
        assertThat(handle.isRunning()).isFalse();
        assertThat(handle.instance()).isEmpty();
    }

    @Test
    void validate_rejectsNullAndMalformedConfig() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());
        Map<String, Object> bad = TestConfigs.standard();
        bad.put("outbounds", "nope");

        assertThatThrownBy(() -> handle.validate(null)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> handle.validate(bad)).isInstanceOf(ConfigException.class);
        handle.validate(TestConfigs.standard());
        assertThat(handle.isRunning()).isFalse();
    }

    @Test
    void addRoutingRule_ipv4_routesSourceToOutbound() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());
        handle.start(TestConfigs.standard());

        handle.addRoutingRule("block-1", "203.0.113.7", "BLOCK");

        MemoryEngine engine = (MemoryEngine) handle.instance().orElseThrow();
        assertThat(engine.route("203.0.113.7")).contains("BLOCK");
        assertThat(engine.route("203.0.113.8")).isEmpty();
    }

    @Test
    void addRoutingRule_ipv6_usesFullPrefix() {
        EngineProvider provider = mock(EngineProvider.class);
        EngineConfig config = mock(EngineConfig.class);
        ProxyEngine engine = mock(ProxyEngine.class);
        RoutingRuleRegistry router = mock(RoutingRuleRegistry.class);
        when(provider.loadConfig(any())).thenReturn(config);
        when(provider.create(config)).thenReturn(engine);
        when(engine.getFeature(RoutingRuleRegistry.class)).thenReturn(Optional.of(router));
        EngineHandle handle = new EngineHandle(provider);
        handle.start(Map.of());

        handle.addRoutingRule("r6", "2001:db8::1", "BLOCK");

        verify(router).addRule(argThat(rule ->
                rule.prefixLength() == 128 && rule.sourceIp() instanceof Inet6Address
                        && rule.outboundTag().equals("BLOCK")), eq(true));
    }

    @Test
    void addRoutingRule_invalidIp_throwsIllegalArgument() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());
        handle.start(TestConfigs.standard());

        assertThatThrownBy(() -> handle.addRoutingRule("r", "not-an-ip", "BLOCK"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> handle.addRoutingRule("r", "300.1.1.1", "BLOCK"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addRoutingRule_notRunning_throwsLifecycleException() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());

        assertThatThrownBy(() -> handle.addRoutingRule("r", "10.0.0.1", "BLOCK"))
                .isInstanceOf(EngineLifecycleException.class);
    }

    @Test
    void addRoutingRule_routerWithoutDynamicRules_throwsLifecycleException() {
        EngineProvider provider = mock(EngineProvider.class);
        EngineConfig config = mock(EngineConfig.class);
        ProxyEngine engine = mock(ProxyEngine.class);
        when(provider.loadConfig(any())).thenReturn(config);
        when(provider.create(config)).thenReturn(engine);
        when(engine.getFeature(RoutingRuleRegistry.class)).thenReturn(Optional.empty());
        EngineHandle handle = new EngineHandle(provider);
        handle.start(Map.of());

        assertThatThrownBy(() -> handle.addRoutingRule("r", "10.0.0.1", "BLOCK"))
                .isInstanceOf(EngineLifecycleException.class)
                .hasMessageContaining("dynamic rule management");
    }

    @Test
    void addRoutingRule_unknownOutbound_throwsRegistryException() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());
        handle.start(TestConfigs.standard());

        assertThatThrownBy(() -> handle.addRoutingRule("r", "10.0.0.1", "NOWHERE"))
                .isInstanceOf(RegistryException.class)
                .hasMessageContaining("failed to add routing rule");
    }

    @Test
    void removeRoutingRule_isIdempotent() {
        EngineHandle handle = new EngineHandle(new MemoryEngineProvider());
        handle.start(TestConfigs.standard());
        handle.addRoutingRule("block-1", "203.0.113.7", "BLOCK");

        handle.removeRoutingRule("block-1");
        handle.removeRoutingRule("block-1");

        MemoryEngine engine = (MemoryEngine) handle.instance().orElseThrow();
        assertThat(engine.route("203.0.113.7")).isEmpty();
    }

    @Test
    void parseIp_neverResolvesHostNames() {
        assertThatThrownBy(() -> EngineHandle.parseIp("localhost")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EngineHandle.parseIp(null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(EngineHandle.parseIp("::1")).isInstanceOf(Inet6Address.class);
        assertThat(EngineHandle.parseIp("192.168.1.1").getHostAddress()).isEqualTo("192.168.1.1");
    }
}
