package com.proxynode.core.sync;

import com.proxynode.core.hash.HashedSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigSynchronizerTest {

    private static final String EMPTY = HashedSet.EMPTY_FINGERPRINT;

    private ConfigSynchronizer synchronizer;

    @BeforeEach
    void setUp() {
        synchronizer = new ConfigSynchronizer();
    }

    @Test
    void isRestartNeeded_neverStarted_returnsTrue() {
        assertThat(synchronizer.isRestartNeeded(signal("h1", fp("vless-in", EMPTY)))).isTrue();
        assertThat(synchronizer.isRestartNeeded(new RestartSignal("", List.of()))).isTrue();
    }

    @Test
    void isRestartNeeded_identicalSignalAfterExtract_returnsFalse() {
        RestartSignal signal = signal("h1", fp("vless-in", fingerprintOf("u1", "u2")));
        synchronizer.extractUsers(signal, config(inbound("vless-in", "u1", "u2")));

        assertThat(synchronizer.isRestartNeeded(signal)).isFalse();
    }

    @Test
    void isRestartNeeded_baseFingerprintChanged_returnsTrue() {
        synchronizer.extractUsers(signal("h1", fp("vless-in", EMPTY)), config(inbound("vless-in")));

        assertThat(synchronizer.isRestartNeeded(signal("h2", fp("vless-in", EMPTY)))).isTrue();
    }

    @Test
    void isRestartNeeded_inboundCountChanged_returnsTrue() {
        synchronizer.extractUsers(signal("h1", fp("vless-in", EMPTY)), config(inbound("vless-in")));

        assertThat(synchronizer.isRestartNeeded(signal("h1", fp("vless-in", EMPTY), fp("trojan-in", EMPTY))))
                .isTrue();
    }

    @Test
    void isRestartNeeded_trackedTagMissingFromSignal_returnsTrue() {
        synchronizer.extractUsers(signal("h1", fp("vless-in", EMPTY)), config(inbound("vless-in")));

        assertThat(synchronizer.isRestartNeeded(signal("h1", fp("renamed-in", EMPTY)))).isTrue();
    }

    @Test
    void isRestartNeeded_oneInboundFingerprintChanged_returnsTrue() {
        String vless = fingerprintOf("u1");
        String trojan = fingerprintOf("t1");
        RestartSignal original = signal("h1", fp("vless-in", vless), fp("trojan-in", trojan));
        synchronizer.extractUsers(original, config(inbound("vless-in", "u1"), inbound("trojan-in", "t1")));
        assertThat(synchronizer.isRestartNeeded(original)).isFalse();

        RestartSignal changed = signal("h1", fp("vless-in", vless), fp("trojan-in", fingerprintOf("t1", "t2")));
        assertThat(synchronizer.isRestartNeeded(changed)).isTrue();
    }

    @Test
    void cleanup_thenAnySignal_needsRestart() {
        RestartSignal signal = signal("h1", fp("vless-in", EMPTY));
        synchronizer.extractUsers(signal, config(inbound("vless-in")));

        synchronizer.cleanup();

        assertThat(synchronizer.isRestartNeeded(signal)).isTrue();
        assertThat(synchronizer.trackedTags()).isEmpty();
        assertThat(synchronizer.liveConfiguration()).isEmpty();
    }

    @Test
    void extractUsers_emptyClientList_tracksZeroFingerprint() {
        RestartSignal signal = signal("h1", new InboundFingerprint("vless-in", EMPTY, 0));

        synchronizer.extractUsers(signal, config(inbound("vless-in")));

        assertThat(synchronizer.currentFingerprint("vless-in")).isEqualTo(EMPTY);
        assertThat(synchronizer.trackedTags()).containsExactly("vless-in");
    }

    @Test
    void endToEnd_addThenRemoveLastMember_stopsTracking() {
        RestartSignal signal = signal("h1", new InboundFingerprint("vless-in", EMPTY, 0));
        synchronizer.extractUsers(signal, config(inbound("vless-in")));
        assertThat(synchronizer.currentFingerprint("vless-in")).isEqualTo(EMPTY);

        synchronizer.addUserToInbound("vless-in", "uuid-A");
        String afterAdd = synchronizer.currentFingerprint("vless-in");
        assertThat(afterAdd).matches("[0-9a-f]{16}").isNotEqualTo(EMPTY).isEqualTo("214b0c8a86d93d24");

        synchronizer.removeUserFromInbound("vless-in", "uuid-A");
        assertThat(synchronizer.currentFingerprint("vless-in")).isEmpty();
        assertThat(synchronizer.trackedTags()).doesNotContain("vless-in");
    }

    @Test
    void extractUsers_skipsInboundsAbsentFromSignal() {
        RestartSignal signal = signal("h1", fp("vless-in", fingerprintOf("u1")));

        synchronizer.extractUsers(signal, config(inbound("vless-in", "u1"), inbound("api"), inbound("extra", "x")));

        assertThat(synchronizer.trackedTags()).containsExactly("vless-in");
        assertThat(synchronizer.currentFingerprint("extra")).isEmpty();
    }

    @Test
    void extractUsers_ignoresMalformedShapes() {
        Map<String, Object> cfg = new LinkedHashMap<>();
        List<Object> inbounds = new ArrayList<>();
        inbounds.add("not-an-object");
        inbounds.add(Map.of("protocol", "vless"));
        Map<String, Object> badClients = new LinkedHashMap<>();
        badClients.put("tag", "vless-in");
        badClients.put("settings", Map.of("clients", List.of("x", Map.of("id", ""), Map.of("id", "ok"))));
        inbounds.add(badClients);
        cfg.put("inbounds", inbounds);

        synchronizer.extractUsers(signal("h1", fp("vless-in", fingerprintOf("ok"))), cfg);

        assertThat(synchronizer.memberCount("vless-in")).isEqualTo(1);
        assertThat(synchronizer.currentFingerprint("vless-in")).isEqualTo(fingerprintOf("ok"));
    }

    @Test
    void extractUsers_nonListInbounds_keepsBaseFingerprint() {
        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("inbounds", "nope");
        RestartSignal signal = new RestartSignal("h1", List.of());

        synchronizer.extractUsers(signal, cfg);

        assertThat(synchronizer.trackedTags()).isEmpty();
        assertThat(synchronizer.isRestartNeeded(signal)).isFalse();
    }

    @Test
    void extractUsers_replacesPreviousState() {
        synchronizer.extractUsers(signal("h1", fp("old-in", fingerprintOf("u1"))), config(inbound("old-in", "u1")));

        synchronizer.extractUsers(signal("h2", fp("new-in", EMPTY)), config(inbound("new-in")));

        assertThat(synchronizer.trackedTags()).containsExactly("new-in");
        assertThat(synchronizer.liveConfiguration()).containsKey("inbounds");
    }

    @Test
    void addUserToInbound_unknownTag_startsTracking() {
        synchronizer.addUserToInbound("fresh-in", "u1");

        assertThat(synchronizer.trackedTags()).containsExactly("fresh-in");
        assertThat(synchronizer.memberCount("fresh-in")).isEqualTo(1);
        assertThat(synchronizer.currentFingerprint("fresh-in")).isEqualTo(fingerprintOf("u1"));
    }

    @Test
    void removeUserFromInbound_unknownTagOrMember_isNoOp() {
        synchronizer.extractUsers(signal("h1", fp("vless-in", fingerprintOf("u1"))), config(inbound("vless-in", "u1")));

        synchronizer.removeUserFromInbound("missing-in", "u1");
        synchronizer.removeUserFromInbound("vless-in", "nobody");

        assertThat(synchronizer.memberCount("vless-in")).isEqualTo(1);
    }

    @Test
    void removeUserFromInbound_nonMemberOfEmptyInbound_keepsTracking() {
        RestartSignal signal = signal("h1", fp("trojan-in", EMPTY));
        synchronizer.extractUsers(signal, config(inbound("trojan-in")));

        synchronizer.removeUserFromInbound("trojan-in", "someone");

        assertThat(synchronizer.trackedTags()).containsExactly("trojan-in");
        assertThat(synchronizer.isRestartNeeded(signal)).isFalse();
    }

    @Test
    void mutations_matchPanelFingerprints() {
        RestartSignal start = signal("h1", fp("vless-in", fingerprintOf("u1", "u2")));
        synchronizer.extractUsers(start, config(inbound("vless-in", "u1", "u2")));

        synchronizer.addUserToInbound("vless-in", "u3");
        synchronizer.removeUserFromInbound("vless-in", "u1");

        assertThat(synchronizer.isRestartNeeded(signal("h1", fp("vless-in", fingerprintOf("u2", "u3"))))).isFalse();
    }

    @Test
    void concurrentMutations_keepMirrorConsistent() throws Exception {
        synchronizer.extractUsers(signal("h1", fp("vless-in", EMPTY)), config(inbound("vless-in")));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);
        try {
            for (int t = 0; t < 8; t++) {
                int thread = t;
                pool.submit(() -> {
                    for (int i = 0; i < 100; i++) {
                        synchronizer.addUserToInbound("vless-in", "u-" + thread + "-" + i);
                        synchronizer.isRestartNeeded(signal("h1", fp("vless-in", EMPTY)));
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(synchronizer.memberCount("vless-in")).isEqualTo(800);
        List<String> expected = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            for (int i = 0; i < 100; i++) {
                expected.add("u-" + t + "-" + i);
            }
        }
        assertThat(synchronizer.currentFingerprint("vless-in"))
                .isEqualTo(fingerprintOf(expected.toArray(new String[0])));
    }

    static RestartSignal signal(String base, InboundFingerprint... inbounds) {
        return new RestartSignal(base, List.of(inbounds));
    }

    static InboundFingerprint fp(String tag, String fingerprint) {
        return new InboundFingerprint(tag, fingerprint, 0);
    }

    static String fingerprintOf(String... ids) {
        HashedSet set = new HashedSet();
        for (String id : ids) {
            set.add(id);
        }
        return set.fingerprint();
    }

    @SafeVarargs
    static Map<String, Object> config(Map<String, Object>... inbounds) {
        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("inbounds", new ArrayList<>(List.of(inbounds)));
        return cfg;
    }

    static Map<String, Object> inbound(String tag, String... ids) {
        List<Object> clients = new ArrayList<>();
        for (String id : ids) {
            clients.add(Map.of("id", id, "email", id));
        }
        Map<String, Object> inbound = new LinkedHashMap<>();
        inbound.put("tag", tag);
        inbound.put("protocol", "vless");
        inbound.put("settings", Map.of("clients", clients));
        return inbound;
    }
}
