package com.proxynode.core.node;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.proxynode.core.engine.EngineHandle;
import com.proxynode.core.exceptions.NodeException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks client source addresses by routing them to the {@value #BLOCK_OUTBOUND}
 * outbound. Each address gets its own rule, tagged with the MD5 hex digest of
 * the address text.
 */
public class IpBlockService {

    private static final Logger log = LoggerFactory.getLogger(IpBlockService.class);

    public static final String BLOCK_OUTBOUND = "BLOCK";

    private final EngineHandle engine;
    /** Rule tag to address. */
    private final Map<String, String> blocked = new ConcurrentHashMap<>();

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public IpBlockService(EngineHandle engine) {
        this.engine = engine;
    }

    /**
     * @param ip IPv4 or IPv6 literal.
     * @throws IllegalArgumentException if {@code ip} is not an IP literal.
     * @throws NodeException            if the engine cannot add the rule.
     */
    public void block(String ip) {
        EngineHandle.parseIp(ip);
        String ruleTag = ruleTag(ip);
        engine.addRoutingRule(ruleTag, ip, BLOCK_OUTBOUND);
        blocked.put(ruleTag, ip);
        log.info("IP {} blocked (rule {})", ip, ruleTag);
    }

    /**
     * Unblocking an address that is not blocked succeeds.
     *
     * @param ip IPv4 or IPv6 literal.
     * @throws IllegalArgumentException if {@code ip} is not an IP literal.
     * @throws NodeException            if the engine cannot remove the rule.
     */
    public void unblock(String ip) {
        EngineHandle.parseIp(ip);
        String ruleTag = ruleTag(ip);
        engine.removeRoutingRule(ruleTag);
        blocked.remove(ruleTag);
        log.info("IP {} unblocked (rule {})", ip, ruleTag);
    }

    public boolean isBlocked(String ip) {
        return blocked.containsKey(ruleTag(ip));
    }

    public List<String> blockedIps() {
        return new ArrayList<>(blocked.values());
    }

    /**
     * Re-adds every blocking rule to a freshly started engine instance.
     * Addresses whose rule cannot be added are logged and kept.
     */
    public void reapply() {
        for (Map.Entry<String, String> entry : blocked.entrySet()) {
            try {
                engine.addRoutingRule(entry.getKey(), entry.getValue(), BLOCK_OUTBOUND);
            } catch (NodeException e) {
                log.warn("Failed to re-apply block for {}: {}", entry.getValue(), e.getMessage());
            }
        }
        if (!blocked.isEmpty()) {
            log.info("Re-applied {} IP blocks", blocked.size());
        }
    }

    /**
     * @param ip Address text.
     * @return Lowercase MD5 hex of the address text.
     */
    public static String ruleTag(String ip) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            byte[] digest = md5.digest(ip.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
