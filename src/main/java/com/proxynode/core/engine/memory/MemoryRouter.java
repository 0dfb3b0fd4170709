package com.proxynode.core.engine.memory;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.proxynode.core.engine.RoutingRule;
import com.proxynode.core.engine.RoutingRuleRegistry;
import com.proxynode.core.exceptions.RegistryException;

/**
 * Ordered rule list; the first matching rule picks the outbound.
 */
class MemoryRouter implements RoutingRuleRegistry {

    private final Set<String> outboundTags;
    private final LinkedList<RoutingRule> rules = new LinkedList<>();

    MemoryRouter(Set<String> outboundTags) {
        this.outboundTags = Set.copyOf(outboundTags);
    }

    @Override
    public synchronized void addRule(RoutingRule rule, boolean shouldAppend) {
        if (rule.ruleTag() == null || rule.ruleTag().isEmpty()) {
            throw new RegistryException("empty rule tag", false);
        }
        if (!outboundTags.contains(rule.outboundTag())) {
            throw new RegistryException("unknown outbound '" + rule.outboundTag() + "'", false);
        }
        rules.removeIf(existing -> existing.ruleTag().equals(rule.ruleTag()));
        if (shouldAppend) {
            rules.addLast(rule);
        } else {
            rules.addFirst(rule);
        }
    }

    @Override
    public synchronized void removeRule(String ruleTag) {
        if (ruleTag == null || ruleTag.isEmpty()) {
            throw new RegistryException("empty tag", true);
        }
        if (!rules.removeIf(rule -> rule.ruleTag().equals(ruleTag))) {
            throw new RegistryException("rule " + ruleTag + " not found", true);
        }
    }

    /**
     * @param source Source address of a connection.
     * @return Outbound chosen by the first matching rule.
     */
    synchronized Optional<String> route(InetAddress source) {
        for (RoutingRule rule : rules) {
            if (rule.matches(source)) {
                return Optional.of(rule.outboundTag());
            }
        }
        return Optional.empty();
    }

    synchronized List<RoutingRule> rules() {
        return new ArrayList<>(rules);
    }
}
