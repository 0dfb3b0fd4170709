package com.proxynode.core.engine;

/**
 * Router capability allowing rules to be added and removed at runtime.
 */
public interface RoutingRuleRegistry extends EngineFeature {
    /**
     * @param rule         Rule to install.
     * @param shouldAppend Append after existing rules instead of prepending.
     * @throws com.proxynode.core.exceptions.RegistryException if rejected.
     */
    void addRule(RoutingRule rule, boolean shouldAppend);

    /**
     * @param ruleTag Tag of the rule to remove.
     * @throws com.proxynode.core.exceptions.RegistryException with
     *                                                         {@code notFound}
     *                                                         set if no rule
     *                                                         has that tag.
     */
    void removeRule(String ruleTag);
}
