package com.proxynode.core.node;

/**
 * Point-in-time view of the node.
 *
 * @param engineRunning Whether an engine instance is running.
 * @param engineVersion Engine build identifier, null when not running.
 * @param nodeVersion   Version of this node.
 * @param healthy       Whether the node itself is able to serve requests.
 */
public record NodeStatus(boolean engineRunning, String engineVersion, String nodeVersion, boolean healthy) {
}
