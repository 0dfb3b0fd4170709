package com.proxynode.core.node;

/**
 * Result of a start push.
 *
 * @param outcome       How the push was handled.
 * @param engineVersion Engine build identifier, null unless the engine is up.
 * @param error         Failure description, null on success.
 * @param nodeVersion   Version of this node.
 */
public record StartResult(StartOutcome outcome, String engineVersion, String error, String nodeVersion) {

    /**
     * @return True if the engine is running with the pushed state.
     */
    public boolean isStarted() {
        return outcome == StartOutcome.STARTED || outcome == StartOutcome.UNCHANGED;
    }
}
