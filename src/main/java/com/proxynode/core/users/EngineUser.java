package com.proxynode.core.users;

/**
 * A user account as handed to an inbound's user registry.
 *
 * @param label   Identity label (the engine's "email" field).
 * @param level   Permission level, normally 0.
 * @param account Protocol-specific credentials.
 */
public record EngineUser(String label, int level, ProtocolAccount account) {
}
