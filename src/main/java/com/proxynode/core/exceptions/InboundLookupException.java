package com.proxynode.core.exceptions;

/**
 * Thrown when an inbound cannot be resolved by tag, or resolves to a handler
 * without the requested capability.
 */
public class InboundLookupException extends NodeException {

    /**
     * Why the lookup failed.
     */
    public enum Reason {
        /** No inbound with that tag exists in the running engine. */
        NOT_FOUND,
        /** The inbound exists but does not support per-user management. */
        UNSUPPORTED
    }

    private final String tag;
    private final Reason reason;

    /**
     * Constructs a new InboundLookupException.
     * 
     * @param tag    the inbound tag that was looked up.
     * @param reason why the lookup failed.
     */
    public InboundLookupException(String tag, Reason reason) {
        super(reason == Reason.NOT_FOUND
                ? "no such inbound tag '" + tag + "'"
                : "inbound '" + tag + "' does not support user management");
        this.tag = tag;
        this.reason = reason;
    }

    public String getTag() {
        return tag;
    }

    public Reason getReason() {
        return reason;
    }
}
