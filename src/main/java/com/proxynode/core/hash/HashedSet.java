package com.proxynode.core.hash;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A set of strings with an order-independent fingerprint that is updated in
 * O(1) per insertion or removal.
 * <p>
 * Each member contributes a dual DJB2 hash which is XOR-folded into two 32-bit
 * accumulators. XOR is commutative and self-inverse, so the fingerprint depends
 * only on the current membership, never on insertion order. The hash constants
 * are shared with the management panel, which computes the same fingerprint
 * from its own view of the membership.
 * </p>
 * Not thread-safe; callers guard instances with their own lock.
 */
public class HashedSet {

    private static final int HIGH_SEED = 5381;
    private static final int LOW_SEED = 5387;

    /** Fingerprint of the empty set. */
    public static final String EMPTY_FINGERPRINT = "0000000000000000";

    private final Set<String> items = new HashSet<>();
    private int hashHigh;
    private int hashLow;

    /**
     * Adds a member. Adding an existing member leaves the set untouched.
     *
     * @param item the member to add.
     */
    public void add(String item) {
        if (items.add(item)) {
            toggle(item);
        }
    }

    /**
     * Removes a member. Removing a non-member leaves the set untouched.
     *
     * @param item the member to remove.
     */
    public void delete(String item) {
        if (items.remove(item)) {
            toggle(item);
        }
    }

    public boolean has(String item) {
        return items.contains(item);
    }

    public int size() {
        return items.size();
    }

    /**
     * Removes all members and resets the fingerprint to
     * {@link #EMPTY_FINGERPRINT}.
     */
    public void clear() {
        items.clear();
        hashHigh = 0;
        hashLow = 0;
    }

    /**
     * Returns the 16-character lowercase hex fingerprint: 8 digits of the high
     * accumulator followed by 8 digits of the low one.
     *
     * @return the fingerprint of the current membership.
     */
    public String fingerprint() {
        return String.format("%08x%08x", hashHigh, hashLow);
    }

    /**
     * Returns a snapshot of the members in no particular order.
     *
     * @return a new list containing every member.
     */
    public List<String> items() {
        return new ArrayList<>(items);
    }

    private void toggle(String item) {
        long dual = djb2Dual(item);
        hashHigh ^= (int) (dual >>> 32);
        hashLow ^= (int) dual;
    }

    /**
     * Computes both DJB2 variants over the UTF-8 bytes of {@code value}.
     * High: {@code h * 33 + b} from 5381. Low: {@code l * 65 + b * 37} from 5387.
     * Both wrap as signed 32-bit integers.
     *
     * @param value the string to hash.
     * @return high hash in the upper 32 bits, low hash in the lower 32 bits.
     */
    static long djb2Dual(String value) {
        int h = HIGH_SEED;
        int l = LOW_SEED;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xff;
            h = (h << 5) + h + c;
            l = (l << 6) + l + c * 37;
        }
        return ((long) h << 32) | (l & 0xffffffffL);
    }
}
