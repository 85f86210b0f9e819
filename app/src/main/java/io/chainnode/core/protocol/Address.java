package io.chainnode.core.protocol;

/**
 * Account addresses are opaque identifiers of {@value ProtocolLimits#MIN_ADDRESS_LEN}..{@value ProtocolLimits#MAX_ADDRESS_LEN}
 * characters from {@code [0-9A-Za-z_:-]}. Keys derive lowercase hex addresses; genesis allocations may use any valid name.
 */
public final class Address {
    private Address(){}

    public static boolean isValid(String addr) {
        return problem(addr) == null;
    }

    /** Null when {@code addr} is acceptable, otherwise a short reason. */
    public static String problem(String addr) {
        if (addr == null) return "missing";
        int len = addr.length();
        if (len < ProtocolLimits.MIN_ADDRESS_LEN) return "shorter than " + ProtocolLimits.MIN_ADDRESS_LEN + " chars";
        if (len > ProtocolLimits.MAX_ADDRESS_LEN) return "longer than " + ProtocolLimits.MAX_ADDRESS_LEN + " chars";
        for (int i = 0; i < len; i++) {
            if (!allowed(addr.charAt(i))) {
                return "illegal character at " + i;
            }
        }
        return null;
    }

    private static boolean allowed(char c) {
        return Character.isLetterOrDigit(c) && c < 128 || c == '_' || c == '-' || c == ':';
    }
}
