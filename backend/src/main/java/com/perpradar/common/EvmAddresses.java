package com.perpradar.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * EVM address helpers. Addresses are stored and compared lowercase.
 */
public final class EvmAddresses {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    private EvmAddresses() {
    }

    /** Trimmed, lowercase form; null stays null. */
    public static String normalize(String address) {
        return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
    }

    /** 0x-prefixed, 42 characters, hex body (case-insensitive). */
    public static boolean isValid(String address) {
        if (address == null || address.isBlank()) return false;
        return EVM_ADDRESS.matcher(normalize(address)).matches();
    }

    /** Display form: first 6 and last 4 characters, e.g. {@code 0xb317...83ae}. */
    public static String shortForm(String address) {
        if (address == null) {
            return "";
        }
        if (address.length() <= 10) {
            return address;
        }
        return address.substring(0, 6) + "..." + address.substring(address.length() - 4);
    }
}
