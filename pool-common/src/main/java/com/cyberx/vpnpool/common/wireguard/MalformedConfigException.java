package com.cyberx.vpnpool.common.wireguard;

import java.util.List;

/**
 * Thrown when a WireGuard config lacks one or more required fields.
 *
 * The message names every missing field so import reports can be read without
 * opening the offending file.
 */
public class MalformedConfigException extends RuntimeException {

    private final List<String> missingFields;

    public MalformedConfigException(List<String> missingFields) {
        super("Invalid WireGuard config - missing required fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
