package com.cyberx.vpnpool.common.pool;

import java.util.Arrays;
import java.util.Optional;

/**
 * Pool class of a credential. Decides which allocation path may claim it.
 *
 * - USER_REQUESTABLE: participant self-service requests
 * - INSTANCE_AUTO_ASSIGN: claimed automatically when an instance is provisioned
 * - RESERVED: held back, never claimed automatically
 */
public enum AssignmentType {
    USER_REQUESTABLE,
    INSTANCE_AUTO_ASSIGN,
    RESERVED;

    /**
     * Lenient lookup for values coming from request bodies and query strings.
     *
     * @param value raw value, may be null
     * @return matching type, or empty if the value is not one of the recognized names
     */
    public static Optional<AssignmentType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(type -> type.name().equals(normalized))
            .findFirst();
    }

    public static String allowedValues() {
        return String.join(", ", Arrays.stream(values()).map(Enum::name).toList());
    }
}
