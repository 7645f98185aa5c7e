package com.cyberx.vpnpool.common.wireguard;

/**
 * Server-wide values used when a credential has no value of its own for a field.
 *
 * Every component is nullable; a null component means "no default", and the
 * corresponding line is left out of a generated config.
 */
public record ServerDefaults(
    String publicKey,
    String dnsServers,
    String allowedIps,
    String mtu
) {

    public static ServerDefaults none() {
        return new ServerDefaults(null, null, null, null);
    }

    /**
     * Layer per-call overrides on top of these defaults.
     *
     * @param overrides values that win where non-blank, may be null
     * @return merged defaults
     */
    public ServerDefaults withOverrides(ServerDefaults overrides) {
        if (overrides == null) {
            return this;
        }
        return new ServerDefaults(
            pick(overrides.publicKey, publicKey),
            pick(overrides.dnsServers, dnsServers),
            pick(overrides.allowedIps, allowedIps),
            pick(overrides.mtu, mtu)
        );
    }

    private static String pick(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
