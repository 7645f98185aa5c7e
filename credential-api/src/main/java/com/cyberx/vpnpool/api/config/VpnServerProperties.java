package com.cyberx.vpnpool.api.config;

import com.cyberx.vpnpool.common.wireguard.ServerDefaults;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WireGuard server values used when a credential carries none of its own.
 *
 * Maps to:
 * vpn:
 *   server:
 *     public-key: ...
 *     endpoint: 216.208.235.11:51020
 *     dns-servers: 10.20.200.1
 *     allowed-ips: 10.0.0.0/8,fd00:a::/32
 *     mtu:
 *
 * Runtime overrides live in the app_settings table, see AppSettingService.
 */
@ConfigurationProperties(prefix = "vpn.server")
@Data
public class VpnServerProperties {

    private String publicKey;

    /**
     * Endpoint used by imports that do not supply an override and whose files carry none.
     */
    private String endpoint;

    private String dnsServers = "10.20.200.1";

    private String allowedIps = "10.0.0.0/8,fd00:a::/32";

    private String mtu;

    public ServerDefaults toServerDefaults() {
        return new ServerDefaults(publicKey, dnsServers, allowedIps, mtu);
    }
}
