package com.cyberx.vpnpool.api.dto;

import com.cyberx.vpnpool.common.wireguard.ServerDefaults;
import lombok.Data;

/**
 * Fields left null keep their stored value; an empty string reverts to the configured default.
 */
@Data
public class ServerDefaultsRequest {
    private String publicKey;
    private String dnsServers;
    private String allowedIps;
    private String mtu;

    public ServerDefaults toServerDefaults() {
        return new ServerDefaults(publicKey, dnsServers, allowedIps, mtu);
    }
}
