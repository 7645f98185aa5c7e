package com.cyberx.vpnpool.api.service;

import com.cyberx.vpnpool.api.entity.VpnCredential;
import com.cyberx.vpnpool.common.pool.AssignmentType;
import com.cyberx.vpnpool.common.wireguard.WireGuardConfig;
import org.springframework.stereotype.Component;

/**
 * Copies WireGuard fields between the parsed config and the stored credential.
 * Unset optional fields stay null in both directions.
 */
@Component
public class CredentialConfigMapper {

    public VpnCredential toNewCredential(WireGuardConfig config, String fileHash, AssignmentType assignmentType) {
        VpnCredential credential = new VpnCredential();
        credential.setFileHash(fileHash);
        credential.setInterfaceIp(config.getInterfaceIp());
        credential.setIpv4Address(config.getIpv4Address());
        credential.setIpv6Local(config.getIpv6Local());
        credential.setIpv6Global(config.getIpv6Global());
        credential.setPrivateKey(config.getPrivateKey());
        credential.setPresharedKey(config.getPresharedKey());
        credential.setEndpoint(config.getEndpoint());
        credential.setPublicKey(config.getPublicKey());
        credential.setDns(config.getDns());
        credential.setMtu(config.getMtu());
        credential.setAllowedIps(config.getAllowedIps());
        credential.setPersistentKeepalive(config.getPersistentKeepalive());
        credential.setTable(config.getTable());
        credential.setSaveConfig(config.getSaveConfig());
        credential.setFwMark(config.getFwMark());
        credential.setAssignmentType(assignmentType);
        credential.setIsAvailable(true);
        credential.setIsActive(true);
        return credential;
    }

    public WireGuardConfig toConfig(VpnCredential credential) {
        WireGuardConfig config = new WireGuardConfig();
        config.setInterfaceIp(credential.getInterfaceIp());
        config.setIpv4Address(credential.getIpv4Address());
        config.setIpv6Local(credential.getIpv6Local());
        config.setIpv6Global(credential.getIpv6Global());
        config.setPrivateKey(credential.getPrivateKey());
        config.setPresharedKey(credential.getPresharedKey());
        config.setEndpoint(credential.getEndpoint());
        config.setPublicKey(credential.getPublicKey());
        config.setDns(credential.getDns());
        config.setMtu(credential.getMtu());
        config.setAllowedIps(credential.getAllowedIps());
        config.setPersistentKeepalive(credential.getPersistentKeepalive());
        config.setTable(credential.getTable());
        config.setSaveConfig(credential.getSaveConfig());
        config.setFwMark(credential.getFwMark());
        return config;
    }
}
