package com.cyberx.vpnpool.common.naming;

/**
 * The credential fields a filename pattern can reference.
 */
public interface NamedCredential {

    Long getId();

    String getIpv4Address();

    String getEndpoint();

    String getRequestBatchId();
}
