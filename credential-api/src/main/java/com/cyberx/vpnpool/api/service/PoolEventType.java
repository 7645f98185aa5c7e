package com.cyberx.vpnpool.api.service;

public enum PoolEventType {
    CREDENTIALS_ASSIGNED,
    CREDENTIALS_IMPORTED,
    CREDENTIALS_REVOKED,
    CREDENTIAL_RELEASED,
    CREDENTIALS_DELETED,
    INSTANCE_LINKED
}
