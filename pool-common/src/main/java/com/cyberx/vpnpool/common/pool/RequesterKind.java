package com.cyberx.vpnpool.common.pool;

public enum RequesterKind {
    USER,
    INSTANCE
}
