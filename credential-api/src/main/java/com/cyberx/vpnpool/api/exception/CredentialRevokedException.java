package com.cyberx.vpnpool.api.exception;

/**
 * The credential was permanently deactivated. Its config may still be in use
 * offline, so it can never be released back into the pool.
 */
public class CredentialRevokedException extends RuntimeException {

    private final Long credentialId;

    public CredentialRevokedException(Long credentialId) {
        super("VPN " + credentialId + " has been permanently deactivated and cannot be returned to the pool");
        this.credentialId = credentialId;
    }

    public Long getCredentialId() {
        return credentialId;
    }
}
