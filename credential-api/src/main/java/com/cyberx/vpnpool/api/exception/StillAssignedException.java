package com.cyberx.vpnpool.api.exception;

/**
 * The credential is assigned (or reserved) and the requested change needs it to be available.
 */
public class StillAssignedException extends RuntimeException {

    private final Long credentialId;

    public StillAssignedException(Long credentialId, String message) {
        super(message);
        this.credentialId = credentialId;
    }

    public Long getCredentialId() {
        return credentialId;
    }
}
