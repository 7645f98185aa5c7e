package com.cyberx.vpnpool.api.exception;

public class CredentialNotFoundException extends RuntimeException {

    private final Long credentialId;

    public CredentialNotFoundException(Long credentialId) {
        super("VPN credential not found: " + credentialId);
        this.credentialId = credentialId;
    }

    public CredentialNotFoundException(String message) {
        super(message);
        this.credentialId = null;
    }

    public Long getCredentialId() {
        return credentialId;
    }
}
