package com.cyberx.vpnpool.api.service;

/**
 * A user to receive one credential in an admin bulk assignment.
 */
public record UserAssignment(Long userId, String username) {
}
