package com.cyberx.vpnpool.common.naming;

/**
 * The principal a download is rendered for.
 *
 * @param userId user id, may be null for anonymous rendering
 * @param username display username, may be null
 */
public record Requester(Long userId, String username) {
}
