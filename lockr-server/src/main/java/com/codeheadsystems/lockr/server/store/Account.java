package com.codeheadsystems.lockr.server.store;

/**
 * What the vault core needs to know about an account.
 *
 * @param userId the user id
 * @param email  the verified email address reset links are sent to
 */
public record Account(String userId, String email) {
}
