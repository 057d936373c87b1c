package org.springaicommunity.gitea.migrator;

/**
 * The authenticated user, used as a connectivity and credentials check.
 *
 * @param id the user ID
 * @param username the login name
 */
public record UserInfo(long id, String username) {
}
