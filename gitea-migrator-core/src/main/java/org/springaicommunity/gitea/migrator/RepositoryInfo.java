package org.springaicommunity.gitea.migrator;

import org.jspecify.annotations.Nullable;

/**
 * Basic Gitea repository information.
 *
 * @param id the unique repository ID
 * @param name the repository name (without owner)
 * @param fullName the full repository name in "owner/repo" format
 * @param description the repository description (may be null)
 * @param htmlUrl the web URL for the repository
 */
public record RepositoryInfo(long id, String name, String fullName, @Nullable String description, String htmlUrl) {

}
