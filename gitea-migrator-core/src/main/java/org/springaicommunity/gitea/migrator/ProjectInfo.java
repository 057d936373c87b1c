package org.springaicommunity.gitea.migrator;

/**
 * Basic GitLab project information.
 *
 * @param id the numeric project ID used by all project-scoped API calls
 * @param pathWithNamespace the full project path in "namespace/name" format
 * @param webUrl the web URL for the project
 */
public record ProjectInfo(long id, String pathWithNamespace, String webUrl) {
}
