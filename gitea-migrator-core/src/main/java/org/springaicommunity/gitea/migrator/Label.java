package org.springaicommunity.gitea.migrator;

import org.jspecify.annotations.Nullable;

/**
 * A label as read from either the source or the destination project.
 *
 * @param id the label ID assigned by the service that returned it
 * @param name the label name (unique within the project, the identity key)
 * @param description an optional description
 * @param color the hex color triplet as returned by the service
 */
public record Label(long id, String name, @Nullable String description, String color) {
}
