/**
 * Core of the GitLab to Gitea migrator: remote API clients, paged readers, reference
 * resolution and the migration engine.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.gitea.migrator;

import org.jspecify.annotations.NullMarked;
