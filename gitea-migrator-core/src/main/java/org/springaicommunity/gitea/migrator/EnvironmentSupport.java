package org.springaicommunity.gitea.migrator;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves access tokens and other settings from the environment, honouring {@code .env}
 * files. The files are read once per process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>System environment variable, then the {@code .env} file in the current working
 * directory (if present)</li>
 * <li>{@code .env} file in the user's home directory</li>
 * </ol>
 */
public final class EnvironmentSupport {

	/**
	 * Variable holding the GitLab access token.
	 */
	public static final String GITLAB_TOKEN = "GITLAB_TOKEN";

	/**
	 * Variable holding the Gitea access token.
	 */
	public static final String GITEA_TOKEN = "GITEA_TOKEN";

	private static final Dotenv WORKING_DIR = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	@Nullable
	private static final Dotenv HOME_DIR = loadFromHome();

	private EnvironmentSupport() {
	}

	@Nullable
	private static Dotenv loadFromHome() {
		String home = System.getProperty("user.home");
		if (home == null) {
			return null;
		}
		return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
	}

	/**
	 * Get an environment value, treating blank values as absent.
	 * @param name the variable name
	 * @return the value, or {@code null} if not set anywhere
	 */
	@Nullable
	public static String get(String name) {
		String value = WORKING_DIR.get(name);
		if ((value == null || value.isBlank()) && HOME_DIR != null) {
			value = HOME_DIR.get(name);
		}
		return value == null || value.isBlank() ? null : value;
	}

}
