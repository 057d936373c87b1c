package org.springaicommunity.gitea.migrator;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link ApiClient} - HTTP operations for both remote APIs</li>
 * <li>{@link SourceReader} - Paged reads from the source project</li>
 * <li>{@link DestinationReader}, {@link DestinationWriter} - Destination lookups and
 * mutations</li>
 * <li>{@link MigrationReporter} - Progress reporting</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Engine → Interfaces (NOT concrete services or HTTP client)
 *   REST services → ApiClient (NOT RestApiClient)
 *   Records → nothing service-level
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.gitea.migrator", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	@ArchTest
	static final ArchRule engine_should_not_depend_on_concrete_services = noClasses().that()
		.haveSimpleName("MigrationEngine")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("RestService")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GiteaDestination")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GitLabSourceReader")
		.because("MigrationEngine should only see the reader, writer and reporter interfaces");

	@ArchTest
	static final ArchRule rest_services_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("RestService")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("RestApiClient")
		.because("REST services should depend on the ApiClient interface, not the concrete RestApiClient");

	@ArchTest
	static final ArchRule engine_should_not_touch_http = noClasses().that()
		.haveSimpleNameStartingWith("Migration")
		.should()
		.dependOnClassesThat()
		.resideInAPackage("java.net.http..")
		.because("Migration logic is independent of the transport");

	@ArchTest
	static final ArchRule reference_resolution_should_be_pure = noClasses().that()
		.haveSimpleNameStartingWith("Reference")
		.or()
		.haveSimpleNameStartingWith("Resol")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Reader")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Writer")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("ApiClient")
		.because("Reference resolution works on pre-fetched lookup tables only");

	@ArchTest
	static final ArchRule api_client_implementations_should_be_named_client = classes().that()
		.implement(ApiClient.class)
		.should()
		.haveSimpleNameEndingWith("Client");

}
