package org.springaicommunity.github.chronicle;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <p>
 * The package is flat; naming conventions mark the architectural roles:
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitHubClient} - HTTP operations for GitHub</li>
 * <li>{@link RestService}, {@link GraphQLService} - typed GitHub operations</li>
 * <li>{@link RunConfirmation} - asking before expensive runs</li>
 * </ul>
 *
 * <h3>Implementations</h3>
 * <ul>
 * <li>{@link GitHubHttpClient} - Default HTTP implementation</li>
 * <li>{@link RetryingGitHubClient} - Retry and classification decorator</li>
 * <li>{@link GitHubRestService}, {@link GitHubGraphQLService} - JSON parsing at the
 * service boundary</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Aggregators, Collection Services → Service interfaces (NOT GitHub*Service, NOT clients)
 *   Decorators → Interface they decorate
 *   Models → nothing above them
 *   Configuration (GitHubChronicleBuilder) → All (wiring layer)
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.github.chronicle",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule services_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Services should depend on GitHubClient interface, not the concrete GitHubHttpClient");

	@ArchTest
	static final ArchRule aggregators_should_not_touch_http = noClasses().that()
		.haveSimpleNameEndingWith("Aggregator")
		.or()
		.haveSimpleNameEndingWith("Collector")
		.or()
		.haveSimpleName("ActivityScanner")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubClient")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Aggregation works on typed results from RestService and GraphQLService");

	@ArchTest
	static final ArchRule only_builder_should_instantiate_github_services = noClasses().that()
		.doNotHaveSimpleName("GitHubChronicleBuilder")
		.and()
		.haveSimpleNameNotStartingWith("GitHub")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubRestService")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("GitHubGraphQLService")
		.because("Only GitHubChronicleBuilder should create concrete GitHub services");

	// ========== Decorator Rules ==========

	@ArchTest
	static final ArchRule github_client_decorators_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("GitHubClient")
		.and()
		.doNotHaveSimpleName("GitHubClient")
		.should()
		.implement(GitHubClient.class)
		.because("All *GitHubClient classes should implement the GitHubClient interface");

	@ArchTest
	static final ArchRule decorators_should_not_depend_on_concrete_http_client = noClasses().that()
		.haveSimpleName("RetryingGitHubClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitHubHttpClient")
		.because("Decorators should depend on the GitHubClient interface, not concrete implementation");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule rest_services_should_implement_interface = classes().that()
		.haveSimpleName("GitHubRestService")
		.should()
		.implement(RestService.class);

	@ArchTest
	static final ArchRule graphql_services_should_implement_interface = classes().that()
		.haveSimpleName("GitHubGraphQLService")
		.should()
		.implement(GraphQLService.class);

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Request")
		.or()
		.haveSimpleNameEndingWith("Result")
		.or()
		.haveSimpleNameEndingWith("Stats")
		.or()
		.haveSimpleNameEndingWith("Totals")
		.or()
		.haveSimpleNameEndingWith("Activity")
		.or()
		.haveSimpleNameEndingWith("Record")
		.or()
		.haveSimpleNameEndingWith("Info")
		.or()
		.haveSimpleName("Commit")
		.or()
		.haveSimpleName("Branch")
		.or()
		.haveSimpleName("ContributionSummary")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Model classes should be pure data without service dependencies");

	@ArchTest
	static final ArchRule models_should_not_depend_on_aggregation = noClasses().that()
		.haveSimpleNameEndingWith("Result")
		.or()
		.haveSimpleNameEndingWith("Activity")
		.or()
		.haveSimpleName("Commit")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Aggregator")
		.because("Aggregators build models, models never call back into them");

	// ========== Service Layer Rules ==========

	@ArchTest
	static final ArchRule github_services_should_not_depend_on_collection_services = noClasses().that()
		.haveSimpleNameStartingWith("GitHub")
		.and()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("CollectionService")
		.because("GitHub API services are lower-level than collection services");

	@ArchTest
	static final ArchRule support_classes_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Parser")
		.or()
		.haveSimpleNameEndingWith("Heuristics")
		.or()
		.haveSimpleNameEndingWith("Normalizer")
		.or()
		.haveSimpleNameEndingWith("Resolver")
		.or()
		.haveSimpleNameEndingWith("Filter")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Support classes should not depend on higher-level services");

}
