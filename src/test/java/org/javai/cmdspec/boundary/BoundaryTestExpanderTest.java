package org.javai.cmdspec.boundary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.javai.cmdspec.DefectKind;
import org.javai.cmdspec.GenerationOptions;
import org.javai.cmdspec.SpecificationDefectException;
import org.javai.cmdspec.capability.DeviceCapabilityCatalog;
import org.javai.cmdspec.capability.LicenseContext;
import org.javai.cmdspec.load.CommandSpecParser;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.resolve.ParameterResolver;
import org.javai.cmdspec.resolve.ParameterValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BoundaryTestExpander")
class BoundaryTestExpanderTest {

	private static final String EX2 = "YSL-VPN-EX2";

	private final CommandSpecParser parser = new CommandSpecParser();
	private BoundaryTestExpander expander;

	@BeforeEach
	void setUp() {
		expander = new BoundaryTestExpander(new ParameterResolver(DeviceCapabilityCatalog.defaults()),
				new ParameterValidator(), GenerationOptions.defaults());
	}

	private BoundaryExpansion expand(CommandSpec command, String parameter) {
		return expander.expand(command, command.parameters().get(parameter), command.boundaryTestsFor(parameter));
	}

	private BoundaryExpansion expand(CommandSpec command, String parameter, LicenseContext license) {
		return expander.expand(command, command.parameters().get(parameter), command.boundaryTestsFor(parameter), license);
	}

	@Nested
	@DisplayName("Derived cases")
	class Derived {

		@Test
		@DisplayName("should cover the four canonical range boundaries")
		void shouldCoverCanonicalBoundaries() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  parameters:
					    retry: {type: int, range: [1, 10]}
					""");

			BoundaryExpansion expansion = expand(command, "retry");

			assertThat(expansion.cases())
					.extracting(ConcreteBoundaryCase::valueToken, ConcreteBoundaryCase::expectedValid, ConcreteBoundaryCase::origin)
					.containsExactly(
							tuple("0", false, BoundaryOrigin.RANGE),
							tuple("1", true, BoundaryOrigin.RANGE),
							tuple("10", true, BoundaryOrigin.RANGE),
							tuple("11", false, BoundaryOrigin.RANGE));
			assertThat(expansion.cases()).allSatisfy(c -> assertThat(c.model()).isNull());
			assertThat(expansion.hasGaps()).isFalse();
		}

		@Test
		@DisplayName("should use explicit boundary values instead of the canonical ones")
		void shouldUseExplicitBoundaries() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  parameters:
					    mtu:
					      type: int
					      range: [64, 1500]
					      boundaries: [63, 576, 1501]
					""");

			assertThat(expand(command, "mtu").cases())
					.extracting(ConcreteBoundaryCase::valueToken, ConcreteBoundaryCase::expectedValid, ConcreteBoundaryCase::origin)
					.containsExactly(
							tuple("63", false, BoundaryOrigin.OVERRIDE),
							tuple("576", true, BoundaryOrigin.OVERRIDE),
							tuple("1501", false, BoundaryOrigin.OVERRIDE));
		}

		@Test
		@DisplayName("should cover every enum member and one value outside the set")
		void shouldCoverEnumMembers() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  parameters:
					    hash: {enum_values: [md5, sha, sha256]}
					""");

			assertThat(expand(command, "hash").cases())
					.extracting(ConcreteBoundaryCase::valueToken, ConcreteBoundaryCase::expectedValid)
					.containsExactly(
							tuple("md5", true),
							tuple("sha", true),
							tuple("sha256", true),
							tuple("invalid-token", false));
		}

		@Test
		@DisplayName("should pick an out-of-set token the domain really rejects")
		void shouldAvoidOutOfSetTokenInsideTheDomain() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  parameters:
					    mode: {enum_values: [main, invalid-token]}
					""");

			assertThat(expand(command, "mode").cases())
					.filteredOn(c -> !c.expectedValid())
					.extracting(ConcreteBoundaryCase::valueToken)
					.containsExactly("invalid-token-x");
		}

		@Test
		@DisplayName("should use the configured out-of-set token")
		void shouldUseConfiguredOutOfSetToken() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  parameters:
					    use: {type: switch}
					""");
			BoundaryTestExpander custom = new BoundaryTestExpander(new ParameterResolver(DeviceCapabilityCatalog.defaults()),
					new ParameterValidator(), GenerationOptions.builder().outOfSetToken("maybe").build());

			BoundaryExpansion expansion = custom.expand(command, command.parameters().get("use"), List.of());

			assertThat(expansion.cases())
					.extracting(ConcreteBoundaryCase::valueToken, ConcreteBoundaryCase::expectedValid)
					.containsExactly(tuple("on", true), tuple("off", true), tuple("maybe", false));
		}

		@Test
		@DisplayName("should derive range boundaries of integer variants with their keyword")
		void shouldDeriveVariantBoundaries() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  parameters:
					    lifetime:
					      variants:
					        - name: seconds
					          keyword: time
					          type: int
					          range: [300, 691200]
					          terraform_field: lifetime
					        - name: unlimited
					          keyword: unlimited
					""");

			assertThat(expand(command, "lifetime").cases())
					.extracting(ConcreteBoundaryCase::valueToken, ConcreteBoundaryCase::expectedValid, ConcreteBoundaryCase::origin)
					.containsExactly(
							tuple("time 299", false, BoundaryOrigin.VARIANT),
							tuple("time 300", true, BoundaryOrigin.VARIANT),
							tuple("time 691200", true, BoundaryOrigin.VARIANT),
							tuple("time 691201", false, BoundaryOrigin.VARIANT));
		}

		@Test
		@DisplayName("should derive cases per applicable model from each model's domain")
		void shouldDerivePerModel() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  applicable_models: [RTX1220, RTX830]
					  parameters:
					    tunnel_id:
					      type: int
					      range: [1, 100]
					      model_constraints:
					        RTX830:
					          capability: ipsec_tunnels
					""");

			BoundaryExpansion expansion = expand(command, "tunnel_id");

			assertThat(expansion.casesFor("RTX1220")).extracting(ConcreteBoundaryCase::valueToken)
					.containsExactly("0", "1", "100", "101");
			assertThat(expansion.casesFor("RTX830")).extracting(ConcreteBoundaryCase::valueToken)
					.containsExactly("0", "1", "20", "21");
			assertThat(expansion.hasGaps()).isFalse();
		}

		@Test
		@DisplayName("should skip models where the parameter is unsupported")
		void shouldSkipUnsupportedModels() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  applicable_models: [RTX1300, NVR510]
					  parameters:
					    retry:
					      type: int
					      range: [1, 10]
					      model_constraints:
					        NVR510: unavailable
					""");

			BoundaryExpansion expansion = expand(command, "retry");

			assertThat(expansion.casesFor("NVR510")).isEmpty();
			assertThat(expansion.casesFor("RTX1300")).hasSize(4);
		}
	}

	@Nested
	@DisplayName("License tiers")
	class LicenseTiers {

		private CommandSpec command;

		@BeforeEach
		void setUp() {
			command = parser.parseString("""
					command:
					  name: ipsec tunnel
					  applicable_models: [RTX1300]
					  parameters:
					    gateway_id:
					      type: int
					      range: [1, 100]
					      model_constraints:
					        RTX1300:
					          capability: ipsec_tunnels
					""");
		}

		@Test
		@DisplayName("should resolve canonical cases under the given license context")
		void shouldUseGivenLicenseContext() {
			LicenseContext twoLicenses = LicenseContext.of(EX2, 2);

			BoundaryExpansion expansion = expand(command, "gateway_id", twoLicenses);

			assertThat(expansion.casesUnder(twoLicenses))
					.extracting(ConcreteBoundaryCase::valueToken, ConcreteBoundaryCase::expectedValid)
					.containsExactlyInAnyOrder(
							tuple("0", false),
							tuple("1", true),
							tuple("499", true),
							tuple("500", true),
							tuple("501", false));
		}

		@Test
		@DisplayName("should derive limit cases for every quantity in the table")
		void shouldDeriveEveryTier() {
			BoundaryExpansion expansion = expand(command, "gateway_id");

			assertThat(expansion.casesUnder(LicenseContext.none())).extracting(ConcreteBoundaryCase::valueToken)
					.containsExactly("0", "1", "100", "101");
			assertThat(expansion.casesUnder(LicenseContext.of(EX2, 3)))
					.extracting(ConcreteBoundaryCase::valueToken, ConcreteBoundaryCase::expectedValid, ConcreteBoundaryCase::origin)
					.containsExactly(
							tuple("699", true, BoundaryOrigin.LICENSE_TIER),
							tuple("700", true, BoundaryOrigin.LICENSE_TIER),
							tuple("701", false, BoundaryOrigin.LICENSE_TIER));
			assertThat(expansion.casesUnder(LicenseContext.of(EX2, 5)))
					.extracting(ConcreteBoundaryCase::valueToken)
					.containsExactly("1099", "1100", "1101");
			assertThat(expansion.cases()).filteredOn(c -> c.origin() == BoundaryOrigin.LICENSE_TIER).hasSize(15);
		}

		@Test
		@DisplayName("should report a declared table without limits as a coverage gap")
		void shouldReportEmptyTableAsGap() {
			CommandSpec empty = parser.parseString("""
					command:
					  name: ipsec tunnel
					  applicable_models: [RTX1220]
					  parameters:
					    gateway_id:
					      type: int
					      range: [1, 100]
					      model_constraints:
					        RTX1220:
					          license_limits:
					            YSL-VPN-EX2: []
					""");

			BoundaryExpansion expansion = expand(empty, "gateway_id");

			assertThat(expansion.gaps()).singleElement().satisfies(gap -> {
				assertThat(gap.model()).isEqualTo("RTX1220");
				assertThat(gap.parameter()).isEqualTo("gateway_id");
			});
			assertThat(expansion.casesFor("RTX1220")).hasSize(4);
		}

		@Test
		@DisplayName("should report an empty inline table as a coverage gap even when a capability is named")
		void shouldReportEmptyInlineTableAsGap() {
			CommandSpec empty = parser.parseString("""
					command:
					  name: ipsec tunnel
					  applicable_models: [RTX1300]
					  parameters:
					    gateway_id:
					      type: int
					      range: [1, 100]
					      model_constraints:
					        RTX1300:
					          capability: ipsec_tunnels
					          license_limits: {}
					""");

			BoundaryExpansion expansion = expand(empty, "gateway_id");

			assertThat(expansion.gaps()).singleElement().satisfies(gap -> {
				assertThat(gap.model()).isEqualTo("RTX1300");
				assertThat(gap.reason()).contains("license extension");
			});
			assertThat(expansion.cases()).noneMatch(c -> c.origin() == BoundaryOrigin.LICENSE_TIER);
		}
	}

	@Nested
	@DisplayName("Declared cases")
	class Declared {

		@Test
		@DisplayName("should take precedence over derived cases for the same value")
		void shouldReplaceDerivedCase() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  parameters:
					    retry: {type: int, range: [1, 10]}
					  boundary_tests:
					    retry:
					      - value: 0
					        valid: false
					        description: zero retries
					        error_contains: out of range
					""");

			BoundaryExpansion expansion = expand(command, "retry");

			assertThat(expansion.cases()).hasSize(4);
			ConcreteBoundaryCase first = expansion.cases().get(0);
			assertThat(first.origin()).isEqualTo(BoundaryOrigin.DECLARED);
			assertThat(first.description()).isEqualTo("zero retries");
			assertThat(first.errorContains()).isEqualTo("out of range");
			assertThat(first.resolvedDomain()).isPresent();
		}

		@Test
		@DisplayName("should keep the canonical cases of each model next to an unscoped declared case")
		void shouldKeepCanonicalCasesPerModel() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  applicable_models: [RTX1220, RTX830]
					  parameters:
					    retry: {type: int, range: [1, 10]}
					  boundary_tests:
					    retry:
					      - value: 0
					        valid: false
					""");

			BoundaryExpansion expansion = expand(command, "retry");

			assertThat(expansion.cases()).filteredOn(c -> c.origin() == BoundaryOrigin.DECLARED)
					.singleElement()
					.satisfies(c -> assertThat(c.model()).isNull());
			assertThat(expansion.casesFor("RTX830"))
					.extracting(ConcreteBoundaryCase::valueToken, ConcreteBoundaryCase::expectedValid)
					.containsExactly(tuple("0", false), tuple("1", true), tuple("10", true), tuple("11", false));
			assertThat(expansion.casesFor("RTX1220")).hasSize(4);
		}

		@Test
		@DisplayName("should let a declared case on one model replace that model's derived case")
		void shouldReplaceDerivedCaseOnSameModel() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  applicable_models: [RTX1220, RTX830]
					  parameters:
					    retry: {type: int, range: [1, 10]}
					  boundary_tests:
					    retry:
					      - value: 10
					        valid: true
					        valid_for: [RTX1220, RTX830]
					""");

			BoundaryExpansion expansion = expand(command, "retry");

			assertThat(expansion.casesFor("RTX830"))
					.extracting(ConcreteBoundaryCase::valueToken, ConcreteBoundaryCase::origin)
					.containsExactly(
							tuple("10", BoundaryOrigin.DECLARED),
							tuple("0", BoundaryOrigin.RANGE),
							tuple("1", BoundaryOrigin.RANGE),
							tuple("11", BoundaryOrigin.RANGE));
		}

		@Test
		@DisplayName("should expand a model-scoped test per model")
		void shouldExpandScopedTest() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  applicable_models: [RTX1220, RTX830]
					  parameters:
					    tunnel_id:
					      type: int
					      range: [1, 100]
					      model_constraints:
					        RTX830:
					          capability: ipsec_tunnels
					  boundary_tests:
					    tunnel_id:
					      - value: 50
					        valid: true
					        valid_for: [RTX1220]
					        invalid_for: [RTX830]
					""");

			BoundaryExpansion expansion = expand(command, "tunnel_id");

			assertThat(expansion.cases())
					.filteredOn(c -> c.origin() == BoundaryOrigin.DECLARED)
					.extracting(ConcreteBoundaryCase::model, ConcreteBoundaryCase::expectedValid)
					.containsExactly(tuple("RTX1220", true), tuple("RTX830", false));
		}

		@Test
		@DisplayName("should report every contradiction with the resolved domain together")
		void shouldReportAllContradictions() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  parameters:
					    retry: {type: int, range: [1, 10]}
					  boundary_tests:
					    retry:
					      - value: 0
					        valid: true
					      - value: 5
					        valid: false
					""");

			assertThatThrownBy(() -> expand(command, "retry"))
					.isInstanceOfSatisfying(SpecificationDefectException.class, e ->
							assertThat(e.defects()).extracting("kind").containsExactly(
									DefectKind.BOUNDARY_CONTRADICTS_DOMAIN,
									DefectKind.BOUNDARY_CONTRADICTS_DOMAIN));
		}

		@Test
		@DisplayName("should reject a declared-valid value outside the enum")
		void shouldRejectValueOutsideEnum() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  parameters:
					    hash: {enum_values: [md5, sha]}
					  boundary_tests:
					    hash:
					      - value: sha512
					        valid: true
					""");

			assertThatThrownBy(() -> expand(command, "hash"))
					.isInstanceOfSatisfying(SpecificationDefectException.class, e ->
							assertThat(e.defects()).extracting("kind").containsExactly(DefectKind.ENUM_VALUE_OUT_OF_DOMAIN));
		}

		@Test
		@DisplayName("should reject a value declared valid on a model lacking the parameter")
		void shouldRejectValidOnUnsupportedModel() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  applicable_models: [RTX1300, NVR510]
					  parameters:
					    retry:
					      type: int
					      range: [1, 10]
					      model_constraints:
					        NVR510: unavailable
					  boundary_tests:
					    retry:
					      - value: 5
					        valid: true
					        valid_for: [RTX1300, NVR510]
					""");

			assertThatThrownBy(() -> expand(command, "retry"))
					.isInstanceOfSatisfying(SpecificationDefectException.class, e ->
							assertThat(e.defects()).singleElement().satisfies(d -> {
								assertThat(d.kind()).isEqualTo(DefectKind.BOUNDARY_CONTRADICTS_DOMAIN);
								assertThat(d.message()).contains("NVR510");
							}));
		}
	}

	@Test
	@DisplayName("should report a range-typed parameter without bounds as a coverage gap")
	void shouldReportMissingRangeAsGap() {
		CommandSpec command = parser.parseString("""
				command:
				  name: demo
				  parameters:
				    weight: {type: int}
				""");

		BoundaryExpansion expansion = expand(command, "weight");

		assertThat(expansion.cases()).isEmpty();
		assertThat(expansion.gaps()).singleElement()
				.satisfies(gap -> assertThat(gap.reason()).contains("no bounds"));
	}
}
