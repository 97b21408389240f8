package org.javai.cmdspec.generate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.cmdspec.DefectKind;
import org.javai.cmdspec.GenerationOptions;
import org.javai.cmdspec.boundary.ConcreteBoundaryCase;
import org.javai.cmdspec.capability.DeviceCapabilityCatalog;
import org.javai.cmdspec.load.CommandSpecParser;
import org.javai.cmdspec.load.CommandSpecRegistry;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.syntax.CommandCodec;
import org.javai.cmdspec.syntax.CommandSyntaxException;
import org.javai.cmdspec.syntax.RoundTripResult;
import org.javai.cmdspec.syntax.TemplateCommandCodec;
import org.javai.cmdspec.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CommandSpecGenerator")
class CommandSpecGeneratorTest {

	private static final String UNBOUNDED = """
			command:
			  name: demo weight
			  parameters:
			    weight: {type: int}
			""";

	private static final String INTEGER_WITH_KEYWORD = """
			command:
			  name: ip mtu
			  syntax:
			    set: "ip mtu <size>"
			  parameters:
			    size:
			      type: int
			      enum_values: [auto, 1280, 1500]
			      terraform_field: mtu
			  syntax_tests:
			    - name: automatic
			      rtx: "ip mtu auto"
			      terraform:
			        mtu: auto
			    - name: fixed
			      rtx: "ip mtu 1500"
			      terraform:
			        mtu: 1500
			""";

	private final CommandSpecParser parser = new CommandSpecParser();
	private final DeviceCapabilityCatalog catalog = DeviceCapabilityCatalog.defaults();
	private CommandSpecRegistry registry;

	@BeforeEach
	void setUp() {
		registry = CommandSpecRegistry.create().registerResources(List.of(
				"specs/ipsec-ike-encryption.yaml",
				"specs/ipsec-ike-keepalive-use.yaml",
				"specs/ipsec-ike-pre-shared-key.yaml",
				"specs/ipsec-ike-pfs.yaml"), getClass().getClassLoader());
	}

	@Nested
	@DisplayName("Well-formed commands")
	class WellFormed {

		private final CommandSpecGenerator generator = new CommandSpecGenerator(catalog, GenerationOptions.defaults());

		@Test
		void shouldGenerateEveryFixtureWithoutFailedRoundTrips() {
			GenerationReport report = generator.generateAll(registry.specs());

			assertThat(report.isComplete()).isTrue();
			assertThat(report.generated()).hasSize(4);
			assertThat(report.generated()).allSatisfy(artifacts -> {
				assertThat(artifacts.failedRoundTrips()).isEmpty();
				assertThat(artifacts.suppressedGaps()).isEmpty();
			});
		}

		@Test
		void shouldCollectBoundaryCasesRoundTripsAndMappings() {
			GenerationResult result = generator.generate(registry.requireSpec("ipsec ike encryption"));

			assertThat(result).isInstanceOfSatisfying(GenerationResult.Generated.class, generated -> {
				CommandArtifacts artifacts = generated.artifacts();
				assertThat(artifacts.boundaryCases())
						.filteredOn(c -> c.parameter().equals("gateway_id") && "RTX830".equals(c.model()))
						.extracting(ConcreteBoundaryCase::valueToken, ConcreteBoundaryCase::expectedValid)
						.contains(
								tuple("0", false),
								tuple("1", true),
								tuple("100", true),
								tuple("101", false));
				assertThat(artifacts.combinations()).isEmpty();
				assertThat(artifacts.roundTrips()).hasSize(7);
				assertThat(artifacts.fieldMappings().structName()).isEqualTo("IKEPhase1");
			});
		}

		@Test
		void shouldBuildThePairwiseMatrixWhenEnabled() {
			GenerationResult result = generator.generate(registry.requireSpec("ipsec ike pfs"));

			assertThat(result).isInstanceOfSatisfying(GenerationResult.Generated.class, generated ->
					assertThat(generated.artifacts().combinations()).isNotEmpty());
		}
	}

	@Nested
	@DisplayName("Aborting")
	class Aborting {

		@Test
		void shouldAbortOnValidatorDefects() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  applicable_models: [RTX9999]
					  parameters:
					    id: {type: int, range: [1, 10]}
					""");

			GenerationResult result = new CommandSpecGenerator(catalog, GenerationOptions.defaults()).generate(command);

			assertThat(result).isInstanceOfSatisfying(GenerationResult.Aborted.class, aborted -> {
				assertThat(aborted.defects()).extracting("kind").containsExactly(DefectKind.UNKNOWN_MODEL);
				assertThat(aborted.gaps()).isEmpty();
			});
		}

		@Test
		void shouldAbortOnBoundaryContradictions() {
			CommandSpec command = parser.parseString("""
					command:
					  name: demo
					  parameters:
					    id: {type: int, range: [1, 10]}
					  boundary_tests:
					    id:
					      - value: 0
					        valid: true
					""");

			GenerationResult result = new CommandSpecGenerator(catalog, GenerationOptions.defaults()).generate(command);

			assertThat(result).isInstanceOfSatisfying(GenerationResult.Aborted.class, aborted ->
					assertThat(aborted.defects()).extracting("kind").containsExactly(DefectKind.BOUNDARY_CONTRADICTS_DOMAIN));
		}

		@Test
		void shouldAbortOnCoverageGapsUnlessSuppressed() {
			CommandSpec command = parser.parseString(UNBOUNDED);

			GenerationResult result = new CommandSpecGenerator(catalog, GenerationOptions.defaults()).generate(command);

			assertThat(result).isInstanceOfSatisfying(GenerationResult.Aborted.class, aborted -> {
				assertThat(aborted.defects()).isEmpty();
				assertThat(aborted.gaps()).singleElement().satisfies(gap -> {
					assertThat(gap.command()).isEqualTo("demo weight");
					assertThat(gap.parameter()).isEqualTo("weight");
				});
			});
		}

		@Test
		void shouldLogSuppressedCoverageGaps() {
			CommandSpec command = parser.parseString(UNBOUNDED);
			CommandSpecGenerator generator = new CommandSpecGenerator(catalog,
					GenerationOptions.builder().suppressCoverageGaps(true).build());

			try (LogCaptorAppender appender = LogCaptorAppender.create(CommandSpecGenerator.class, Level.WARN)) {
				GenerationResult result = generator.generate(command);

				assertThat(result).isInstanceOfSatisfying(GenerationResult.Generated.class, generated ->
						assertThat(generated.artifacts().suppressedGaps()).hasSize(1));
				assertThat(appender.messagesAt(Level.WARN))
						.singleElement()
						.satisfies(message -> assertThat(message).startsWith("Suppressed coverage gap: demo weight/weight"));
			}
		}
	}

	@Test
	void shouldKeepInputOrderWhenGeneratingInParallel() {
		List<CommandSpec> commands = new ArrayList<>(registry.specs());
		commands.add(1, parser.parseString(UNBOUNDED));
		CommandSpecGenerator generator = new CommandSpecGenerator(catalog,
				GenerationOptions.builder().parallelism(2).build());

		GenerationReport report = generator.generateAll(commands);

		assertThat(report.results()).extracting(GenerationResult::command)
				.containsExactlyElementsOf(commands.stream().map(CommandSpec::name).toList());
		assertThat(report.aborted()).extracting(GenerationResult.Aborted::command).containsExactly("demo weight");
		assertThat(report.isComplete()).isFalse();
	}

	@Test
	void shouldReportRoundTripFailuresOfTheSuppliedCodec() {
		CommandCodec codec = mock(CommandCodec.class);
		when(codec.normalize(anyString())).thenAnswer(invocation -> invocation.getArgument(0));
		when(codec.parse(anyString())).thenThrow(new CommandSyntaxException("unsupported"));
		when(codec.serialize(anyMap())).thenThrow(new CommandSyntaxException("unsupported"));
		CommandSpecGenerator generator = new CommandSpecGenerator(catalog, GenerationOptions.defaults(), command -> codec);

		GenerationResult result = generator.generate(registry.requireSpec("ipsec ike pfs"));

		assertThat(result).isInstanceOfSatisfying(GenerationResult.Generated.class, generated ->
				assertThat(generated.artifacts().failedRoundTrips()).singleElement().satisfies(failed ->
						assertThat(failed.failures()).extracting(RoundTripResult.DirectionFailure::direction)
								.containsExactly(RoundTripResult.Direction.PARSE, RoundTripResult.Direction.SERIALIZE)));
	}

	@Test
	void shouldRoundTripKeywordValuesOfIntegerParameters() {
		CommandSpecGenerator generator = new CommandSpecGenerator(catalog, GenerationOptions.defaults());

		GenerationResult result = generator.generate(parser.parseString(INTEGER_WITH_KEYWORD));

		assertThat(result).isInstanceOfSatisfying(GenerationResult.Generated.class, generated -> {
			assertThat(generated.artifacts().roundTrips()).hasSize(2);
			assertThat(generated.artifacts().failedRoundTrips()).isEmpty();
		});
	}

	@Test
	void shouldReportUnexpectedCodecErrorsAsFailedRoundTrips() {
		CommandCodec codec = mock(CommandCodec.class);
		when(codec.normalize(anyString())).thenAnswer(invocation -> invocation.getArgument(0));
		when(codec.parse(anyString())).thenThrow(new NumberFormatException("For input string: \"auto\""));
		when(codec.serialize(anyMap())).thenReturn("ipsec ike pfs 1 on");
		CommandSpecGenerator generator = new CommandSpecGenerator(catalog, GenerationOptions.defaults(), command -> codec);

		GenerationResult result = generator.generate(registry.requireSpec("ipsec ike pfs"));

		assertThat(result).isInstanceOfSatisfying(GenerationResult.Generated.class, generated ->
				assertThat(generated.artifacts().failedRoundTrips()).isNotEmpty().allSatisfy(failed ->
						assertThat(failed.failures()).anySatisfy(failure -> {
							assertThat(failure.direction()).isEqualTo(RoundTripResult.Direction.PARSE);
							assertThat(failure.actual()).contains("NumberFormatException");
						})));
	}

	@Test
	void shouldAbortOnlyTheCommandWhoseGeneratorFails() {
		CommandSpecGenerator generator = new CommandSpecGenerator(catalog,
				GenerationOptions.builder().parallelism(1).build(), command -> {
					if (command.name().equals("ipsec ike pfs")) {
						throw new IllegalStateException("codec unavailable");
					}
					return new TemplateCommandCodec(command);
				});

		try (LogCaptorAppender appender = LogCaptorAppender.create(CommandSpecGenerator.class, Level.WARN)) {
			GenerationReport report = generator.generateAll(registry.specs());

			assertThat(report.aborted()).singleElement().satisfies(aborted -> {
				assertThat(aborted.command()).isEqualTo("ipsec ike pfs");
				assertThat(aborted.defects()).isEmpty();
				assertThat(aborted.error()).contains("codec unavailable");
			});
			assertThat(report.generated()).hasSize(3);
			assertThat(appender.messagesAt(Level.WARN)).containsExactly("Generation of ipsec ike pfs failed");
		}
	}
}
