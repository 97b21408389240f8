package org.javai.cmdspec.generate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.javai.cmdspec.CoverageGap;
import org.javai.cmdspec.CoverageGapException;
import org.javai.cmdspec.GenerationOptions;
import org.javai.cmdspec.SpecificationDefect;
import org.javai.cmdspec.SpecificationDefectException;
import org.javai.cmdspec.boundary.BoundaryExpansion;
import org.javai.cmdspec.boundary.BoundaryTestExpander;
import org.javai.cmdspec.boundary.ConcreteBoundaryCase;
import org.javai.cmdspec.capability.DeviceCapabilityCatalog;
import org.javai.cmdspec.mapping.FieldMappingEmitter;
import org.javai.cmdspec.mapping.FieldMappingTable;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.model.Parameter;
import org.javai.cmdspec.pairwise.Combination;
import org.javai.cmdspec.pairwise.PairwiseMatrixGenerator;
import org.javai.cmdspec.resolve.ParameterResolver;
import org.javai.cmdspec.resolve.ParameterValidator;
import org.javai.cmdspec.syntax.CommandCodec;
import org.javai.cmdspec.syntax.RoundTripResult;
import org.javai.cmdspec.syntax.SyntaxRoundTripValidator;
import org.javai.cmdspec.syntax.TemplateCommandCodec;
import org.javai.cmdspec.validate.CommandSpecValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every generator over a command specification.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CommandSpecGenerator generator = new CommandSpecGenerator(
 *         DeviceCapabilityCatalog.defaults(), GenerationOptions.defaults());
 * GenerationReport report = generator.generateAll(registry.specs());
 * }</pre>
 *
 * <p>A defective specification, an unsuppressed coverage gap or a failing
 * generator aborts its own command only. Commands are independent; with a parallelism above one they
 * are generated on a fixed thread pool and reported in input order.
 */
public class CommandSpecGenerator {

	private static final Logger logger = LoggerFactory.getLogger(CommandSpecGenerator.class);

	private final GenerationOptions options;
	private final CommandSpecValidator validator;
	private final BoundaryTestExpander expander;
	private final PairwiseMatrixGenerator pairwise = new PairwiseMatrixGenerator();
	private final FieldMappingEmitter mappingEmitter = new FieldMappingEmitter();
	private final Function<CommandSpec, CommandCodec> codecFactory;

	public CommandSpecGenerator(DeviceCapabilityCatalog catalog, GenerationOptions options) {
		this(catalog, options, TemplateCommandCodec::new);
	}

	public CommandSpecGenerator(DeviceCapabilityCatalog catalog, GenerationOptions options,
			Function<CommandSpec, CommandCodec> codecFactory) {
		Objects.requireNonNull(catalog, "catalog must not be null");
		this.options = options != null ? options : GenerationOptions.defaults();
		this.codecFactory = Objects.requireNonNull(codecFactory, "codecFactory must not be null");
		this.validator = new CommandSpecValidator(catalog);
		this.expander = new BoundaryTestExpander(new ParameterResolver(catalog), new ParameterValidator(), this.options);
	}

	public GenerationResult generate(CommandSpec command) {
		Objects.requireNonNull(command, "command must not be null");
		logger.debug("Generating artifacts for {}", command.name());

		try {
			List<SpecificationDefect> defects = validator.validate(command);
			if (!defects.isEmpty()) {
				logger.debug("Specification of {} has {} defect(s)", command.name(), defects.size());
				return new GenerationResult.Aborted(command.name(), defects, List.of());
			}

			List<ConcreteBoundaryCase> cases = new ArrayList<>();
			List<CoverageGap> gaps = new ArrayList<>();
			for (Parameter parameter : command.parameters().values()) {
				try {
					BoundaryExpansion expansion = expander.expand(command, parameter, command.boundaryTestsFor(parameter.name()));
					cases.addAll(expansion.cases());
					gaps.addAll(expansion.gaps());
				}
				catch (SpecificationDefectException e) {
					defects.addAll(e.defects());
				}
			}
			if (!defects.isEmpty()) {
				throw new SpecificationDefectException(defects);
			}
			if (!gaps.isEmpty()) {
				if (!options.suppressCoverageGaps()) {
					throw new CoverageGapException(gaps);
				}
				gaps.forEach(gap -> logger.warn("Suppressed coverage gap: {}", gap));
			}

			List<Combination> combinations = pairwise.generate(command);
			List<RoundTripResult> roundTrips = new SyntaxRoundTripValidator(codecFactory.apply(command)).verifyAll(command);
			FieldMappingTable mappings = mappingEmitter.emitTable(command);

			logger.debug("{}: {} boundary case(s), {} combination(s), {} round trip(s)",
					command.name(), cases.size(), combinations.size(), roundTrips.size());
			return new GenerationResult.Generated(
					new CommandArtifacts(command.name(), cases, combinations, roundTrips, mappings, gaps));
		}
		catch (SpecificationDefectException e) {
			return new GenerationResult.Aborted(command.name(), e.defects(), List.of());
		}
		catch (CoverageGapException e) {
			return new GenerationResult.Aborted(command.name(), List.of(), e.gaps());
		}
		catch (RuntimeException e) {
			logger.warn("Generation of {} failed", command.name(), e);
			return GenerationResult.Aborted.failed(command.name(), e);
		}
	}

	public GenerationReport generateAll(List<CommandSpec> commands) {
		Objects.requireNonNull(commands, "commands must not be null");
		if (options.parallelism() == 1 || commands.size() < 2) {
			return new GenerationReport(commands.stream().map(this::generate).toList());
		}

		ExecutorService executor = Executors.newFixedThreadPool(Math.min(options.parallelism(), commands.size()));
		try {
			List<Future<GenerationResult>> futures = new ArrayList<>();
			for (CommandSpec command : commands) {
				futures.add(executor.submit(() -> generate(command)));
			}
			List<GenerationResult> results = new ArrayList<>();
			for (Future<GenerationResult> future : futures) {
				results.add(future.get());
			}
			return new GenerationReport(results);
		}
		catch (ExecutionException e) {
			throw new IllegalStateException("Generation failed", e.getCause());
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Generation was interrupted", e);
		}
		finally {
			executor.shutdownNow();
		}
	}
}
