package org.javai.cmdspec.generate;

import java.util.List;
import org.javai.cmdspec.CoverageGap;
import org.javai.cmdspec.boundary.ConcreteBoundaryCase;
import org.javai.cmdspec.mapping.FieldMappingTable;
import org.javai.cmdspec.pairwise.Combination;
import org.javai.cmdspec.syntax.RoundTripResult;

/**
 * Everything generated for one command.
 *
 * @param command command name
 * @param boundaryCases boundary cases of every parameter, in parameter order
 * @param combinations pairwise matrix, empty when pairwise generation is off
 * @param roundTrips outcome of every syntax test
 * @param fieldMappings target schema mapping
 * @param suppressedGaps coverage gaps that were logged instead of aborting
 */
public record CommandArtifacts(
		String command,
		List<ConcreteBoundaryCase> boundaryCases,
		List<Combination> combinations,
		List<RoundTripResult> roundTrips,
		FieldMappingTable fieldMappings,
		List<CoverageGap> suppressedGaps
) {

	public CommandArtifacts {
		boundaryCases = boundaryCases != null ? List.copyOf(boundaryCases) : List.of();
		combinations = combinations != null ? List.copyOf(combinations) : List.of();
		roundTrips = roundTrips != null ? List.copyOf(roundTrips) : List.of();
		suppressedGaps = suppressedGaps != null ? List.copyOf(suppressedGaps) : List.of();
	}

	public List<RoundTripResult.Failed> failedRoundTrips() {
		return roundTrips.stream()
				.filter(RoundTripResult.Failed.class::isInstance)
				.map(RoundTripResult.Failed.class::cast)
				.toList();
	}
}
