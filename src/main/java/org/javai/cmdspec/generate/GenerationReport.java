package org.javai.cmdspec.generate;

import java.util.List;

/**
 * Results of a generation run, one per command, in input order.
 */
public record GenerationReport(List<GenerationResult> results) {

	public GenerationReport {
		results = results != null ? List.copyOf(results) : List.of();
	}

	public List<CommandArtifacts> generated() {
		return results.stream()
				.filter(GenerationResult.Generated.class::isInstance)
				.map(r -> ((GenerationResult.Generated) r).artifacts())
				.toList();
	}

	public List<GenerationResult.Aborted> aborted() {
		return results.stream()
				.filter(GenerationResult.Aborted.class::isInstance)
				.map(GenerationResult.Aborted.class::cast)
				.toList();
	}

	public boolean isComplete() {
		return aborted().isEmpty();
	}
}
