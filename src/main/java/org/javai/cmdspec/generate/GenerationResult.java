package org.javai.cmdspec.generate;

import java.util.List;
import org.javai.cmdspec.CoverageGap;
import org.javai.cmdspec.SpecificationDefect;

/**
 * Outcome of generating the artifacts of one command.
 */
public sealed interface GenerationResult {

	String command();

	record Generated(CommandArtifacts artifacts) implements GenerationResult {
		@Override
		public String command() {
			return artifacts.command();
		}
	}

	/**
	 * Generation stopped because the specification is defective, has
	 * unsuppressed coverage gaps or made a generator fail. Nothing partial is
	 * returned.
	 *
	 * @param error description of an unexpected generator failure, null otherwise
	 */
	record Aborted(String command, List<SpecificationDefect> defects, List<CoverageGap> gaps, String error)
			implements GenerationResult {
		public Aborted {
			defects = defects != null ? List.copyOf(defects) : List.of();
			gaps = gaps != null ? List.copyOf(gaps) : List.of();
		}

		public Aborted(String command, List<SpecificationDefect> defects, List<CoverageGap> gaps) {
			this(command, defects, gaps, null);
		}

		public static Aborted failed(String command, RuntimeException cause) {
			return new Aborted(command, List.of(), List.of(), cause.toString());
		}
	}
}
