package org.javai.cmdspec;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when generation for a command cannot proceed because its
 * specification is defective. Carries every defect found, not just the first.
 */
public class SpecificationDefectException extends RuntimeException {

	private final List<SpecificationDefect> defects;

	public SpecificationDefectException(SpecificationDefect defect) {
		this(List.of(defect));
	}

	public SpecificationDefectException(List<SpecificationDefect> defects) {
		super(describe(defects));
		this.defects = List.copyOf(defects);
	}

	public List<SpecificationDefect> defects() {
		return defects;
	}

	private static String describe(List<SpecificationDefect> defects) {
		if (defects == null || defects.isEmpty()) {
			throw new IllegalArgumentException("At least one defect is required");
		}
		return defects.stream().map(SpecificationDefect::toString).collect(Collectors.joining("; "));
	}
}
