package org.javai.cmdspec;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when coverage gaps block generation and have not been suppressed.
 */
public class CoverageGapException extends RuntimeException {

	private final List<CoverageGap> gaps;

	public CoverageGapException(List<CoverageGap> gaps) {
		super(gaps.stream().map(CoverageGap::toString).collect(Collectors.joining("; ")));
		this.gaps = List.copyOf(gaps);
	}

	public List<CoverageGap> gaps() {
		return gaps;
	}
}
