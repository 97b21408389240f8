package org.javai.cmdspec.boundary;

import java.util.List;
import java.util.Objects;
import org.javai.cmdspec.CoverageGap;
import org.javai.cmdspec.capability.LicenseContext;

/**
 * Boundary cases derived for one parameter, with any coverage gaps found on the way.
 */
public record BoundaryExpansion(String parameter, List<ConcreteBoundaryCase> cases, List<CoverageGap> gaps) {

	public BoundaryExpansion {
		cases = cases != null ? List.copyOf(cases) : List.of();
		gaps = gaps != null ? List.copyOf(gaps) : List.of();
	}

	public boolean hasGaps() {
		return !gaps.isEmpty();
	}

	public List<ConcreteBoundaryCase> casesFor(String model) {
		return cases.stream().filter(c -> Objects.equals(c.model(), model)).toList();
	}

	public List<ConcreteBoundaryCase> casesUnder(LicenseContext license) {
		return cases.stream().filter(c -> c.license().equals(license)).toList();
	}
}
