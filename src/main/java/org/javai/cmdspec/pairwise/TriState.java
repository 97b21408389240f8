package org.javai.cmdspec.pairwise;

/**
 * Truth value of an expression over a partial assignment.
 */
public enum TriState {
	TRUE,
	FALSE,
	UNKNOWN;

	public TriState and(TriState other) {
		if (this == FALSE || other == FALSE) {
			return FALSE;
		}
		if (this == UNKNOWN || other == UNKNOWN) {
			return UNKNOWN;
		}
		return TRUE;
	}
}
