package org.javai.cmdspec;

/**
 * Options that steer artifact generation.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * GenerationOptions options = GenerationOptions.builder()
 *         .suppressCoverageGaps(true)
 *         .parallelism(4)
 *         .build();
 * }</pre>
 *
 * @param suppressCoverageGaps when true, coverage gaps are logged instead of aborting the command
 * @param outOfSetToken token used as the invalid out-of-set case for enum parameters
 * @param parallelism number of worker threads used to generate independent commands
 */
public record GenerationOptions(
		boolean suppressCoverageGaps,
		String outOfSetToken,
		int parallelism
) {

	public static final String DEFAULT_OUT_OF_SET_TOKEN = "invalid-token";

	public GenerationOptions {
		if (outOfSetToken == null || outOfSetToken.isBlank()) {
			throw new IllegalArgumentException("outOfSetToken must not be blank");
		}
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1");
		}
	}

	public static GenerationOptions defaults() {
		return new GenerationOptions(false, DEFAULT_OUT_OF_SET_TOKEN, 1);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link GenerationOptions}.
	 */
	public static class Builder {
		private boolean suppressCoverageGaps;
		private String outOfSetToken = DEFAULT_OUT_OF_SET_TOKEN;
		private int parallelism = 1;

		private Builder() {}

		public Builder suppressCoverageGaps(boolean suppressCoverageGaps) {
			this.suppressCoverageGaps = suppressCoverageGaps;
			return this;
		}

		public Builder outOfSetToken(String outOfSetToken) {
			this.outOfSetToken = outOfSetToken;
			return this;
		}

		public Builder parallelism(int parallelism) {
			this.parallelism = parallelism;
			return this;
		}

		public GenerationOptions build() {
			return new GenerationOptions(suppressCoverageGaps, outOfSetToken, parallelism);
		}
	}
}
