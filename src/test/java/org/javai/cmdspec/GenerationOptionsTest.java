package org.javai.cmdspec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class GenerationOptionsTest {

	@Test
	void defaultsAbortOnGapsAndRunSequentially() {
		GenerationOptions options = GenerationOptions.defaults();

		assertThat(options.suppressCoverageGaps()).isFalse();
		assertThat(options.outOfSetToken()).isEqualTo("invalid-token");
		assertThat(options.parallelism()).isEqualTo(1);
	}

	@Test
	void builderOverridesEachOption() {
		GenerationOptions options = GenerationOptions.builder()
				.suppressCoverageGaps(true)
				.outOfSetToken("bogus")
				.parallelism(4)
				.build();

		assertThat(options).isEqualTo(new GenerationOptions(true, "bogus", 4));
	}

	@Test
	void rejectsBlankTokenAndNonPositiveParallelism() {
		assertThatThrownBy(() -> GenerationOptions.builder().outOfSetToken(" ").build())
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> GenerationOptions.builder().parallelism(0).build())
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("parallelism");
	}
}
