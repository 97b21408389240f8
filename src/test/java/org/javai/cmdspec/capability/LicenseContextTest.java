package org.javai.cmdspec.capability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class LicenseContextTest {

	@Test
	void emptyContextHoldsNothing() {
		assertThat(LicenseContext.none().isEmpty()).isTrue();
		assertThat(LicenseContext.none().holds("YSL-VPN-EX2")).isFalse();
		assertThat(LicenseContext.none().quantity("YSL-VPN-EX2")).isZero();
	}

	@Test
	void zeroQuantitiesAreDropped() {
		LicenseContext context = new LicenseContext(Map.of("YSL-VPN-EX2", 0));

		assertThat(context).isEqualTo(LicenseContext.none());
	}

	@Test
	void negativeQuantitiesAreRejected() {
		assertThatThrownBy(() -> LicenseContext.of("YSL-VPN-EX2", -1))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void withReplacesOneQuantityAndKeepsTheRest() {
		LicenseContext context = LicenseContext.of("YSL-VPN-EX2", 1).with("YSL-VPN-EX3", 2);

		LicenseContext upgraded = context.with("YSL-VPN-EX2", 3);

		assertThat(upgraded.quantity("YSL-VPN-EX2")).isEqualTo(3);
		assertThat(upgraded.quantity("YSL-VPN-EX3")).isEqualTo(2);
		assertThat(context.quantity("YSL-VPN-EX2")).isEqualTo(1);
	}

	@Test
	void contextsWithTheSameQuantitiesAreEqual() {
		LicenseContext a = LicenseContext.of("A", 1).with("B", 2);
		LicenseContext b = LicenseContext.of("B", 2).with("A", 1);

		assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
	}
}
