package org.javai.cmdspec.capability;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * License SKUs held by a device and their quantities, e.g. {@code YSL-VPN-EX2 x2}.
 */
public record LicenseContext(Map<String, Integer> quantities) {

	private static final LicenseContext NONE = new LicenseContext(Map.of());

	public LicenseContext {
		TreeMap<String, Integer> sorted = new TreeMap<>();
		if (quantities != null) {
			quantities.forEach((sku, quantity) -> {
				if (quantity == null || quantity < 0) {
					throw new IllegalArgumentException("License quantity for " + sku + " must be non-negative");
				}
				if (quantity > 0) {
					sorted.put(sku, quantity);
				}
			});
		}
		quantities = Collections.unmodifiableMap(sorted);
	}

	public static LicenseContext none() {
		return NONE;
	}

	public static LicenseContext of(String sku, int quantity) {
		return new LicenseContext(Map.of(sku, quantity));
	}

	public int quantity(String sku) {
		return quantities.getOrDefault(sku, 0);
	}

	public boolean holds(String sku) {
		return quantity(sku) > 0;
	}

	public boolean isEmpty() {
		return quantities.isEmpty();
	}

	/**
	 * A copy of this context with the quantity of one SKU replaced.
	 */
	public LicenseContext with(String sku, int quantity) {
		TreeMap<String, Integer> copy = new TreeMap<>(quantities);
		copy.put(sku, quantity);
		return new LicenseContext(copy);
	}

	@Override
	public String toString() {
		return quantities.isEmpty() ? "{}" : quantities.toString();
	}
}
