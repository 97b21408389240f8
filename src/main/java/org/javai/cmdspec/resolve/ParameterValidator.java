package org.javai.cmdspec.resolve;

import java.util.List;
import java.util.regex.Pattern;
import org.javai.cmdspec.model.EnumValue;
import org.javai.cmdspec.model.IntRange;
import org.javai.cmdspec.model.ParamType;
import org.javai.cmdspec.model.Values;
import org.javai.cmdspec.model.Variant;

/**
 * Validates input values against an {@link EffectiveDomain}.
 *
 * <p>Enum members and variants are tried first. A parameter that declares
 * either accepts nothing else. Otherwise the value is checked against the
 * semantic type, the range (string length for strings) and the pattern.
 */
public class ParameterValidator {

	private static final Pattern HEX = Pattern.compile("(0x)?[0-9a-fA-F]+");
	private static final Pattern IPV6 = Pattern.compile("[0-9a-fA-F:]+");

	public ValidationResult validate(EffectiveDomain domain, Object value) {
		String token = Values.token(value);
		if (token == null || token.isEmpty()) {
			return domain.parameter().required()
					? ValidationResult.invalid("value is required")
					: ValidationResult.valid();
		}

		List<EnumValue> enumValues = domain.enumValues();
		List<Variant> variants = domain.variants();
		if (enumValues.stream().anyMatch(v -> v.value().equals(token))) {
			return ValidationResult.valid();
		}
		for (Variant variant : variants) {
			if (matchesVariant(domain, variant, token)) {
				return ValidationResult.valid();
			}
		}
		if (!enumValues.isEmpty() || !variants.isEmpty()) {
			return ValidationResult.invalid("'" + token + "' is not one of the allowed values of " + domain.parameter().name());
		}

		String reason = checkScalar(domain.type(), domain.pattern(), domain.range(), token);
		return reason == null ? ValidationResult.valid() : ValidationResult.invalid(reason);
	}

	private boolean matchesVariant(EffectiveDomain domain, Variant variant, String token) {
		String rest = token;
		if (!variant.keywordTokens().isEmpty()) {
			String keyword = String.join(" ", variant.keywordTokens());
			if (token.equals(keyword)) {
				return variant.valueArity(domain.parameter().fieldBinding()) == 0;
			}
			if (!token.startsWith(keyword + " ")) {
				return false;
			}
			rest = token.substring(keyword.length()).trim();
		}
		int arity = variant.valueArity(domain.parameter().fieldBinding());
		if (arity == 0) {
			return false;
		}
		String[] parts = rest.split("\\s+");
		if (arity > 1) {
			return parts.length == arity;
		}
		if (parts.length != 1) {
			return false;
		}
		return checkScalar(variant.effectiveType(domain.type()), variant.pattern(), variant.range(), rest) == null;
	}

	/**
	 * @return the reason the token is invalid, or {@code null} when it is valid
	 */
	private String checkScalar(ParamType type, String pattern, IntRange range, String token) {
		if (pattern != null && !token.matches(pattern)) {
			return "'" + token + "' does not match pattern " + pattern;
		}
		switch (type) {
			case INT -> {
				long number;
				try {
					number = Long.parseLong(token);
				}
				catch (NumberFormatException e) {
					return "'" + token + "' is not an integer";
				}
				if (range != null && !range.contains(number)) {
					return number + " is outside " + range;
				}
			}
			case SWITCH -> {
				if (!token.equals("on") && !token.equals("off")) {
					return "'" + token + "' is not on or off";
				}
			}
			case IP_ADDRESS -> {
				if (!isIpAddress(token)) {
					return "'" + token + "' is not an IP address";
				}
			}
			case IP_RANGE -> {
				if (!isIpRange(token)) {
					return "'" + token + "' is not an address range";
				}
			}
			case HEX -> {
				if (!HEX.matcher(token).matches()) {
					return "'" + token + "' is not hexadecimal";
				}
			}
			default -> {
				if (range != null && !range.contains(token.length())) {
					return "length " + token.length() + " of '" + token + "' is outside " + range;
				}
			}
		}
		return null;
	}

	private boolean isIpAddress(String token) {
		if (token.contains(":")) {
			return IPV6.matcher(token).matches() && token.chars().filter(c -> c == ':').count() >= 2;
		}
		String[] octets = token.split("\\.", -1);
		if (octets.length != 4) {
			return false;
		}
		for (String octet : octets) {
			if (octet.isEmpty() || octet.length() > 3 || !octet.chars().allMatch(Character::isDigit)) {
				return false;
			}
			if (Integer.parseInt(octet) > 255) {
				return false;
			}
		}
		return true;
	}

	private boolean isIpRange(String token) {
		int slash = token.indexOf('/');
		if (slash > 0) {
			String address = token.substring(0, slash);
			String prefix = token.substring(slash + 1);
			if (!isIpAddress(address) || prefix.isEmpty() || !prefix.chars().allMatch(Character::isDigit) || prefix.length() > 3) {
				return false;
			}
			int maxPrefix = address.contains(":") ? 128 : 32;
			return Integer.parseInt(prefix) <= maxPrefix;
		}
		int dash = token.indexOf('-');
		if (dash > 0) {
			return isIpAddress(token.substring(0, dash)) && isIpAddress(token.substring(dash + 1));
		}
		return false;
	}
}
