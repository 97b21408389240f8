package org.javai.cmdspec.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A syntax form compiled into keywords, placeholders and optional groups,
 * e.g. {@code ipsec ike keepalive use <gateway_id> on dpd <interval> [<retry>]}.
 */
public record CommandTemplate(String source, List<TemplateToken> tokens) {

	public CommandTemplate {
		tokens = List.copyOf(tokens);
	}

	/**
	 * @throws IllegalArgumentException when brackets are unbalanced or a placeholder is empty
	 */
	public static CommandTemplate compile(String source) {
		if (source == null || source.isBlank()) {
			throw new IllegalArgumentException("Template must not be blank");
		}
		String padded = source.replace("[", " [ ").replace("]", " ] ").trim();
		Deque<List<TemplateToken>> stack = new ArrayDeque<>();
		stack.push(new ArrayList<>());
		for (String word : padded.split("\\s+")) {
			if (word.equals("[")) {
				stack.push(new ArrayList<>());
			}
			else if (word.equals("]")) {
				if (stack.size() == 1) {
					throw new IllegalArgumentException("Unbalanced ']' in template: " + source);
				}
				List<TemplateToken> group = stack.pop();
				stack.peek().add(new TemplateToken.OptionalGroup(group));
			}
			else if (word.startsWith("<") && word.endsWith(">")) {
				String name = word.substring(1, word.length() - 1).trim();
				if (name.isEmpty()) {
					throw new IllegalArgumentException("Empty placeholder in template: " + source);
				}
				stack.peek().add(new TemplateToken.Placeholder(name));
			}
			else if (word.contains("<") || word.contains(">")) {
				throw new IllegalArgumentException("Malformed placeholder '" + word + "' in template: " + source);
			}
			else {
				stack.peek().add(new TemplateToken.Keyword(word));
			}
		}
		if (stack.size() != 1) {
			throw new IllegalArgumentException("Unclosed '[' in template: " + source);
		}
		return new CommandTemplate(source, stack.pop());
	}

	/**
	 * Parameter names in order of first appearance, including those inside optional groups.
	 */
	public Set<String> placeholders() {
		Set<String> names = new LinkedHashSet<>();
		collect(tokens, names);
		return names;
	}

	static void collect(List<TemplateToken> tokens, Set<String> names) {
		for (TemplateToken token : tokens) {
			if (token instanceof TemplateToken.Placeholder placeholder) {
				names.add(placeholder.parameter());
			}
			else if (token instanceof TemplateToken.OptionalGroup group) {
				collect(group.tokens(), names);
			}
		}
	}
}
