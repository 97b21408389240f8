package org.javai.cmdspec.syntax;

import java.util.List;

/**
 * One element of a compiled command template.
 */
public sealed interface TemplateToken {

	/** A literal word of the command line. */
	record Keyword(String text) implements TemplateToken {
	}

	/** A {@code <parameter>} slot. */
	record Placeholder(String parameter) implements TemplateToken {
	}

	/** A {@code [ ... ]} group that may be left out as a whole. */
	record OptionalGroup(List<TemplateToken> tokens) implements TemplateToken {
		public OptionalGroup {
			tokens = List.copyOf(tokens);
		}
	}
}
