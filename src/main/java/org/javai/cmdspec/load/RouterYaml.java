package org.javai.cmdspec.load;

import java.util.regex.Pattern;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * SnakeYAML configured for router specifications. YAML 1.1 would read the
 * router's {@code on}/{@code off}/{@code yes}/{@code no} keywords as booleans;
 * here only {@code true}/{@code false} are booleans and the switch keywords
 * stay strings.
 */
public final class RouterYaml {

	private RouterYaml() {}

	public static Yaml create() {
		LoaderOptions loaderOptions = new LoaderOptions();
		DumperOptions dumperOptions = new DumperOptions();
		return new Yaml(new Constructor(loaderOptions), new Representer(dumperOptions), dumperOptions,
				loaderOptions, new SwitchKeywordResolver());
	}

	static final class SwitchKeywordResolver extends Resolver {

		private static final Pattern STRICT_BOOL = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");

		@Override
		protected void addImplicitResolvers() {
			addImplicitResolver(Tag.BOOL, STRICT_BOOL, "tTfF");
			addImplicitResolver(Tag.INT, INT, "-+0123456789");
			addImplicitResolver(Tag.FLOAT, FLOAT, "-+0123456789.");
			addImplicitResolver(Tag.MERGE, MERGE, "<");
			addImplicitResolver(Tag.NULL, NULL, "~nN\0");
			addImplicitResolver(Tag.NULL, EMPTY, null);
		}
	}
}
