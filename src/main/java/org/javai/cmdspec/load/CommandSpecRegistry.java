package org.javai.cmdspec.load;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.javai.cmdspec.SpecLoadException;
import org.javai.cmdspec.model.CommandSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry for command specifications.
 *
 * Loads specifications from the classpath or the filesystem once and gives
 * access to them by command name. Registrations are idempotent per command name.
 */
public final class CommandSpecRegistry {

	private static final Logger logger = LoggerFactory.getLogger(CommandSpecRegistry.class);

	private final Map<String, CommandSpec> specs = new LinkedHashMap<>();
	private final CommandSpecParser parser;

	private CommandSpecRegistry(CommandSpecParser parser) {
		this.parser = parser;
	}

	/**
	 * Create an empty registry backed by a fresh parser.
	 */
	public static CommandSpecRegistry create() {
		return new CommandSpecRegistry(new CommandSpecParser());
	}

	/**
	 * Register a specification directly. If one with the same command name is
	 * already present, the existing one is kept and returned.
	 */
	public CommandSpec register(CommandSpec spec) {
		Objects.requireNonNull(spec, "spec must not be null");
		CommandSpec existing = specs.get(spec.name());
		if (existing != null) {
			logger.debug("Command spec '{}' already registered; skipping", spec.name());
			return existing;
		}
		specs.put(spec.name(), spec);
		return spec;
	}

	/**
	 * Load a specification from a classpath resource using this class' loader.
	 */
	public CommandSpec registerResource(String resourcePath) {
		return registerResource(resourcePath, CommandSpecRegistry.class.getClassLoader());
	}

	/**
	 * Load and register a specification from a classpath resource.
	 *
	 * @throws IllegalArgumentException if the resource cannot be found
	 * @throws SpecLoadException if parsing fails
	 */
	public CommandSpec registerResource(String resourcePath, ClassLoader loader) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		Objects.requireNonNull(loader, "loader must not be null");
		try (InputStream is = loader.getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new IllegalArgumentException("Resource not found: " + resourcePath);
			}
			return register(parser.parse(is));
		} catch (IOException e) {
			throw new SpecLoadException("Failed to read command spec resource: " + resourcePath, e);
		}
	}

	/**
	 * Load and register a specification from a filesystem path.
	 *
	 * @throws SpecLoadException if parsing fails
	 */
	public CommandSpec registerPath(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		return register(parser.parse(path));
	}

	/**
	 * Register every {@code .yaml}/{@code .yml} file directly under a directory, in
	 * file name order. Files that fail to parse are skipped with a warning.
	 */
	public CommandSpecRegistry registerDirectory(Path directory) {
		Objects.requireNonNull(directory, "directory must not be null");
		if (!Files.isDirectory(directory)) {
			throw new IllegalArgumentException("Not a directory: " + directory);
		}
		try (Stream<Path> files = Files.list(directory)) {
			files.filter(Files::isRegularFile)
					.filter(p -> {
						String name = p.getFileName().toString();
						return name.endsWith(".yaml") || name.endsWith(".yml");
					})
					.sorted()
					.forEach(p -> {
						try {
							registerPath(p);
						}
						catch (SpecLoadException ex) {
							logger.warn("Failed to load command spec from {}", p, ex);
						}
					});
		}
		catch (IOException e) {
			throw new SpecLoadException("Failed to scan directory: " + directory, e);
		}
		return this;
	}

	/**
	 * Bulk register specifications from resource paths using the provided loader.
	 */
	public CommandSpecRegistry registerResources(List<String> resourcePaths, ClassLoader loader) {
		if (resourcePaths == null) {
			return this;
		}
		for (String path : resourcePaths) {
			if (path != null) {
				registerResource(path, loader);
			}
		}
		return this;
	}

	public Optional<CommandSpec> specFor(String commandName) {
		return Optional.ofNullable(specs.get(commandName));
	}

	/**
	 * Retrieve a specification by command name or throw if not present.
	 */
	public CommandSpec requireSpec(String commandName) {
		return specFor(commandName)
				.orElseThrow(() -> new IllegalStateException("No command spec registered for: " + commandName));
	}

	/**
	 * All registered specifications in insertion order.
	 */
	public List<CommandSpec> specs() {
		return List.copyOf(specs.values());
	}
}
