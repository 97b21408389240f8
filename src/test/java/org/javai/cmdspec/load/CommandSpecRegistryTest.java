package org.javai.cmdspec.load;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.cmdspec.SpecLoadException;
import org.javai.cmdspec.model.CommandSpec;
import org.javai.cmdspec.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CommandSpecRegistryTest {

	private static final String ENCRYPTION = "specs/ipsec-ike-encryption.yaml";
	private static final String KEEPALIVE = "specs/ipsec-ike-keepalive-use.yaml";

	@Test
	void registersFromResourceAndRetrievesByCommandName() {
		CommandSpecRegistry registry = CommandSpecRegistry.create();

		CommandSpec spec = registry.registerResource(ENCRYPTION);

		assertThat(registry.specFor("ipsec ike encryption")).contains(spec);
		assertThat(registry.requireSpec("ipsec ike encryption")).isSameAs(spec);
	}

	@Test
	void registeringTheSameCommandTwiceKeepsTheFirst() {
		CommandSpecRegistry registry = CommandSpecRegistry.create();

		CommandSpec first = registry.registerResource(ENCRYPTION);
		CommandSpec second = registry.registerResource(ENCRYPTION);

		assertThat(second).isSameAs(first);
		assertThat(registry.specs()).hasSize(1);
	}

	@Test
	void registersBulkResourcesInOrder() {
		CommandSpecRegistry registry = CommandSpecRegistry.create()
				.registerResources(List.of(KEEPALIVE, ENCRYPTION), getClass().getClassLoader());

		assertThat(registry.specs()).extracting(CommandSpec::name)
				.containsExactly("ipsec ike keepalive use", "ipsec ike encryption");
	}

	@Test
	void missingResourceIsRejected() {
		CommandSpecRegistry registry = CommandSpecRegistry.create();

		assertThatThrownBy(() -> registry.registerResource("specs/no-such-command.yaml"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Resource not found");
	}

	@Test
	void requireSpecFailsForUnknownCommand() {
		CommandSpecRegistry registry = CommandSpecRegistry.create();

		assertThat(registry.specFor("ip route")).isEmpty();
		assertThatThrownBy(() -> registry.requireSpec("ip route"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("ip route");
	}

	@Test
	void registerPathReportsTheFileOnParseFailure(@TempDir Path dir) throws Exception {
		Path broken = dir.resolve("broken.yaml");
		Files.writeString(broken, "command:\n  description: no name\n");

		assertThatThrownBy(() -> CommandSpecRegistry.create().registerPath(broken))
				.isInstanceOf(SpecLoadException.class)
				.hasMessageContaining("broken.yaml");
	}

	@Test
	void registerDirectoryLoadsYamlFilesAndSkipsBrokenOnes(@TempDir Path dir) throws Exception {
		Files.writeString(dir.resolve("b-route.yml"), "command:\n  name: ip route\n");
		Files.writeString(dir.resolve("a-filter.yaml"), "command:\n  name: ip filter\n");
		Files.writeString(dir.resolve("c-broken.yaml"), "command:\n  description: no name\n");
		Files.writeString(dir.resolve("notes.txt"), "not a spec");

		CommandSpecRegistry registry = CommandSpecRegistry.create();
		try (LogCaptorAppender appender = LogCaptorAppender.create(CommandSpecRegistry.class, Level.WARN)) {
			registry.registerDirectory(dir);

			assertThat(appender.messagesAt(Level.WARN)).singleElement()
					.satisfies(msg -> assertThat(msg).contains("c-broken.yaml"));
		}

		assertThat(registry.specs()).extracting(CommandSpec::name)
				.containsExactly("ip filter", "ip route");
	}

	@Test
	void registerDirectoryRejectsAFile(@TempDir Path dir) throws Exception {
		Path file = Files.writeString(dir.resolve("single.yaml"), "command:\n  name: ip route\n");

		assertThatThrownBy(() -> CommandSpecRegistry.create().registerDirectory(file))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Not a directory");
	}
}
