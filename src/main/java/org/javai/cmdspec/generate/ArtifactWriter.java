package org.javai.cmdspec.generate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.javai.cmdspec.boundary.ConcreteBoundaryCase;
import org.javai.cmdspec.mapping.FieldMappingJsonEmitter;
import org.javai.cmdspec.model.Values;
import org.javai.cmdspec.pairwise.Combination;
import org.javai.cmdspec.syntax.RoundTripResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one JSON document per generated command, for diffing against
 * committed golden files.
 */
public class ArtifactWriter {

	private static final Logger logger = LoggerFactory.getLogger(ArtifactWriter.class);

	private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

	/**
	 * Write the artifacts of every generated command of a report.
	 *
	 * @return the files written, in report order
	 */
	public List<Path> writeAll(GenerationReport report, Path directory) throws IOException {
		List<Path> written = new ArrayList<>();
		for (CommandArtifacts artifacts : report.generated()) {
			written.add(write(artifacts, directory));
		}
		return written;
	}

	public Path write(CommandArtifacts artifacts, Path directory) throws IOException {
		Files.createDirectories(directory);
		Path file = directory.resolve(fileName(artifacts.command()));
		Files.writeString(file, mapper.writeValueAsString(toJson(artifacts)) + System.lineSeparator(), StandardCharsets.UTF_8);
		logger.debug("Wrote {}", file);
		return file;
	}

	/**
	 * {@code ipsec ike encryption} becomes {@code ipsec-ike-encryption.json}.
	 */
	public static String fileName(String command) {
		String slug = command.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
		return slug + ".json";
	}

	public ObjectNode toJson(CommandArtifacts artifacts) {
		ObjectNode root = mapper.createObjectNode();
		root.put("command", artifacts.command());

		ArrayNode boundaries = root.putArray("boundaryCases");
		for (ConcreteBoundaryCase boundaryCase : artifacts.boundaryCases()) {
			ObjectNode node = boundaries.addObject();
			node.put("parameter", boundaryCase.parameter());
			node.put("value", boundaryCase.valueToken());
			node.put("valid", boundaryCase.expectedValid());
			if (boundaryCase.model() != null) {
				node.put("model", boundaryCase.model());
			}
			if (!boundaryCase.license().isEmpty()) {
				ObjectNode license = node.putObject("license");
				boundaryCase.license().quantities().forEach((sku, quantity) -> license.put(sku, quantity.intValue()));
			}
			node.put("origin", boundaryCase.origin().name().toLowerCase(Locale.ROOT));
			if (boundaryCase.description() != null) {
				node.put("description", boundaryCase.description());
			}
			if (boundaryCase.errorContains() != null) {
				node.put("errorContains", boundaryCase.errorContains());
			}
		}

		ArrayNode combinations = root.putArray("combinations");
		for (Combination combination : artifacts.combinations()) {
			ObjectNode node = combinations.addObject();
			ObjectNode values = node.putObject("values");
			combination.values().forEach((name, value) -> values.put(name, Values.token(value)));
			ArrayNode models = node.putArray("models");
			combination.models().forEach(models::add);
			node.put("otherModels", combination.otherModels());
		}

		ArrayNode roundTrips = root.putArray("roundTrips");
		for (RoundTripResult result : artifacts.roundTrips()) {
			ObjectNode node = roundTrips.addObject();
			node.put("test", result.test().name());
			if (result.model() != null) {
				node.put("model", result.model());
			}
			if (result instanceof RoundTripResult.Passed) {
				node.put("status", "passed");
			}
			else if (result instanceof RoundTripResult.Skipped skipped) {
				node.put("status", "skipped");
				node.put("reason", skipped.reason());
			}
			else if (result instanceof RoundTripResult.Failed failed) {
				node.put("status", "failed");
				ArrayNode failures = node.putArray("failures");
				failed.failures().forEach(f -> {
					ObjectNode failure = failures.addObject();
					failure.put("direction", f.direction().name().toLowerCase(Locale.ROOT));
					failure.put("expected", f.expected());
					failure.put("actual", f.actual());
				});
			}
		}

		root.set("fieldMappings", FieldMappingJsonEmitter.emit(artifacts.fieldMappings()));

		ArrayNode gaps = root.putArray("suppressedGaps");
		artifacts.suppressedGaps().forEach(gap -> gaps.add(gap.toString()));
		return root;
	}
}
