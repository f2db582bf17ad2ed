package org.javai.orderflow.context;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.javai.orderflow.session.Stage;

/**
 * Loads stage instructions from {@code /prompts/<stage>.txt} on the classpath.
 *
 * <p>Placeholders of the form <code>{{name}}</code> are replaced from the supplied variables
 * when the templates are loaded. Constraints are appended per call.</p>
 */
public class ClasspathStageInstructions implements StageInstructions {

	private final Map<Stage, String> templates = new EnumMap<>(Stage.class);

	public ClasspathStageInstructions(Map<String, String> variables) {
		this("/prompts/", variables);
	}

	public ClasspathStageInstructions(String basePath, Map<String, String> variables) {
		for (Stage stage : Stage.values()) {
			if (stage.isTerminal()) {
				continue;
			}
			String text = read(basePath + stage.wireName() + ".txt");
			for (Map.Entry<String, String> variable : variables.entrySet()) {
				text = text.replace("{{" + variable.getKey() + "}}", variable.getValue());
			}
			templates.put(stage, text.strip());
		}
	}

	@Override
	public String instructionsFor(Stage stage, List<String> constraints) {
		String base = templates.getOrDefault(stage, "");
		if (constraints.isEmpty()) {
			return base;
		}
		StringBuilder sb = new StringBuilder(base);
		sb.append("\n\nCustomer constraints (always respect these):");
		constraints.forEach(constraint -> sb.append("\n- ").append(constraint));
		return sb.toString();
	}

	private static String read(String resource) {
		try (InputStream in = ClasspathStageInstructions.class.getResourceAsStream(resource)) {
			if (in == null) {
				throw new IllegalStateException("Missing stage instructions resource " + resource);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + resource, e);
		}
	}
}
