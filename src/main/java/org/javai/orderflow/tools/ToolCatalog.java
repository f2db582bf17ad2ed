package org.javai.orderflow.tools;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.javai.orderflow.session.Stage;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.util.json.schema.JsonSchemaGenerator;

/**
 * Spring AI tool definitions for each stage, generated once from the argument records.
 */
public class ToolCatalog {

	private final Map<ToolName, ToolDefinition> definitions = new EnumMap<>(ToolName.class);

	public ToolCatalog() {
		for (ToolName tool : ToolName.values()) {
			definitions.put(tool, ToolDefinition.builder()
					.name(tool.wireName())
					.description(tool.description())
					.inputSchema(JsonSchemaGenerator.generateForType(tool.argumentType()))
					.build());
		}
	}

	public ToolDefinition definition(ToolName tool) {
		return definitions.get(tool);
	}

	/**
	 * Definitions of the tools the stage may call, in declaration order.
	 */
	public List<ToolDefinition> forStage(Stage stage) {
		return ToolName.surfaceOf(stage).stream().map(definitions::get).toList();
	}
}
