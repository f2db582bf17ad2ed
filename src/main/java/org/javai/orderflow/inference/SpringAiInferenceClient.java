package org.javai.orderflow.inference;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.orderflow.session.ConversationMessage;
import org.javai.orderflow.session.Stage;
import org.javai.orderflow.tools.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;

/**
 * {@link InferenceClient} backed by a Spring AI {@link ChatClient}.
 *
 * <p>Tools are declared to the model but never executed by Spring AI: internal tool execution is
 * switched off, so requested calls come back in the response. Each stage may use its own model.</p>
 */
public class SpringAiInferenceClient implements InferenceClient {

	private static final Logger logger = LoggerFactory.getLogger(SpringAiInferenceClient.class);

	private final ChatClient chatClient;
	private final Map<Stage, String> stageModels;

	/**
	 * @param chatClient client built on the configured chat model
	 * @param stageModels model id per stage; stages without an entry use the chat model's default
	 */
	public SpringAiInferenceClient(ChatClient chatClient, Map<Stage, String> stageModels) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.stageModels = stageModels == null || stageModels.isEmpty()
				? Map.of()
				: new EnumMap<>(stageModels);
	}

	@Override
	public InferenceResponse infer(InferenceRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		ToolCallingChatOptions.Builder options = ToolCallingChatOptions.builder()
				.toolCallbacks(callbacks(request))
				.internalToolExecutionEnabled(false);
		String model = stageModels.get(request.stage());
		if (model != null) {
			options.model(model);
		}

		logger.debug("Session {} calling model {} for stage {} with {} messages and {} tool rounds",
				request.sessionId(), model == null ? "<default>" : model, request.stage().wireName(),
				request.messages().size(), request.rounds().size());

		ChatResponse response = chatClient.prompt()
				.system(request.instructions())
				.messages(toMessages(request))
				.options(options.build())
				.call()
				.chatResponse();
		return fromResponse(response);
	}

	static List<Message> toMessages(InferenceRequest request) {
		List<Message> messages = new ArrayList<>();
		for (ConversationMessage message : request.messages()) {
			messages.add(switch (message.role()) {
				case CONTEXT -> new SystemMessage(message.text());
				case USER -> new UserMessage(message.text());
				case ASSISTANT -> new AssistantMessage(message.text());
			});
		}
		for (ToolRound round : request.rounds()) {
			List<AssistantMessage.ToolCall> calls = round.calls().stream()
					.map(call -> new AssistantMessage.ToolCall(call.id(), "function", call.name(), call.arguments()))
					.toList();
			messages.add(new AssistantMessage(round.assistantText(), Map.of(), calls));
			List<ToolResponseMessage.ToolResponse> replies = round.replies().stream()
					.map(reply -> new ToolResponseMessage.ToolResponse(reply.callId(), reply.toolName(), reply.content()))
					.toList();
			messages.add(new ToolResponseMessage(replies));
		}
		return messages;
	}

	static InferenceResponse fromResponse(ChatResponse response) {
		if (response == null || response.getResults() == null || response.getResults().isEmpty()) {
			return InferenceResponse.text("");
		}
		StringBuilder text = new StringBuilder();
		List<ToolCall> calls = new ArrayList<>();
		for (Generation generation : response.getResults()) {
			AssistantMessage output = generation.getOutput();
			if (output == null) {
				continue;
			}
			if (output.getText() != null && !output.getText().isBlank()) {
				if (!text.isEmpty()) {
					text.append('\n');
				}
				text.append(output.getText());
			}
			if (output.hasToolCalls()) {
				for (AssistantMessage.ToolCall call : output.getToolCalls()) {
					calls.add(new ToolCall(call.id(), call.name(), call.arguments()));
				}
			}
		}
		return new InferenceResponse(text.toString(), calls);
	}

	private static List<ToolCallback> callbacks(InferenceRequest request) {
		return request.tools().stream().<ToolCallback>map(DeclaredToolCallback::new).toList();
	}
}
