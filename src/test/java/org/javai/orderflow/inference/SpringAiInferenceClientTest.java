package org.javai.orderflow.inference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import org.javai.orderflow.session.ConversationMessage;
import org.javai.orderflow.session.Stage;
import org.javai.orderflow.tools.ToolCall;
import org.javai.orderflow.tools.ToolCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.model.tool.ToolCallingChatOptions;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SpringAiInferenceClientTest {

	@Mock
	private ChatClient chatClient;

	@Mock
	private ChatClient.ChatClientRequestSpec requestSpec;

	@Mock
	private ChatClient.CallResponseSpec callSpec;

	@Test
	void messagesKeepRolesAndReplayToolRounds() {
		ToolCall call = new ToolCall("call_1", "search_menu", "{\"query\":\"كبسة\"}");
		InferenceRequest request = request(Stage.ORDERING)
				.withRound(new ToolRound("", List.of(call), List.of(new ToolReply("call_1", "search_menu", "{\"success\":true}"))));

		List<Message> messages = SpringAiInferenceClient.toMessages(request);

		assertThat(messages).extracting(Message::getMessageType).containsExactly(
				MessageType.SYSTEM, MessageType.USER, MessageType.ASSISTANT, MessageType.ASSISTANT, MessageType.TOOL);
		AssistantMessage issued = (AssistantMessage) messages.get(3);
		assertThat(issued.getToolCalls()).singleElement().satisfies(toolCall -> {
			assertThat(toolCall.id()).isEqualTo("call_1");
			assertThat(toolCall.name()).isEqualTo("search_menu");
			assertThat(toolCall.type()).isEqualTo("function");
		});
		ToolResponseMessage replies = (ToolResponseMessage) messages.get(4);
		assertThat(replies.getResponses()).singleElement()
				.satisfies(reply -> assertThat(reply.responseData()).isEqualTo("{\"success\":true}"));
	}

	@Test
	void responseTextAndToolCallsAreCollected() {
		AssistantMessage output = new AssistantMessage("لحظة", Map.of(), List.of(
				new AssistantMessage.ToolCall("call_9", "function", "add_item", "{\"item_id\":\"pepsi\"}")));

		InferenceResponse response = SpringAiInferenceClient.fromResponse(new ChatResponse(List.of(new Generation(output))));

		assertThat(response.text()).isEqualTo("لحظة");
		assertThat(response.toolCalls()).containsExactly(new ToolCall("call_9", "add_item", "{\"item_id\":\"pepsi\"}"));
	}

	@Test
	void emptyResponseIsBlankText() {
		assertThat(SpringAiInferenceClient.fromResponse(null).text()).isEmpty();
		assertThat(SpringAiInferenceClient.fromResponse(new ChatResponse(List.of())).hasToolCalls()).isFalse();
	}

	@Test
	void inferDeclaresToolsWithoutExecutingThemAndUsesStageModel() {
		when(chatClient.prompt()).thenReturn(requestSpec);
		when(requestSpec.system(anyString())).thenReturn(requestSpec);
		when(requestSpec.messages(anyList())).thenReturn(requestSpec);
		when(requestSpec.options(any())).thenReturn(requestSpec);
		when(requestSpec.call()).thenReturn(callSpec);
		when(callSpec.chatResponse()).thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage("مرحبا")))));
		SpringAiInferenceClient client = new SpringAiInferenceClient(chatClient, Map.of(Stage.CHECKOUT, "gpt-4o"));

		InferenceResponse response = client.infer(request(Stage.CHECKOUT));

		assertThat(response.text()).isEqualTo("مرحبا");
		ArgumentCaptor<ChatOptions> options = ArgumentCaptor.forClass(ChatOptions.class);
		verify(requestSpec).options(options.capture());
		assertThat(options.getValue()).isInstanceOfSatisfying(ToolCallingChatOptions.class, toolOptions -> {
			assertThat(toolOptions.getModel()).isEqualTo("gpt-4o");
			assertThat(toolOptions.getInternalToolExecutionEnabled()).isFalse();
			assertThat(toolOptions.getToolCallbacks()).extracting(callback -> callback.getToolDefinition().name())
					.contains("confirm_order");
		});
		verify(requestSpec).system("instructions");
	}

	private static InferenceRequest request(Stage stage) {
		return new InferenceRequest("s1", stage, "instructions",
				List.of(ConversationMessage.context("<SESSION_STATE>\n</SESSION_STATE>"), ConversationMessage.user("نعم")),
				new ToolCatalog().forStage(stage), List.of());
	}
}
