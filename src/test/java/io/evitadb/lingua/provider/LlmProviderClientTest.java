package io.evitadb.lingua.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("LlmProviderClient should translate through a chat model")
class LlmProviderClientTest {

	private ChatModel mockModel;
	private LlmProviderClient client;

	@BeforeEach
	void setUp() {
		mockModel = mock(ChatModel.class);
		client = new LlmProviderClient(mockModel, new PromptLoader());
	}

	@Test
	@DisplayName("sends the text with a system prompt naming both languages")
	void shouldSendPromptAndText() throws Exception {
		final List<ChatMessage> messages = new ArrayList<>();
		when(mockModel.chat(anyList())).thenAnswer(invocation -> {
			final List<ChatMessage> sent = invocation.getArgument(0);
			messages.addAll(sent);
			return response("Hola ⟦0⟧");
		});

		final String result = client.translate("Hello ⟦0⟧", "en", "es");

		verify(mockModel, times(1)).chat(anyList());
		assertEquals(2, messages.size());
		assertTrue(((SystemMessage) messages.get(0)).text().contains("from English (en) to Spanish (es)"));
		assertEquals("Hello ⟦0⟧", ((UserMessage) messages.get(1)).singleText());
		assertEquals("Hola ⟦0⟧", result);
	}

	@Test
	@DisplayName("keeps the leading and trailing whitespace of the source")
	void shouldPreserveSurroundingWhitespace() throws Exception {
		answer("\n  Hola \n");

		assertEquals("  Hola ", client.translate("  Hello ", "en", "es"));
		assertEquals("Hola", client.translate("Hello", "en", "es"));
	}

	@Test
	@DisplayName("fails on an empty answer")
	void shouldFailOnEmptyAnswer() {
		answer("   ");

		final ProviderException ex = assertThrows(ProviderException.class, () -> client.translate("Hello", "en", "es"));
		assertFalse(ex.isPermanent());
	}

	@Test
	@DisplayName("reports transient failures and keeps the client usable")
	void shouldReportTransientFailure() throws Exception {
		when(mockModel.chat(anyList()))
			.thenThrow(new RateLimitException("Too many requests"))
			.thenReturn(response("Hola"));

		final ProviderException ex = assertThrows(ProviderException.class, () -> client.translate("Hello", "en", "es"));
		assertFalse(ex.isPermanent());
		assertFalse(client.hasPermanentFailure());
		assertEquals("Hola", client.translate("Hello", "en", "es"));
	}

	@Test
	@DisplayName("fails fast after a permanent failure")
	void shouldFailFastAfterPermanentFailure() {
		when(mockModel.chat(anyList())).thenThrow(new AuthenticationException("Invalid API key"));

		final ProviderException first = assertThrows(ProviderException.class, () -> client.translate("Hello", "en", "es"));
		final ProviderException second = assertThrows(ProviderException.class, () -> client.translate("World", "en", "es"));

		assertTrue(first.isPermanent());
		assertTrue(second.isPermanent());
		assertTrue(client.hasPermanentFailure());
		verify(mockModel, times(1)).chat(anyList());
		assertEquals(Optional.empty(), client.detectLanguage(List.of("Hello")));
	}

	@Test
	@DisplayName("detects a bare or decorated language code")
	void shouldDetectLanguage() {
		answer("es");
		assertEquals(Optional.of("es"), client.detectLanguage(List.of("Hola mundo")));

		answer(" zh_cn. ");
		assertEquals(Optional.of("zh-CN"), client.detectLanguage(List.of("你好")));
	}

	@Test
	@DisplayName("returns empty when detection is inconclusive or fails")
	void shouldReturnEmptyWhenUnknown() {
		answer("unknown");
		assertEquals(Optional.empty(), client.detectLanguage(List.of("123")));

		when(mockModel.chat(anyList())).thenThrow(new RuntimeException("connection reset"));
		assertEquals(Optional.empty(), client.detectLanguage(List.of("Hello")));

		assertEquals(Optional.empty(), client.detectLanguage(List.of()));
	}

	@Test
	@DisplayName("parses the first known code from a chatty answer")
	void shouldParseChattyAnswer() {
		assertEquals(Optional.of("fr"), LlmProviderClient.parseLanguageCode("The language is French (fr)."));
		assertEquals(Optional.of("de"), LlmProviderClient.parseLanguageCode("DE"));
		assertEquals(Optional.empty(), LlmProviderClient.parseLanguageCode("Unknown language"));
		assertEquals(Optional.empty(), LlmProviderClient.parseLanguageCode("I am not sure"));
		assertEquals(Optional.empty(), LlmProviderClient.parseLanguageCode(null));
	}

	private void answer(String text) {
		when(mockModel.chat(anyList())).thenReturn(response(text));
	}

	private static ChatResponse response(String text) {
		return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
	}
}
