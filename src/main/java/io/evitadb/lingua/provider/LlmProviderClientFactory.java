package io.evitadb.lingua.provider;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Creates {@link LlmProviderClient}s, each over its own freshly built ChatModel.
 */
public final class LlmProviderClientFactory implements ProviderClientFactory {

	@Nonnull
	private final LlmSettings settings;
	@Nonnull
	private final PromptLoader promptLoader;

	public LlmProviderClientFactory(@Nonnull LlmSettings settings, @Nonnull PromptLoader promptLoader) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader must not be null");
	}

	@Nonnull
	@Override
	public ProviderClient create() {
		return new LlmProviderClient(ChatModelFactory.create(this.settings), this.promptLoader);
	}
}
