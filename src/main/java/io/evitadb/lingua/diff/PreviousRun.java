package io.evitadb.lingua.diff;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Documents left behind by an earlier translation of the same input into one target language.
 *
 * @param output translated document written by the earlier run
 * @param source source document the earlier run translated from
 */
public record PreviousRun(
	@Nonnull JsonNode output,
	@Nonnull JsonNode source
) {

	public PreviousRun {
		Objects.requireNonNull(output, "output must not be null");
		Objects.requireNonNull(source, "source must not be null");
	}
}
