package io.evitadb.lingua;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes JSON localization documents.
 *
 * Output is UTF-8 with non-ASCII characters kept verbatim, indented by two spaces with `"key": value`
 * separators and one array element per line, terminated by a newline.
 */
public final class JsonDocumentWriter {

	@Nonnull
	private final ObjectMapper objectMapper;
	@Nonnull
	private final ObjectWriter prettyWriter;

	public JsonDocumentWriter(@Nonnull ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
		final DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
		final DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
			.withSeparators(Separators.createDefaultInstance().withObjectFieldValueSpacing(Separators.Spacing.AFTER));
		printer.indentObjectsWith(indenter);
		printer.indentArraysWith(indenter);
		this.prettyWriter = objectMapper.writer(printer);
	}

	/**
	 * Parses a JSON document from a file.
	 *
	 * @param file the file to read
	 * @return parsed document
	 * @throws IOException when the file cannot be read or is not valid JSON
	 */
	@Nonnull
	public JsonNode read(@Nonnull Path file) throws IOException {
		Objects.requireNonNull(file, "file must not be null");
		final String content = Files.readString(file, StandardCharsets.UTF_8);
		try {
			final JsonNode node = this.objectMapper.readTree(content);
			if (node == null || node.isMissingNode()) {
				throw new IOException("File " + file + " contains no JSON document");
			}
			return node;
		} catch (JsonProcessingException e) {
			throw new IOException("Invalid JSON in " + file + ": " + e.getOriginalMessage(), e);
		}
	}

	/**
	 * Writes the document to the target file, creating its parent directories.
	 *
	 * @param document   document to write
	 * @param targetFile target file, overwritten when it exists
	 * @throws IOException if an I/O error occurs while creating directories or writing the file
	 */
	public void write(@Nonnull JsonNode document, @Nonnull Path targetFile) throws IOException {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");

		final Path absolute = targetFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		final String toWrite = this.prettyWriter.writeValueAsString(document) + "\n";
		Files.write(absolute, toWrite.getBytes(StandardCharsets.UTF_8));
	}
}
