package org.janelia.diffraction.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Jackson mappers for the instrument and material documents and for logging parameter objects.
 *
 * Both mappers bind fields directly (getters are ignored), so the immutable document classes
 * only need a private no-arg constructor.
 *
 * @author Eric Trautman
 */
public class JsonUtils {

    /** Lenient mapper: unknown properties are skipped. Used for writing documents and logging. */
    public static final ObjectMapper MAPPER = buildMapper(false);

    /** Rejects unknown properties so that misspelled geometry or material keys fail fast. */
    public static final ObjectMapper STRICT_MAPPER = buildMapper(true);

    private static ObjectMapper buildMapper(final boolean failOnUnknownProperties) {

        // keep numeric arrays (translations, distortion parameters) readable on their own lines
        final DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentArraysWith(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE);

        return new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .setDefaultPrettyPrinter(printer)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, failOnUnknownProperties);
    }

    /**
     * Reads and writes one document type: documents are read strictly and written with the lenient mapper.
     */
    public static class Helper<T> {

        private final Class<T> documentClass;

        public Helper(final Class<T> documentClass) {
            this.documentClass = documentClass;
        }

        public String toJson(final T document)
                throws IllegalArgumentException {
            try {
                return MAPPER.writeValueAsString(document);
            } catch (final JsonProcessingException e) {
                throw new IllegalArgumentException("failed to serialize " + documentClass.getSimpleName(), e);
            }
        }

        public T fromJson(final String json)
                throws IllegalArgumentException {
            try {
                return STRICT_MAPPER.readValue(json, documentClass);
            } catch (final JsonProcessingException e) {
                throw new IllegalArgumentException("invalid " + documentClass.getSimpleName() + " json", e);
            }
        }

        /**
         * @throws IOException
         *   if the file cannot be read.
         *
         * @throws IllegalArgumentException
         *   if the content does not describe a valid document.
         */
        public T fromJsonFile(final Path path)
                throws IOException, IllegalArgumentException {
            try (final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                return STRICT_MAPPER.readValue(reader, documentClass);
            } catch (final JsonProcessingException e) {
                throw new IllegalArgumentException("invalid " + documentClass.getSimpleName() + " in " + path, e);
            }
        }
    }
}
