package io.hearthwarrio.formschema.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Renders a {@link FormSchema} as a pretty-printed JSON document.
 * Writing the document somewhere is up to the caller.
 */
public final class FormSchemaJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private FormSchemaJson() {
    }

    /**
     * @param schema schema to render
     * @return JSON text
     * @throws IllegalStateException if the schema cannot be serialized
     */
    public static String toJson(FormSchema schema) {
        try {
            return MAPPER.writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize form schema " + schema.getVersion(), e);
        }
    }

    /**
     * @return shared mapper configured for schema documents
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
