package org.dxworks.clippy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.dxworks.clippy.model.ClippyContent;

/**
 * JSON wire codec for {@link ClippyContent}. The shape is the one stored next to
 * snippets: {@code version}, {@code blocks} tagged by {@code type}, optional metadata.
 */
public final class ContentCodec {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private static final ObjectMapper PRETTY_MAPPER = MAPPER.copy().enable(SerializationFeature.INDENT_OUTPUT);

    private ContentCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(ClippyContent content) throws JsonProcessingException {
        return MAPPER.writeValueAsString(content);
    }

    public static String toPrettyJson(Object value) throws JsonProcessingException {
        return PRETTY_MAPPER.writeValueAsString(value);
    }

    public static ClippyContent fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, ClippyContent.class);
    }

    public static JsonNode toTree(ClippyContent content) {
        return MAPPER.valueToTree(content);
    }

    public static JsonNode readTree(String json) throws JsonProcessingException {
        return MAPPER.readTree(json);
    }
}
