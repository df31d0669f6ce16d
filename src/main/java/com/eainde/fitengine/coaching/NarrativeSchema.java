package com.eainde.fitengine.coaching;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The fixed response schema of the narrative call, read from {@code schema/narrative-schema.json}
 * and converted into a LangChain4j {@link JsonSchema}.
 */
@Component
public class NarrativeSchema {

    static final String LOCATION = "schema/narrative-schema.json";
    static final String NAME = "CoachingNarrative";

    private final JsonSchema jsonSchema;

    public NarrativeSchema(ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(LOCATION).getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            this.jsonSchema = JsonSchema.builder()
                    .name(NAME)
                    .rootElement(parseElement(root))
                    .build();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load narrative schema from " + LOCATION, e);
        }
    }

    public JsonSchema jsonSchema() {
        return jsonSchema;
    }

    private static JsonSchemaElement parseElement(JsonNode node) {
        String type = node.path("type").asText(node.has("properties") ? "object" : "string");
        return switch (type) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "string" -> JsonStringSchema.builder().description(description(node)).build();
            default -> throw new IllegalStateException("Unsupported schema type in narrative schema: " + type);
        };
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description(node));

        Iterator<Map.Entry<String, JsonNode>> fields = node.path("properties").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.addProperty(field.getKey(), parseElement(field.getValue()));
        }

        if (node.path("required").isArray()) {
            List<String> required = new ArrayList<>();
            node.get("required").forEach(n -> required.add(n.asText()));
            builder.required(required);
        }
        builder.additionalProperties(node.path("additionalProperties").asBoolean(false));
        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description(node));
        if (node.has("items")) {
            builder.items(parseElement(node.get("items")));
        }
        return builder.build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }
}
