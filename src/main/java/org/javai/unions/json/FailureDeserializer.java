package org.javai.unions.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;
import org.javai.unions.Failure;
import org.javai.unions.FailureBuilder;
import org.javai.unions.FailureKind;

/**
 * Reads the form written by {@link FailureSerializer}. A missing or unknown {@code "$type"}
 * reads as a general failure; metadata on a kind that carries none is ignored.
 */
class FailureDeserializer extends StdDeserializer<Failure> {

    FailureDeserializer() {
        super(Failure.class);
    }

    @Override
    public Failure deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(p);
        return fromTree(node, ctxt);
    }

    private Failure fromTree(JsonNode node, DeserializationContext ctxt) throws IOException {
        if (!node.isObject()) {
            return ctxt.reportInputMismatch(this, "Expected a JSON object for Failure but found %s", node.getNodeType());
        }
        String code = requiredText(node, "code", ctxt);
        String message = requiredText(node, "message", ctxt);
        FailureKind kind = node.hasNonNull(UnionsModule.TYPE_FIELD)
                ? FailureKind.fromTypeName(node.get(UnionsModule.TYPE_FIELD).asText()).getOrElse(FailureKind.GENERAL)
                : FailureKind.GENERAL;

        if (kind == FailureKind.AGGREGATE) {
            return aggregate(node, ctxt);
        }
        Map<String, Object> metadata = null;
        if (kind.carriesMetadata() && node.hasNonNull("metadata")) {
            JsonNode entries = node.get("metadata");
            if (!entries.isObject()) {
                return ctxt.reportInputMismatch(this, "Failure \"metadata\" must be a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = entries.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isNull()) {
                    return ctxt.reportInputMismatch(this, "Failure metadata \"%s\" must not be null", field.getKey());
                }
            }
            metadata = ctxt.readTreeAsValue(entries,
                    ctxt.getTypeFactory().constructMapType(Map.class, String.class, Object.class));
        }
        return Failure.of(kind, code, message, metadata);
    }

    private Failure aggregate(JsonNode node, DeserializationContext ctxt) throws IOException {
        JsonNode errors = node.get("errors");
        if (errors == null || !errors.isArray() || errors.isEmpty()) {
            return ctxt.reportInputMismatch(this, "AggregateError requires a non-empty \"errors\" array");
        }
        FailureBuilder builder = new FailureBuilder();
        for (JsonNode child : errors) {
            builder.append(fromTree(child, ctxt));
        }
        return builder.build();
    }

    private String requiredText(JsonNode node, String field, DeserializationContext ctxt) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return ctxt.reportInputMismatch(this, "Failure requires a string \"%s\" property", field);
        }
        return value.asText();
    }
}
