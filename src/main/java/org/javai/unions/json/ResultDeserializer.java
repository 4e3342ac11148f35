package org.javai.unions.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import org.javai.unions.Failure;
import org.javai.unions.Result;

/**
 * Reads the form written by {@link ResultSerializer}. A failure without an {@code "error"}
 * reads as a general {@code DESERIALIZATION_ERROR} failure; a success without a
 * {@code "value"} is rejected.
 */
class ResultDeserializer extends StdDeserializer<Result<?>> implements ContextualDeserializer {

    static final Failure MISSING_ERROR =
            Failure.of("DESERIALIZATION_ERROR", "Missing error information in failure result");

    private final JavaType valueType;

    ResultDeserializer() {
        this(null);
    }

    private ResultDeserializer(JavaType valueType) {
        super(Result.class);
        this.valueType = valueType;
    }

    @Override
    public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) {
        JavaType type = property != null ? property.getType() : ctxt.getContextualType();
        return new ResultDeserializer(UnionsModule.containedType(type, ctxt));
    }

    @Override
    public Result<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(p);
        if (!node.isObject()) {
            return ctxt.reportInputMismatch(this, "Expected a JSON object for Result but found %s", node.getNodeType());
        }
        JsonNode success = node.get(UnionsModule.SUCCESS_FIELD);
        if (success == null || !success.isBoolean()) {
            return ctxt.reportInputMismatch(this, "Result requires a boolean \"%s\" property", UnionsModule.SUCCESS_FIELD);
        }

        if (success.booleanValue()) {
            JsonNode value = node.get(UnionsModule.VALUE_FIELD);
            if (value == null || value.isNull()) {
                return ctxt.reportInputMismatch(this, "Success result must have a value");
            }
            JavaType type = valueType != null ? valueType : ctxt.constructType(Object.class);
            Object deserialized = ctxt.readTreeAsValue(value, type);
            return Result.success(deserialized);
        }

        JsonNode error = node.get(UnionsModule.ERROR_FIELD);
        if (error == null || error.isNull()) {
            return Result.failure(MISSING_ERROR);
        }
        Failure failure = ctxt.readTreeAsValue(error, Failure.class);
        return Result.failure(failure);
    }
}
