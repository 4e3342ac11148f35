package org.javai.unions.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import org.javai.unions.Failure;

/**
 * Writes a failure as {@code {"$type", "code", "message"}} plus either {@code "metadata"}
 * (when non-empty) or, for aggregates, {@code "errors"}.
 */
class FailureSerializer extends StdSerializer<Failure> {

    FailureSerializer() {
        super(Failure.class);
    }

    @Override
    public void serialize(Failure failure, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeStringField(UnionsModule.TYPE_FIELD, failure.kind().typeName());
        gen.writeStringField("code", failure.code());
        gen.writeStringField("message", failure.message());
        if (failure.isAggregate()) {
            gen.writeArrayFieldStart("errors");
            for (Failure child : failure.errors()) {
                serialize(child, gen, provider);
            }
            gen.writeEndArray();
        } else if (!failure.metadata().isEmpty()) {
            provider.defaultSerializeField("metadata", failure.metadata(), gen);
        }
        gen.writeEndObject();
    }
}
