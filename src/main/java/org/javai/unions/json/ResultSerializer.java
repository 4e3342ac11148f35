package org.javai.unions.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import org.javai.unions.Result;

/**
 * Writes {@code {"isSuccess": true, "value": ...}} or {@code {"isSuccess": false, "error": ...}}.
 */
class ResultSerializer extends StdSerializer<Result<?>> {

    ResultSerializer() {
        super(Result.class, false);
    }

    @Override
    public void serialize(Result<?> result, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeBooleanField(UnionsModule.SUCCESS_FIELD, result.isSuccess());
        if (result.isSuccess()) {
            provider.defaultSerializeField(UnionsModule.VALUE_FIELD, result.getValue(), gen);
        } else {
            provider.defaultSerializeField(UnionsModule.ERROR_FIELD, result.getFailure(), gen);
        }
        gen.writeEndObject();
    }
}
