package org.javai.unions.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import org.javai.unions.UnitResult;

class UnitResultSerializer extends StdSerializer<UnitResult> {

    UnitResultSerializer() {
        super(UnitResult.class);
    }

    @Override
    public void serialize(UnitResult result, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeBooleanField(UnionsModule.SUCCESS_FIELD, result.isSuccess());
        if (result.isFailure()) {
            provider.defaultSerializeField(UnionsModule.ERROR_FIELD, result.getFailure(), gen);
        }
        gen.writeEndObject();
    }
}
