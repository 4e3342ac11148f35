package org.javai.unions.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import org.javai.unions.Failure;
import org.javai.unions.UnitResult;

class UnitResultDeserializer extends StdDeserializer<UnitResult> {

    UnitResultDeserializer() {
        super(UnitResult.class);
    }

    @Override
    public UnitResult deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(p);
        JsonNode success = node.get(UnionsModule.SUCCESS_FIELD);
        if (success == null || !success.isBoolean()) {
            return ctxt.reportInputMismatch(this, "UnitResult requires a boolean \"%s\" property", UnionsModule.SUCCESS_FIELD);
        }
        if (success.booleanValue()) {
            return UnitResult.success();
        }
        JsonNode error = node.get(UnionsModule.ERROR_FIELD);
        if (error == null || error.isNull()) {
            return UnitResult.failure(ResultDeserializer.MISSING_ERROR);
        }
        Failure failure = ctxt.readTreeAsValue(error, Failure.class);
        return UnitResult.failure(failure);
    }
}
