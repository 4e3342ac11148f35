package org.javai.unions.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import org.javai.unions.Option;

/**
 * Writes a present option as its bare value and an absent one as JSON {@code null}.
 * Absent options count as empty, so {@code JsonInclude.Include.NON_EMPTY} omits them.
 */
class OptionSerializer extends StdSerializer<Option<?>> {

    OptionSerializer() {
        super(Option.class, false);
    }

    @Override
    public void serialize(Option<?> option, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (option.isNone()) {
            gen.writeNull();
        } else {
            provider.defaultSerializeValue(option.get(), gen);
        }
    }

    @Override
    public boolean isEmpty(SerializerProvider provider, Option<?> value) {
        return value == null || value.isNone();
    }
}
