package org.javai.unions.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import org.javai.unions.Option;

/**
 * Reads JSON {@code null} or a missing creator property as an absent option and anything
 * else as a present option of the declared value type.
 */
class OptionDeserializer extends StdDeserializer<Option<?>> implements ContextualDeserializer {

    private final JavaType valueType;

    OptionDeserializer() {
        this(null);
    }

    private OptionDeserializer(JavaType valueType) {
        super(Option.class);
        this.valueType = valueType;
    }

    @Override
    public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) {
        JavaType type = property != null ? property.getType() : ctxt.getContextualType();
        return new OptionDeserializer(UnionsModule.containedType(type, ctxt));
    }

    @Override
    public Option<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        Object value = ctxt.readValue(p, valueType != null ? valueType : ctxt.constructType(Object.class));
        return Option.ofNullable(value);
    }

    @Override
    public Option<?> getNullValue(DeserializationContext ctxt) {
        return Option.none();
    }

    @Override
    public Object getAbsentValue(DeserializationContext ctxt) {
        return Option.none();
    }

    @Override
    public Object getEmptyValue(DeserializationContext ctxt) {
        return Option.none();
    }
}
