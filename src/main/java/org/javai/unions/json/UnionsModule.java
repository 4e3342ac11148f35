package org.javai.unions.json;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.javai.unions.Failure;
import org.javai.unions.Option;
import org.javai.unions.Result;
import org.javai.unions.UnitResult;

/**
 * Jackson support for {@link Failure}, {@link Option}, {@link Result} and {@link UnitResult}.
 *
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new UnionsModule());
 *
 * String json = mapper.writeValueAsString(Result.success(42));
 * // {"isSuccess":true,"value":42}
 *
 * Result<Integer> back = mapper.readValue(json, new TypeReference<Result<Integer>>() {});
 * }</pre>
 *
 * <p>Failures keep their kind through the {@code "$type"} discriminator. Option and Result
 * values need their full generic type when read as a root value, e.g. through a
 * {@code TypeReference}; as properties of a bean or record the declared type is used.
 */
public class UnionsModule extends SimpleModule {

    static final String TYPE_FIELD = "$type";
    static final String SUCCESS_FIELD = "isSuccess";
    static final String VALUE_FIELD = "value";
    static final String ERROR_FIELD = "error";

    public UnionsModule() {
        super("UnionsModule");
        addSerializer(Failure.class, new FailureSerializer());
        addDeserializer(Failure.class, new FailureDeserializer());
        addSerializer(new OptionSerializer());
        addDeserializer(Option.class, new OptionDeserializer());
        addSerializer(new ResultSerializer());
        addDeserializer(Result.class, new ResultDeserializer());
        addSerializer(UnitResult.class, new UnitResultSerializer());
        addDeserializer(UnitResult.class, new UnitResultDeserializer());
    }

    /**
     * The first type parameter of {@code type}, or {@code Object} when unknown.
     */
    static JavaType containedType(JavaType type, DeserializationContext ctxt) {
        if (type == null || type.containedTypeCount() == 0) {
            return ctxt.constructType(Object.class);
        }
        return type.containedType(0);
    }
}
