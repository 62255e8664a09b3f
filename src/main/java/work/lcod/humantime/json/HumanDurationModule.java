package work.lcod.humantime.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.math.BigInteger;
import work.lcod.humantime.api.DurationParseException;
import work.lcod.humantime.api.HumanDuration;
import work.lcod.humantime.shared.DurationParser;

/**
 * Jackson bindings for {@link HumanDuration}: written as canonical text, read from text or
 * from a whole number of seconds.
 */
public final class HumanDurationModule extends SimpleModule {
    private static final long serialVersionUID = 1L;

    public HumanDurationModule() {
        super("HumanDurationModule");
        addSerializer(HumanDuration.class, new Serializer());
        addDeserializer(HumanDuration.class, new Deserializer());
    }

    static final class Serializer extends StdSerializer<HumanDuration> {
        private static final long serialVersionUID = 1L;

        Serializer() {
            super(HumanDuration.class);
        }

        @Override
        public void serialize(HumanDuration value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.toString());
        }
    }

    static final class Deserializer extends StdDeserializer<HumanDuration> {
        private static final long serialVersionUID = 1L;

        Deserializer() {
            super(HumanDuration.class);
        }

        @Override
        public HumanDuration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            if (parser.currentToken() == JsonToken.VALUE_NUMBER_INT) {
                BigInteger seconds = parser.getBigIntegerValue();
                if (seconds.signum() < 0) {
                    throw context.weirdNumberException(seconds, HumanDuration.class, "negative durations are not supported");
                }
                if (seconds.bitLength() > Long.SIZE) {
                    throw context.weirdNumberException(seconds, HumanDuration.class, "seconds exceed 2^64-1");
                }
                // unsigned: values above Long.MAX_VALUE keep their low 64 bits
                return HumanDuration.ofSeconds(seconds.longValue());
            }
            if (parser.currentToken() != JsonToken.VALUE_STRING) {
                return (HumanDuration) context.handleUnexpectedToken(HumanDuration.class, parser);
            }
            String raw = parser.getText();
            try {
                return DurationParser.parse(raw);
            } catch (DurationParseException ex) {
                throw context.weirdStringException(raw, HumanDuration.class, ex.getMessage());
            }
        }
    }
}
