package org.carball.qan.model.digest;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Reads a {@code BIGINT UNSIGNED} column into the bits of a {@code long}. Values above
 * {@link Long#MAX_VALUE} come out negative and must be compared with
 * {@link Long#compareUnsigned} and widened with {@link #toDouble}.
 */
public class UnsignedLongDeserializer extends StdDeserializer<Long> {

    public UnsignedLongDeserializer() {
        super(Long.class);
    }

    @Override
    public Long deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            BigInteger value = p.getBigIntegerValue();
            if (value.signum() >= 0 && value.bitLength() <= Long.SIZE) {
                return value.longValue();
            }
            throw ctxt.weirdNumberException(value, Long.class, "not an unsigned 64-bit counter");
        }
        if (token == JsonToken.VALUE_STRING) {
            String text = p.getText().trim();
            try {
                return Long.parseUnsignedLong(text);
            } catch (NumberFormatException e) {
                throw ctxt.weirdStringException(text, Long.class, "not an unsigned 64-bit counter");
            }
        }
        return (Long) ctxt.handleUnexpectedToken(Long.class, p);
    }

    @Override
    public Long getNullValue(DeserializationContext ctxt) {
        return 0L;
    }

    public static double toDouble(long unsigned) {
        if (unsigned >= 0) {
            return unsigned;
        }
        // halve keeping the low bit so rounding stays correct, then double back
        return ((unsigned >>> 1) | (unsigned & 1)) * 2.0;
    }
}
