package com.cso.dispatch.task;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;

/**
 * Reads an int from a JSON number or a numeric string; an empty string is 0. The backend sends
 * some IDs as strings and some as numbers.
 */
public final class FlexIntDeserializer extends JsonDeserializer<Integer> {

    @Override
    public Integer deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return p.getIntValue();
        }
        if (token == JsonToken.VALUE_NUMBER_FLOAT) {
            return (int) p.getDoubleValue();
        }
        if (token == JsonToken.VALUE_STRING) {
            String s = p.getText().trim();
            if (s.isEmpty()) return 0;
            try {
                return Integer.parseInt(s);
            } catch (NumberFormatException e) {
                return (Integer) ctxt.handleWeirdStringValue(Integer.class, s, "not an integer");
            }
        }
        return (Integer) ctxt.handleUnexpectedToken(Integer.class, p);
    }

    @Override
    public Integer getNullValue(DeserializationContext ctxt) {
        return 0;
    }
}
