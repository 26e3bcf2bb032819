package com.cso.dispatch.task;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.math.RoundingMode;

/** Reads a string from a JSON string or number; numbers are rendered without a fraction. */
public final class FlexStringDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            return p.getText();
        }
        if (token == JsonToken.VALUE_NUMBER_INT) {
            return p.getBigIntegerValue().toString();
        }
        if (token == JsonToken.VALUE_NUMBER_FLOAT) {
            return p.getDecimalValue().setScale(0, RoundingMode.HALF_EVEN).toPlainString();
        }
        return (String) ctxt.handleUnexpectedToken(String.class, p);
    }
}
