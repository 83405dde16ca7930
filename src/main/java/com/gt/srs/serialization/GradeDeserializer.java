package com.gt.srs.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.srs.model.Grade;
import org.springframework.stereotype.Component;

import java.io.IOException;

// Accepts either the quality score (0-3) or the grade name
@Component
public class GradeDeserializer extends JsonDeserializer<Grade> {
    @Override
    public Grade deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        Grade grade = jsonParser.currentToken() == JsonToken.VALUE_NUMBER_INT
                ? Grade.fromQuality(jsonParser.getIntValue())
                : fromText(jsonParser.getValueAsString());

        if (grade == null) {
            return (Grade) deserializationContext.handleWeirdStringValue(Grade.class, jsonParser.getText(), "Unknown grade");
        }

        return grade;
    }

    private static Grade fromText(String text) {
        if (text != null && text.trim().matches("\\d{1,9}")) {
            return Grade.fromQuality(Integer.parseInt(text.trim()));
        }

        return Grade.fromName(text);
    }
}
