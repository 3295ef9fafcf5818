package com.gridcalc.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/** JSON codec for {@link SheetDocument}. */
public final class SheetJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private SheetJson() {
    }

    public static String write(SheetDocument document) throws JsonProcessingException {
        return MAPPER.writeValueAsString(document);
    }

    public static SheetDocument read(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, SheetDocument.class);
    }
}
