package com.eyelevel.invoiceprocessor.common.json.jackson;

import com.eyelevel.invoiceprocessor.common.json.JsonSerializer;
import com.eyelevel.invoiceprocessor.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link JsonSerializer} backed by the application's Jackson {@link ObjectMapper}. Used to snapshot
 * analysis payloads into {@code analysis_result}.
 */
@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> String serialize(T object) {
        return serialize(object, false);
    }

    @Override
    public <T> String serialize(T object, boolean prettyPrint) {
        if (object == null) {
            return null;
        }
        log.debug("Serializing {} to JSON (prettyPrint: {})", object.getClass().getSimpleName(), prettyPrint);
        try {
            return prettyPrint
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(object)
                    : objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            log.error("Error serializing {} to JSON", object.getClass().getName(), e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }
}
