package express.mvp.cipherlink.transport.config;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import express.mvp.cipherlink.transport.ConfigurationException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses settings documents into plain {@link Map}/{@link List} object graphs.
 *
 * <p>Objects become insertion-ordered maps, arrays become lists, integral numbers become
 * {@link Integer}, {@link Long} or {@link java.math.BigInteger} depending on magnitude, and
 * {@code null} stays {@code null}. Trailing content after the root value is rejected.
 */
public final class JsonSettings {

    private static final JsonFactory FACTORY = new JsonFactory();

    private JsonSettings() {}

    /**
     * Parses a document whose root must be a JSON object.
     *
     * @param json the document
     * @return the parsed object
     * @throws ConfigurationException if the document is malformed or not an object
     */
    public static Map<String, Object> parseObject(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try (JsonParser parser = FACTORY.createParser(json)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_OBJECT) {
                throw new ConfigurationException("Settings document must be a JSON object");
            }
            Map<String, Object> root = readObject(parser);
            JsonToken trailing = parser.nextToken();
            if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
                throw new ConfigurationException("Settings document contains trailing content");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(
                    "Malformed settings document: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read settings document", e);
        }
    }

    private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING -> parser.getText();
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NULL -> null;
            default -> throw new ConfigurationException("Unsupported JSON token: " + token);
        };
    }

    private static Map<String, Object> readObject(JsonParser parser) throws IOException {
        Map<String, Object> map = new LinkedHashMap<>();
        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_OBJECT) {
                return map;
            }
            if (token != JsonToken.FIELD_NAME) {
                throw new ConfigurationException("Expected field name but found " + token);
            }
            String fieldName = parser.getCurrentName();
            map.put(fieldName, readValue(parser, parser.nextToken()));
        }
    }

    private static List<Object> readArray(JsonParser parser) throws IOException {
        List<Object> list = new ArrayList<>();
        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                return list;
            }
            list.add(readValue(parser, token));
        }
    }
}
