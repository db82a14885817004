package com.tsl.search.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsl.search.model.FlatList;
import com.tsl.search.model.ProfileSection;
import com.tsl.search.model.StructuredList;
import java.sql.Array;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes semi-structured profile columns into {@link ProfileSection} values.
 *
 * <p>Shapes: a JSON array of scalars becomes a flat list; a JSON array of objects becomes a
 * structured list; an object carrying {@code manual_list} becomes that flat list, any other object
 * is flattened value by value; a JSON string or plain text becomes a one-item flat list. Anything
 * undecodable degrades to an empty section.
 */
@Component
public class ProfileSectionDecoder {
    private static final Logger logger = LoggerFactory.getLogger(ProfileSectionDecoder.class);
    private static final String MANUAL_LIST = "manual_list";
    private static final String SCALAR_FIELD = "value";

    private final ObjectMapper objectMapper;

    public ProfileSectionDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decodes a JSON column. Malformed JSON yields an empty section.
     */
    public ProfileSection decodeJson(Object raw, String field) {
        if (raw == null) {
            return ProfileSection.empty();
        }
        if (raw instanceof Array) {
            return fromSqlArray((Array) raw, field);
        }
        if (raw instanceof Collection || raw instanceof Map) {
            return fromNode(objectMapper.valueToTree(raw));
        }
        String text = raw.toString();
        if (text.isBlank()) {
            return ProfileSection.empty();
        }
        try {
            return fromNode(objectMapper.readTree(text));
        } catch (JsonProcessingException e) {
            logger.warn("profile_field_undecodable field={} reason={}", field, e.getOriginalMessage());
            return ProfileSection.empty();
        }
    }

    /**
     * Decodes a column that may hold free text or JSON. Text that does not parse as JSON is kept as a
     * single item.
     */
    public ProfileSection decodeText(Object raw, String field) {
        if (raw == null) {
            return ProfileSection.empty();
        }
        if (raw instanceof Array || raw instanceof Collection || raw instanceof Map) {
            return decodeJson(raw, field);
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return ProfileSection.empty();
        }
        if (text.startsWith("[") || text.startsWith("{")) {
            try {
                return fromNode(objectMapper.readTree(text));
            } catch (JsonProcessingException e) {
                logger.debug("profile_field_plain_text field={}", field);
            }
        }
        return FlatList.of(text);
    }

    public List<String> decodeStrings(Object raw, String field) {
        ProfileSection section = decodeText(raw, field);
        if (section instanceof FlatList) {
            return ((FlatList) section).getItems();
        }
        String formatted = section.format(List.of());
        return formatted.isEmpty() ? List.of() : List.of(formatted);
    }

    private ProfileSection fromSqlArray(Array array, String field) {
        try {
            Object value = array.getArray();
            if (!(value instanceof Object[])) {
                return ProfileSection.empty();
            }
            List<String> items = new ArrayList<>();
            for (Object item : (Object[]) value) {
                if (item != null) {
                    items.add(item.toString());
                }
            }
            return new FlatList(items);
        } catch (SQLException e) {
            logger.warn("profile_field_undecodable field={} reason={}", field, e.getMessage());
            return ProfileSection.empty();
        }
    }

    ProfileSection fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ProfileSection.empty();
        }
        if (node.isArray()) {
            return fromArray(node);
        }
        if (node.isObject()) {
            JsonNode manual = node.get(MANUAL_LIST);
            if (manual != null && manual.isArray()) {
                return new FlatList(scalars(manual));
            }
            List<String> items = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                JsonNode value = fields.next().getValue();
                if (value.isArray()) {
                    items.addAll(scalars(value));
                } else if (value.isValueNode() && !value.isNull()) {
                    items.add(value.asText());
                }
            }
            return new FlatList(items);
        }
        return FlatList.of(node.asText());
    }

    private ProfileSection fromArray(JsonNode array) {
        boolean structured = false;
        for (JsonNode element : array) {
            if (element.isObject()) {
                structured = true;
                break;
            }
        }
        if (!structured) {
            return new FlatList(scalars(array));
        }
        List<Map<String, String>> entries = new ArrayList<>();
        for (JsonNode element : array) {
            Map<String, String> entry = new LinkedHashMap<>();
            if (element.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    String value = render(field.getValue());
                    if (value != null) {
                        entry.put(field.getKey(), value);
                    }
                }
            } else if (element.isValueNode() && !element.isNull()) {
                entry.put(SCALAR_FIELD, element.asText());
            }
            entries.add(entry);
        }
        return new StructuredList(entries);
    }

    private static List<String> scalars(JsonNode array) {
        List<String> items = new ArrayList<>();
        for (JsonNode element : array) {
            String value = render(element);
            if (value != null) {
                items.add(value);
            }
        }
        return items;
    }

    private static String render(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        if (value.isArray()) {
            return String.join(", ", scalars(value));
        }
        return value.toString();
    }
}
