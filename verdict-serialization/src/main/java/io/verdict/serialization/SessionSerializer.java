package io.verdict.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ReviewSession;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Utility class for serializing review sessions and their items to and from JSON.
///
/// Whole sessions round-trip through {@link #toJson(ReviewSession)} and
/// {@link #fromJson(String)}. Storage backends that keep session columns separately use
/// {@link #itemsToJson(Collection)} and {@link #itemsFromJson(String)}, which write the
/// items as a JSON array so first-submission order survives stores that reorder object
/// keys.
///
/// ### Usage
/// {@snippet :
/// String json = SessionSerializer.toJson(session);
/// ReviewSession restored = SessionSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. Uses one shared mapper built by {@link #createMapper()}.
///
/// @see VerdictJacksonModule for the registered type handlers
public final class SessionSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private static final TypeReference<List<ItemReview>> ITEM_LIST = new TypeReference<>() {};

    private SessionSerializer() {}

    /// Serializes a session, including all items and passes, to pretty-printed JSON.
    ///
    /// @param session the session to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ReviewSession session) {
        try {
            return MAPPER.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize session: " + e.getMessage(), e);
        }
    }

    /// Deserializes a session from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized session, never null
    /// @throws IllegalArgumentException if the JSON is malformed or violates the model
    public static ReviewSession fromJson(String json) {
        try {
            return MAPPER.readValue(json, ReviewSession.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize session: " + e.getMessage(), e);
        }
    }

    /// Serializes items as a JSON array, preserving iteration order.
    ///
    /// @param items items to write, not null
    /// @return JSON array, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String itemsToJson(Collection<ItemReview> items) {
        try {
            return MAPPER.writeValueAsString(List.copyOf(items));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize items: " + e.getMessage(), e);
        }
    }

    /// Deserializes a JSON array of items into a map keyed by item id, in array order.
    ///
    /// @param json JSON array, not null
    /// @return ordered item map, never null
    /// @throws IllegalArgumentException if the JSON is malformed or repeats an item id
    public static Map<String, ItemReview> itemsFromJson(String json) {
        List<ItemReview> list;
        try {
            list = MAPPER.readValue(json, ITEM_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize items: " + e.getMessage(), e);
        }
        Map<String, ItemReview> items = new LinkedHashMap<>();
        for (ItemReview item : list) {
            if (items.putIfAbsent(item.itemId(), item) != null) {
                throw new IllegalArgumentException("Duplicate item id: " + item.itemId());
            }
        }
        return items;
    }

    /// Creates an ObjectMapper configured for review-model serialization.
    ///
    /// Registers:
    /// - `VerdictJacksonModule` for passes and decisions
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new VerdictJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
