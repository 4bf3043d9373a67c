package io.verdict.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.verdict.core.exception.ValidationException;
import io.verdict.core.policy.ItemTypePolicy;
import io.verdict.core.policy.WorkflowPolicy;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Reads and writes workflow policy documents.
///
/// A document maps each item type to its requirements:
/// ```json
/// {
///   "pages":   { "required_passes": ["style", "fact_check"], "required_approvals": 1 },
///   "quizzes": { "required_passes": ["style"], "optional_passes": ["a11y"],
///                "required_approvals": 2 }
/// }
/// ```
/// `optional_passes` may be omitted. Unknown fields are rejected so that a misspelled key
/// cannot silently weaken a policy.
///
/// @implNote Thread-safe. Stateless apart from a shared mapper.
public final class WorkflowPolicyParser {

    static final String REQUIRED_PASSES = "required_passes";
    static final String OPTIONAL_PASSES = "optional_passes";
    static final String REQUIRED_APPROVALS = "required_approvals";

    private static final Set<String> KNOWN_FIELDS =
            Set.of(REQUIRED_PASSES, OPTIONAL_PASSES, REQUIRED_APPROVALS);

    private static final ObjectMapper MAPPER = SessionSerializer.createMapper();

    private WorkflowPolicyParser() {}

    /// Parses a policy document.
    ///
    /// @param json policy JSON, not null
    /// @return the policy, never null
    /// @throws ValidationException if the document is malformed or describes an invalid policy
    public static WorkflowPolicy parse(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ValidationException(
                    "Malformed policy document: " + e.getOriginalMessage(), e);
        }
    }

    public static WorkflowPolicy parse(InputStream in) {
        Objects.requireNonNull(in, "in must not be null");
        try {
            return fromTree(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new ValidationException(
                    "Could not read policy document: " + e.getMessage(), e);
        }
    }

    /// Parses a policy document from a file.
    ///
    /// @throws ValidationException if the file cannot be read or is not a valid policy
    public static WorkflowPolicy parse(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        } catch (IOException e) {
            throw new ValidationException("Could not read policy file " + file, e);
        }
    }

    /// Writes a policy in the same document shape {@link #parse(String)} accepts.
    public static String toJson(WorkflowPolicy policy) {
        ObjectNode root = MAPPER.createObjectNode();
        for (Map.Entry<String, ItemTypePolicy> entry : policy.itemTypes().entrySet()) {
            ItemTypePolicy itemPolicy = entry.getValue();
            ObjectNode node = root.putObject(entry.getKey());
            ArrayNode required = node.putArray(REQUIRED_PASSES);
            itemPolicy.requiredPassKinds().forEach(required::add);
            if (!itemPolicy.optionalPassKinds().isEmpty()) {
                ArrayNode optional = node.putArray(OPTIONAL_PASSES);
                itemPolicy.optionalPassKinds().forEach(optional::add);
            }
            node.put(REQUIRED_APPROVALS, itemPolicy.requiredApprovals());
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize policy: " + e.getMessage(), e);
        }
    }

    private static WorkflowPolicy fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ValidationException("Policy document must be a JSON object");
        }
        if (root.isEmpty()) {
            throw new ValidationException("Policy document defines no item types");
        }
        WorkflowPolicy.Builder builder = WorkflowPolicy.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.itemType(field.getKey(), itemTypePolicy(field.getKey(), field.getValue()));
        }
        return builder.build();
    }

    private static ItemTypePolicy itemTypePolicy(String itemType, JsonNode node) {
        if (!node.isObject()) {
            throw new ValidationException("Policy for '" + itemType + "' must be an object");
        }
        node.fieldNames()
                .forEachRemaining(
                        name -> {
                            if (!KNOWN_FIELDS.contains(name)) {
                                throw new ValidationException(
                                        "Unknown field '"
                                                + name
                                                + "' in policy for '"
                                                + itemType
                                                + "'");
                            }
                        });
        JsonNode approvals = node.get(REQUIRED_APPROVALS);
        if (approvals == null || !approvals.canConvertToInt() || !approvals.isIntegralNumber()) {
            throw new ValidationException(
                    "Policy for '" + itemType + "' needs an integer " + REQUIRED_APPROVALS);
        }
        try {
            return new ItemTypePolicy(
                    passKinds(itemType, node, REQUIRED_PASSES, true),
                    passKinds(itemType, node, OPTIONAL_PASSES, false),
                    approvals.intValue());
        } catch (ValidationException e) {
            throw new ValidationException(
                    "Invalid policy for '" + itemType + "': " + e.getMessage(), e);
        }
    }

    private static Set<String> passKinds(
            String itemType, JsonNode node, String field, boolean mandatory) {
        JsonNode array = node.get(field);
        if (array == null || array.isNull()) {
            if (mandatory) {
                throw new ValidationException("Policy for '" + itemType + "' needs " + field);
            }
            return Set.of();
        }
        if (!array.isArray()) {
            throw new ValidationException(field + " of '" + itemType + "' must be an array");
        }
        Set<String> kinds = new LinkedHashSet<>();
        for (JsonNode element : array) {
            if (!element.isTextual() || element.asText().isBlank()) {
                throw new ValidationException(
                        field + " of '" + itemType + "' must contain non-blank strings");
            }
            kinds.add(element.asText());
        }
        return kinds;
    }
}
