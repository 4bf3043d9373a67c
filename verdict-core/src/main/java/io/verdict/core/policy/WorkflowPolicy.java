package io.verdict.core.policy;

import io.verdict.core.exception.ValidationException;
import io.verdict.core.review.ReviewPass;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Read-only review requirements per item type.
///
/// The engine consumes a policy but never changes it. Item status is always re-derived
/// from passes and the policy in force, so replacing the policy takes effect on the next
/// read or write of each item.
///
/// ### Usage
/// {@snippet :
/// WorkflowPolicy policy = WorkflowPolicy.builder()
///     .itemType("pages", ItemTypePolicy.of(1, "style", "fact_check"))
///     .build();
/// }
///
/// @see ItemTypePolicy
public final class WorkflowPolicy {

    private final Map<String, ItemTypePolicy> itemTypes;

    private WorkflowPolicy(Map<String, ItemTypePolicy> itemTypes) {
        this.itemTypes = Collections.unmodifiableMap(new LinkedHashMap<>(itemTypes));
    }

    /// Returns the default workflow for course content.
    ///
    /// | Item type | Required passes | Approvals |
    /// |---|---|---|
    /// | `pages` | style, fact_check, consistency | 1 |
    /// | `quizzes` | style, fact_check, consistency | 2 |
    /// | `assignments` | fact_check, consistency, style | 2 |
    /// | `rubrics` | consistency, style | 1 |
    ///
    /// @return the default policy, never null
    public static WorkflowPolicy defaults() {
        return builder()
                .itemType(
                        "pages",
                        ItemTypePolicy.of(
                                1, PassKinds.STYLE, PassKinds.FACT_CHECK, PassKinds.CONSISTENCY))
                .itemType(
                        "quizzes",
                        ItemTypePolicy.of(
                                2, PassKinds.STYLE, PassKinds.FACT_CHECK, PassKinds.CONSISTENCY))
                .itemType(
                        "assignments",
                        ItemTypePolicy.of(
                                2, PassKinds.FACT_CHECK, PassKinds.CONSISTENCY, PassKinds.STYLE))
                .itemType("rubrics", ItemTypePolicy.of(1, PassKinds.CONSISTENCY, PassKinds.STYLE))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ItemTypePolicy> find(String itemType) {
        return Optional.ofNullable(itemTypes.get(itemType));
    }

    /// Returns the policy for an item type.
    ///
    /// @param itemType item type key, not null
    /// @return the item type's policy, never null
    /// @throws ValidationException if the type is not configured
    public ItemTypePolicy forItemType(String itemType) {
        ItemTypePolicy policy = itemTypes.get(itemType);
        if (policy == null) {
            throw new ValidationException("No workflow policy for item type: " + itemType);
        }
        return policy;
    }

    /// Validates that a pass may be recorded for an item of the given type.
    ///
    /// @param itemType type of the reviewed item, not null
    /// @param pass the submitted pass, not null
    /// @throws ValidationException if the type is unknown or does not recognise the
    /// pass kind
    public void validatePass(String itemType, ReviewPass pass) {
        ItemTypePolicy policy = forItemType(itemType);
        if (!policy.recognizes(pass.getPassKind())) {
            throw new ValidationException(
                    "Pass kind '"
                            + pass.getPassKind()
                            + "' is not recognised for item type '"
                            + itemType
                            + "'; expected one of "
                            + policy.requiredPassKinds());
        }
    }

    /// Returns every configured item type and its policy.
    ///
    /// @return immutable map in declaration order, never null
    public Map<String, ItemTypePolicy> itemTypes() {
        return itemTypes;
    }

    /// Builder for {@link WorkflowPolicy}.
    public static final class Builder {
        private final Map<String, ItemTypePolicy> itemTypes = new LinkedHashMap<>();

        private Builder() {}

        public Builder itemType(String itemType, ItemTypePolicy policy) {
            Objects.requireNonNull(itemType, "itemType must not be null");
            itemTypes.put(itemType, Objects.requireNonNull(policy, "policy must not be null"));
            return this;
        }

        public Builder itemTypes(Map<String, ItemTypePolicy> policies) {
            policies.forEach(this::itemType);
            return this;
        }

        public WorkflowPolicy build() {
            return new WorkflowPolicy(itemTypes);
        }
    }

    @Override
    public String toString() {
        return "WorkflowPolicy" + itemTypes;
    }
}
