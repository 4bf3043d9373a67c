package io.verdict.core.access;

import io.verdict.core.policy.PassKinds;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Access policy keyed on the caller's agent role.
///
/// | Role | Create | Submit | Read | Escalate | Merge |
/// |---|---|---|---|---|---|
/// | `content_agent` | yes | no | yes | no | no |
/// | `style_agent` | no | `style` | yes | no | no |
/// | `fact_check_agent` | no | `fact_check` | yes | no | no |
/// | `consistency_agent` | no | `consistency` | yes | no | no |
/// | `approval_agent` | yes | any kind | yes | yes | yes |
/// | no role (operator) | yes | any kind | yes | yes | yes |
/// | any other role | no | no | yes | no | no |
///
/// Submissions and escalations are further limited to the caller's item-type scope.
public final class RoleBasedAccessPolicy implements AccessPolicy {

    private static final Logger logger = Logger.getLogger(RoleBasedAccessPolicy.class.getName());

    public static final String CONTENT_AGENT = "content_agent";
    public static final String STYLE_AGENT = "style_agent";
    public static final String FACT_CHECK_AGENT = "fact_check_agent";
    public static final String CONSISTENCY_AGENT = "consistency_agent";
    public static final String APPROVAL_AGENT = "approval_agent";

    private static final Map<String, String> REVIEW_KIND_BY_ROLE =
            Map.of(
                    STYLE_AGENT, PassKinds.STYLE,
                    FACT_CHECK_AGENT, PassKinds.FACT_CHECK,
                    CONSISTENCY_AGENT, PassKinds.CONSISTENCY);

    private static final Set<String> CREATORS = Set.of(CONTENT_AGENT, APPROVAL_AGENT);

    @Override
    public boolean isAllowed(CallerContext caller, Operation operation, AccessTarget target) {
        Objects.requireNonNull(caller, "caller must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(target, "target must not be null");

        if (operation == Operation.READ) {
            return true;
        }
        if (target.itemType() != null && !caller.covers(target.itemType())) {
            logger.fine(
                    () ->
                            "Item type "
                                    + target.itemType()
                                    + " outside scope of "
                                    + caller.callerId());
            return false;
        }

        String role = caller.role();
        if (role == null || APPROVAL_AGENT.equals(role)) {
            return true;
        }
        return switch (operation) {
            case CREATE_SESSION -> CREATORS.contains(role);
            case SUBMIT_REVIEW ->
                    target.passKind() != null
                            && target.passKind().equals(REVIEW_KIND_BY_ROLE.get(role));
            default -> false;
        };
    }
}
