package io.verdict.core.policy;

/// Well-known pass kind names.
///
/// Pass kinds are an open set validated against the workflow policy; these constants
/// only name the kinds the default policy and the role table refer to.
public final class PassKinds {

    public static final String STYLE = "style";
    public static final String FACT_CHECK = "fact_check";
    public static final String CONSISTENCY = "consistency";

    /// Pseudo-pass recording a human resolution of an escalated item. Recognised for
    /// every item type and never listed as a required kind.
    public static final String HUMAN_OVERRIDE = "human_override";

    private PassKinds() {}
}
