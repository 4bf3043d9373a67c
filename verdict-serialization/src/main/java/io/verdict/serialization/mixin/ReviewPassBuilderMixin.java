package io.verdict.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for {@link io.verdict.core.review.ReviewPass.Builder}.
///
/// The builder uses bare setter names (`passKind(...)`, `decision(...)`) rather than
/// `withPassKind(...)`, so the prefix is cleared.
///
/// @see ReviewPassMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class ReviewPassBuilderMixin {}
