package io.verdict.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.verdict.core.review.ReviewPass;

/// Jackson mixin for {@link ReviewPass}.
///
/// `ReviewPass` is immutable and built through {@link ReviewPass.Builder}. This mixin
/// points Jackson at the builder for deserialization so the core type stays free of
/// Jackson annotations. Serialization uses the public `getX` accessors; null optional
/// fields (`reviewerRole`, `severity`, `timestamp`) are omitted.
///
/// @apiNote Registered by {@link io.verdict.serialization.VerdictJacksonModule}; not
/// for direct use.
/// @see ReviewPassBuilderMixin for the builder-side configuration
@JsonDeserialize(builder = ReviewPass.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class ReviewPassMixin {}
