package io.verdict.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.verdict.core.review.Decision;
import io.verdict.core.review.ReviewPass;
import io.verdict.serialization.mixin.ReviewPassBuilderMixin;
import io.verdict.serialization.mixin.ReviewPassMixin;
import java.io.Serial;

/// Jackson module that teaches an `ObjectMapper` the review model.
///
/// Records ({@link io.verdict.core.review.ReviewSession},
/// {@link io.verdict.core.review.ItemReview}, {@link io.verdict.core.review.Escalation})
/// bind through their canonical constructors and need no help. This module covers the
/// rest:
///
/// - {@link ReviewPass} is built through its builder, configured via mixins
/// - {@link Decision} is written with its lower-case wire name
///
/// ### Usage
/// {@snippet :
/// ObjectMapper mapper = new ObjectMapper()
///         .registerModule(new VerdictJacksonModule())
///         .registerModule(new JavaTimeModule());
/// }
///
/// @see SessionSerializer#createMapper() for the fully configured mapper
public class VerdictJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 1L;

    public VerdictJacksonModule() {
        super("VerdictJacksonModule");
        addSerializer(Decision.class, new DecisionSerializer());
        addDeserializer(Decision.class, new DecisionDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        context.setMixInAnnotations(ReviewPass.class, ReviewPassMixin.class);
        context.setMixInAnnotations(ReviewPass.Builder.class, ReviewPassBuilderMixin.class);
    }
}
