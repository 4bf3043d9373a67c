package io.verdict.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.verdict.core.exception.ValidationException;
import io.verdict.core.review.Decision;
import java.io.IOException;
import java.io.Serial;

/// Reads a {@link Decision} from its wire name, case-insensitively.
///
/// Unknown values are reported as a Jackson mapping error so callers see one failure
/// type for all malformed input.
public class DecisionDeserializer extends StdDeserializer<Decision> {

    @Serial private static final long serialVersionUID = 1L;

    public DecisionDeserializer() {
        super(Decision.class);
    }

    @Override
    public Decision deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String text = p.getValueAsString();
        try {
            return Decision.fromWireName(text);
        } catch (ValidationException e) {
            return (Decision) ctxt.handleWeirdStringValue(Decision.class, text, e.getMessage());
        }
    }
}
