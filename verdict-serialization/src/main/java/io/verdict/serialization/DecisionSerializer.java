package io.verdict.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.verdict.core.review.Decision;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link Decision} as its lower-case wire name.
public class DecisionSerializer extends StdSerializer<Decision> {

    @Serial private static final long serialVersionUID = 1L;

    public DecisionSerializer() {
        super(Decision.class);
    }

    @Override
    public void serialize(Decision value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(value.wireName());
    }
}
