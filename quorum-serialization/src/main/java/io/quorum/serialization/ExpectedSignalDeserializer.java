package io.quorum.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.quorum.core.verify.ExpectedSignal;
import java.io.IOException;
import java.io.Serial;

/// Reads an `ExpectedSignal` from its text form.
///
/// @implNote Package-private. Registered by {@link QuorumJacksonModule}.
/// @see ExpectedSignalSerializer for the inverse operation
class ExpectedSignalDeserializer extends StdDeserializer<ExpectedSignal> {

    @Serial private static final long serialVersionUID = -6180457932101255470L;

    ExpectedSignalDeserializer() {
        super(ExpectedSignal.class);
    }

    /// @throws IOException if the value is not a string or not a known signal
    @Override
    public ExpectedSignal deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            return (ExpectedSignal) ctx.handleUnexpectedToken(ExpectedSignal.class, p);
        }
        String text = p.getText();
        try {
            return ExpectedSignal.parse(text);
        } catch (IllegalArgumentException e) {
            throw ctx.weirdStringException(text, ExpectedSignal.class, e.getMessage());
        }
    }
}
