package io.quorum.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.quorum.core.verify.ExpectedSignal;
import java.io.IOException;
import java.io.Serial;

/// Writes an `ExpectedSignal` as its text form, e.g. `"present"` or `"contains:version=2"`.
///
/// @implNote Package-private. Registered by {@link QuorumJacksonModule}.
/// @see ExpectedSignalDeserializer for the inverse operation
class ExpectedSignalSerializer extends StdSerializer<ExpectedSignal> {

    @Serial private static final long serialVersionUID = 4418806272351040713L;

    ExpectedSignalSerializer() {
        super(ExpectedSignal.class);
    }

    @Override
    public void serialize(ExpectedSignal signal, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(signal.asText());
    }
}
