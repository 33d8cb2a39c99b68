package io.quorum.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.quorum.core.report.FinalReport;
import io.quorum.core.verify.ExpectedSignal;
import io.quorum.serialization.mixin.FinalReportMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the serialization configuration of the
/// report model in one place.
///
/// - `ExpectedSignal` is written and read in its text form
/// - `FinalReport` gets a mixin that drops derived accessors and fixes field order
///
/// Every other report type is a record and binds through its canonical constructor.
///
/// @see ReportSerializer for the convenience factory API
public class QuorumJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2609315704786217749L;

    public QuorumJacksonModule() {
        super("QuorumJacksonModule");

        addSerializer(ExpectedSignal.class, new ExpectedSignalSerializer());
        addDeserializer(ExpectedSignal.class, new ExpectedSignalDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(FinalReport.class, FinalReportMixin.class);
    }
}
