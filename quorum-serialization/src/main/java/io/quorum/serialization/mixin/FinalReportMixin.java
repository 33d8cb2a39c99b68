package io.quorum.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for `FinalReport`.
///
/// Puts the header fields first and drops `incomplete`, which is derived from
/// `warning`.
@JsonIgnoreProperties({"incomplete"})
@JsonPropertyOrder({
    "corpusName",
    "warning",
    "coveragePct",
    "statistics",
    "findings",
    "minorityViews",
    "escalations",
    "coverage"
})
public abstract class FinalReportMixin {}
