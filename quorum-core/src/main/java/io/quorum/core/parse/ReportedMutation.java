package io.quorum.core.parse;

import io.quorum.core.verify.ExpectedSignal;

/// A mutation claim as a decoder extracted it.
///
/// @param targetResource the resource said to have changed
/// @param expectedSignal what ground truth should show
public record ReportedMutation(String targetResource, ExpectedSignal expectedSignal) {}
