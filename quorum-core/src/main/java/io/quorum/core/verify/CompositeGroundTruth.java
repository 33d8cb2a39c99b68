package io.quorum.core.verify;

import java.io.IOException;
import java.util.List;

/// Routes each check to the first delegate that supports the signal kind.
public class CompositeGroundTruth implements GroundTruth {

    private final List<GroundTruth> delegates;

    public CompositeGroundTruth(List<GroundTruth> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public boolean supports(ExpectedSignal.Kind kind) {
        return delegates.stream().anyMatch(d -> d.supports(kind));
    }

    @Override
    public GroundTruthCheck check(String targetResource, ExpectedSignal signal) throws IOException {
        for (GroundTruth delegate : delegates) {
            if (delegate.supports(signal.kind())) {
                return delegate.check(targetResource, signal);
            }
        }
        return GroundTruthCheck.unsatisfied("no ground truth can check '" + signal.asText() + "'");
    }
}
