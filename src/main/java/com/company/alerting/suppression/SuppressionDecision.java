package com.company.alerting.suppression;

import com.company.alerting.domain.AlertEvent;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class SuppressionDecision {

    public static final SuppressionDecision NONE = new SuppressionDecision(List.of());

    List<CompositeOutcome> outcomes;

    public List<AlertEvent> emitted() {
        return outcomes.stream()
                .filter(o -> o.getAction() == CompositeOutcome.Action.EMIT)
                .map(CompositeOutcome::getComposite)
                .collect(Collectors.toList());
    }

    public List<CompositeOutcome> skipped() {
        return outcomes.stream()
                .filter(CompositeOutcome::isSkipped)
                .collect(Collectors.toList());
    }

    public long heldCount() {
        return outcomes.stream()
                .filter(o -> o.getAction() == CompositeOutcome.Action.HOLD)
                .count();
    }
}
