package com.questrail.expectations.manifest;

import com.questrail.expectations.api.Result;
import com.questrail.expectations.condition.ConditionSynthesizer;
import com.questrail.expectations.condition.SynthesizedCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ExpectedReconciler
 * -----------------------------------------------------------------------------
 * Rewrites a test node's {@code expected} entries from the evidence recorded
 * since the last coalesce.
 *
 * <h2>Per tracked entry (stored order)</h2>
 * <ul>
 *   <li><b>No evidence</b>: kept verbatim. An entry that was not exercised is
 *       not evidence against it.</li>
 *   <li><b>All evidence agrees on S</b>: a conditional entry whose S equals
 *       the unconditional status is redundant and dropped; otherwise the
 *       stored value becomes S.</li>
 *   <li><b>Evidence disagrees, conditional entry</b>: the entry is dropped
 *       and all its evidence becomes unplaced, to be re-partitioned.</li>
 *   <li><b>Evidence disagrees, unconditional entry</b>: only the results
 *       that differ from the unconditional status become unplaced.</li>
 * </ul>
 *
 * <h2>Unplaced evidence</h2>
 * When every unplaced result has the same status and no stored entry received
 * evidence, one unconditional entry is written (unless it equals the
 * default). Otherwise the {@link ConditionSynthesizer} partitions the results
 * and each condition whose status differs from the unconditional status is
 * added.
 *
 * <h2>Collapse</h2>
 * A trailing unconditional entry equal to the default status is dropped, and
 * an {@code expected} attribute left without entries is removed.
 */
final class ExpectedReconciler
{
    private static final ConditionSynthesizer SYNTHESIZER = new ConditionSynthesizer();

    private ExpectedReconciler() {}

    static CoalesceOutcome reconcile(TestNode node) {
        ConditionalAttributes attributes = node.attributes();
        String defaultStatus = node.defaultStatus();

        // Fixed for the whole pass, even if the unconditional entry is rewritten below.
        String unconditionalStatus = attributes.get(TestNode.EXPECTED).orElse(defaultStatus);

        List<Result> unplaced = new ArrayList<>(node.unplacedEvidence());
        boolean trackedEvidence = false;
        int updated = 0;
        int removed = 0;
        int added = 0;

        for (TrackedCondition tracked : node.trackedConditions()) {
            List<Result> evidence = tracked.evidence();
            if (evidence.isEmpty()) {
                continue;
            }
            trackedEvidence = true;

            ConditionalValue entry = tracked.value();
            String status = evidence.get(0).status();

            if (allHaveStatus(evidence, status)) {
                if (!entry.isUnconditional() && status.equals(unconditionalStatus)) {
                    attributes.removeValue(TestNode.EXPECTED, entry);
                    removed++;
                } else if (!status.equals(entry.value())) {
                    entry.setValue(status);
                    updated++;
                }
            } else if (!entry.isUnconditional()) {
                attributes.removeValue(TestNode.EXPECTED, entry);
                removed++;
                unplaced.addAll(evidence);
            } else {
                for (Result result : evidence) {
                    if (!result.status().equals(unconditionalStatus)) {
                        unplaced.add(result);
                    }
                }
            }
        }

        if (!unplaced.isEmpty()) {
            String status = unplaced.get(0).status();
            if (!trackedEvidence && allHaveStatus(unplaced, status)) {
                if (!status.equals(defaultStatus)) {
                    attributes.set(TestNode.EXPECTED, status);
                    added++;
                }
            } else {
                for (SynthesizedCondition condition : SYNTHESIZER.synthesize(unplaced)) {
                    if (!condition.status().equals(unconditionalStatus)) {
                        attributes.set(TestNode.EXPECTED, condition.status(), condition.predicate());
                        added++;
                    }
                }
            }
        }

        List<ConditionalValue> entries = attributes.values(TestNode.EXPECTED);
        if (!entries.isEmpty()) {
            ConditionalValue last = entries.get(entries.size() - 1);
            if (last.isUnconditional() && Objects.equals(last.value(), defaultStatus)) {
                attributes.removeValue(TestNode.EXPECTED, last);
                removed++;
            }
        }
        if (attributes.has(TestNode.EXPECTED) && attributes.values(TestNode.EXPECTED).isEmpty()) {
            attributes.remove(TestNode.EXPECTED);
        }

        return new CoalesceOutcome(updated, removed, added);
    }

    private static boolean allHaveStatus(List<Result> results, String status) {
        for (Result result : results) {
            if (!result.status().equals(status)) {
                return false;
            }
        }
        return true;
    }
}
