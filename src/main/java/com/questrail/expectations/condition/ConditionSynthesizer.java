package com.questrail.expectations.condition;

import com.questrail.expectations.api.Result;
import com.questrail.expectations.expr.BinaryExpression;
import com.questrail.expectations.expr.Expression;
import com.questrail.expectations.expr.NumberLiteral;
import com.questrail.expectations.expr.StringLiteral;
import com.questrail.expectations.expr.UnaryExpression;
import com.questrail.expectations.expr.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ConditionSynthesizer
 * -----------------------------------------------------------------------------
 * Builds a minimal set of conditions that discriminate between results whose
 * statuses diverge.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>For every (property, value) pair found in any result's descriptor,
 *       collect the distinct statuses of the results carrying that pair. Each
 *       pair is a <em>candidate discriminator</em>.</li>
 *   <li>When there is more than one result, drop every candidate whose
 *       distinct-status count equals the <em>total</em> number of results.</li>
 *   <li>Of the surviving candidates' property names, keep those listed in
 *       {@link #DISCRIMINATOR_PRIORITY}, in that order.</li>
 *   <li>Group the results by their <em>signature</em>: the bindings of the
 *       kept properties in each result's own descriptor. Each distinct
 *       signature yields one condition whose status is that of the first
 *       result seen with the signature.</li>
 *   <li>The predicate is a right-nested {@code and} chain of per-property
 *       tests in priority order.</li>
 * </ol>
 *
 * <p>Step 2 compares against the total result count, not the number of
 * results sharing the value, so small result sets can keep candidates that
 * do not actually narrow the outcome. Step 4 silently keeps the first status
 * when two results share a signature, which makes the outcome depend on the
 * order evidence arrived in.</p>
 *
 * <p>The synthesizer is stateless.</p>
 */
public final class ConditionSynthesizer
{
    private static final Logger log = LoggerFactory.getLogger(ConditionSynthesizer.class);

    /**
     * Fixed order in which environment properties are considered as
     * discriminators and in which they appear in synthesized predicates.
     */
    public static final List<String> DISCRIMINATOR_PRIORITY =
            List.of("debug", "os", "version", "processor", "bits");

    /**
     * Properties compiled to a bare variable test rather than an equality.
     */
    public static final Set<String> BOOLEAN_PROPERTIES = Set.of("debug");

    /**
     * Synthesizes conditions for the given results.
     *
     * @param results non-empty results, normally with at least two statuses
     * @return one condition per distinct signature, in first-seen order
     * @throws ConditionSynthesisException if no discriminator survives or a
     *         result lacks a selected discriminator property
     */
    public List<SynthesizedCondition> synthesize(List<Result> results) {
        Objects.requireNonNull(results, "results");
        if (results.isEmpty()) {
            throw new IllegalArgumentException("results must not be empty");
        }

        List<String> discriminators = selectDiscriminators(results);
        if (discriminators.isEmpty()) {
            throw new ConditionSynthesisException(
                    "No environment property discriminates between " + results.size() + " results"
            );
        }
        log.debug("Discriminating {} results on {}", results.size(), discriminators);

        Map<List<PropertyBinding>, SynthesizedCondition> conditions = new LinkedHashMap<>();
        for (Result result : results) {
            List<PropertyBinding> signature = signatureOf(result, discriminators);
            if (conditions.containsKey(signature)) {
                // First status seen for a signature wins.
                continue;
            }
            conditions.put(signature,
                    new SynthesizedCondition(signature, buildPredicate(signature), result.status()));
        }
        return List.copyOf(conditions.values());
    }

    /**
     * Steps 1 to 3: candidate collection, pruning and priority selection.
     */
    List<String> selectDiscriminators(List<Result> results) {
        Map<PropertyBinding, Set<String>> statusesByCandidate = new LinkedHashMap<>();
        for (Result result : results) {
            for (Map.Entry<String, Object> property : result.descriptor().asMap().entrySet()) {
                statusesByCandidate
                        .computeIfAbsent(new PropertyBinding(property.getKey(), property.getValue()),
                                k -> new LinkedHashSet<>())
                        .add(result.status());
            }
        }

        if (results.size() > 1) {
            statusesByCandidate.values().removeIf(statuses -> statuses.size() == results.size());
        }

        Set<String> candidateProperties = new LinkedHashSet<>();
        for (PropertyBinding candidate : statusesByCandidate.keySet()) {
            candidateProperties.add(candidate.property());
        }

        List<String> selected = new ArrayList<>();
        for (String property : DISCRIMINATOR_PRIORITY) {
            if (candidateProperties.contains(property)) {
                selected.add(property);
            }
        }
        return selected;
    }

    private static List<PropertyBinding> signatureOf(Result result, List<String> discriminators) {
        List<PropertyBinding> signature = new ArrayList<>(discriminators.size());
        for (String property : discriminators) {
            Object value = result.descriptor().get(property).orElseThrow(() ->
                    new ConditionSynthesisException(
                            "Result " + result + " has no value for discriminator '" + property + "'"));
            signature.add(new PropertyBinding(property, value));
        }
        return signature;
    }

    /**
     * Builds the conjunction of per-property tests for a signature. The first
     * binding becomes the outermost left operand, so it is tested first.
     *
     * @param signature non-empty bindings in priority order
     */
    public static Expression buildPredicate(List<PropertyBinding> signature) {
        if (signature.isEmpty()) {
            throw new IllegalArgumentException("signature must not be empty");
        }

        List<Expression> tests = new ArrayList<>(signature.size());
        for (PropertyBinding binding : signature) {
            tests.add(propertyTest(binding));
        }

        Expression chain = tests.get(tests.size() - 1);
        for (int i = tests.size() - 2; i >= 0; i--) {
            chain = BinaryExpression.and(tests.get(i), chain);
        }
        return chain;
    }

    private static Expression propertyTest(PropertyBinding binding) {
        Variable variable = new Variable(binding.property());
        Object value = binding.value();

        if (BOOLEAN_PROPERTIES.contains(binding.property())) {
            return isTrue(value) ? variable : UnaryExpression.not(variable);
        }
        Expression literal = value instanceof Number n
                ? NumberLiteral.of(n)
                : new StringLiteral(String.valueOf(value));
        return BinaryExpression.equalTo(variable, literal);
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        return !String.valueOf(value).isEmpty();
    }
}
