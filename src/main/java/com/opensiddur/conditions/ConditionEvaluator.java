package com.opensiddur.conditions;

import com.opensiddur.models.CombinatorCondition;
import com.opensiddur.models.Condition;
import com.opensiddur.models.FeatureCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates condition expressions against the current feature values.
 */
public class ConditionEvaluator {

    public Truth evaluate(Condition condition, FeatureLookup lookup) {
        if (condition == null) {
            return Truth.UNDEFINED;
        }
        if (condition instanceof FeatureCondition) {
            FeatureCondition leaf = (FeatureCondition) condition;
            return FeatureMatcher.match(lookup.current(leaf.key()), leaf.getValue());
        }
        if (condition instanceof CombinatorCondition) {
            CombinatorCondition combinator = (CombinatorCondition) condition;
            List<Truth> operands = new ArrayList<>();
            for (Condition sub : combinator.getConditions()) {
                operands.add(evaluate(sub, lookup));
            }
            switch (combinator.operator()) {
                case ALL:
                    return TruthTables.all(operands);
                case ANY:
                    return TruthTables.any(operands);
                case NONE:
                    return TruthTables.none(operands);
                case ONE:
                    return TruthTables.one(operands);
                default:
                    throw new IllegalStateException("Unknown operator " + combinator.operator());
            }
        }
        throw new IllegalArgumentException("Unsupported condition type: " + condition.getClass().getSimpleName());
    }
}
