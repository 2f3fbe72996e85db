package com.opensiddur.settings;

import com.opensiddur.conditions.FeatureLookup;
import com.opensiddur.errors.UnbalancedScopeException;
import com.opensiddur.models.FeatureKey;
import com.opensiddur.models.FeatureStructure;
import com.opensiddur.models.FeatureValue;
import com.opensiddur.models.ScopeOwner;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Current value of every feature during one compile.
 *
 * Each feature has its own stack of declared values. A declare pushes onto the stacks of the
 * features it assigns; the matching end removes that declare's frames wherever they sit, so
 * scopes may end in any order. Derived features are recomputed as soon as an input changes,
 * and an explicit declaration of a derived feature takes precedence over the computed value.
 *
 * Not thread-safe: one tracker per compile.
 */
public class ScopeTracker implements FeatureLookup {

    private final Map<FeatureKey, LinkedList<ScopeFrame>> stacks = new HashMap<>();
    private final Map<ScopeOwner, List<FeatureKey>> openDeclares = new LinkedHashMap<>();
    private final Map<FeatureKey, FeatureValue> derivedValues = new HashMap<>();
    private final List<DerivedFeature> derived;

    public ScopeTracker() {
        this(DerivedFeatures.all());
    }

    public ScopeTracker(List<DerivedFeature> derived) {
        this.derived = List.copyOf(derived);
        List<FeatureKey> all = new ArrayList<>();
        for (DerivedFeature feature : this.derived) {
            all.add(feature.getKey());
        }
        recompute(all);
    }

    public void declare(ScopeOwner owner, List<FeatureStructure> assignments) {
        if (openDeclares.containsKey(owner)) {
            throw new UnbalancedScopeException("declare '" + owner.id() + "' is already open");
        }
        List<FeatureKey> keys = new ArrayList<>();
        for (FeatureStructure structure : assignments) {
            for (Map.Entry<String, FeatureValue> assignment : structure.getFeatures().entrySet()) {
                FeatureKey key = FeatureKey.of(structure.getName(), assignment.getKey());
                FeatureValue value = assignment.getValue() != null ? assignment.getValue() : FeatureValue.undefined();
                stacks.computeIfAbsent(key, k -> new LinkedList<>()).push(new ScopeFrame(value, owner));
                keys.add(key);
            }
        }
        openDeclares.put(owner, keys);
        recompute(keys);
    }

    /**
     * Undo the declare opened by {@code owner}.
     *
     * @throws UnbalancedScopeException if no such declare is open
     */
    public void endDeclare(ScopeOwner owner) {
        List<FeatureKey> keys = openDeclares.remove(owner);
        if (keys == null) {
            throw new UnbalancedScopeException("no open declare with id '" + owner.id() + "'");
        }
        for (FeatureKey key : keys) {
            LinkedList<ScopeFrame> stack = stacks.get(key);
            if (stack == null) {
                continue;
            }
            Iterator<ScopeFrame> frames = stack.iterator();
            while (frames.hasNext()) {
                if (frames.next().owner().equals(owner)) {
                    frames.remove();
                }
            }
            if (stack.isEmpty()) {
                stacks.remove(key);
            }
        }
        recompute(keys);
    }

    public boolean isOpen(ScopeOwner owner) {
        return openDeclares.containsKey(owner);
    }

    /**
     * End every declare opened during the given document visit; returns their ids.
     */
    public List<String> endVisit(long visit) {
        List<ScopeOwner> owned = new ArrayList<>();
        for (ScopeOwner owner : openDeclares.keySet()) {
            if (owner.visit() == visit) {
                owned.add(owner);
            }
        }
        List<String> ids = new ArrayList<>();
        for (int i = owned.size() - 1; i >= 0; i--) {
            endDeclare(owned.get(i));
            ids.add(owned.get(i).id());
        }
        return ids;
    }

    @Override
    public FeatureValue current(FeatureKey key) {
        LinkedList<ScopeFrame> stack = stacks.get(key);
        if (stack != null && !stack.isEmpty()) {
            return stack.peek().value();
        }
        FeatureValue computed = derivedValues.get(key);
        return computed != null ? computed : FeatureValue.defaultValue();
    }

    /**
     * Every feature with a value other than DEFAULT.
     */
    public Map<FeatureKey, FeatureValue> snapshot() {
        Map<FeatureKey, FeatureValue> values = new LinkedHashMap<>();
        for (FeatureKey key : stacks.keySet()) {
            values.put(key, current(key));
        }
        for (FeatureKey key : derivedValues.keySet()) {
            values.putIfAbsent(key, current(key));
        }
        return values;
    }

    public int openDeclareCount() {
        return openDeclares.size();
    }

    private void recompute(Collection<FeatureKey> changed) {
        Set<FeatureKey> dirty = new HashSet<>(changed);
        for (DerivedFeature feature : derived) {
            boolean affected = dirty.contains(feature.getKey());
            for (FeatureKey input : feature.getInputs()) {
                affected |= dirty.contains(input);
            }
            if (!affected) {
                continue;
            }
            FeatureValue value = feature.compute(this);
            FeatureValue previous = derivedValues.put(feature.getKey(), value);
            if (!value.equals(previous)) {
                dirty.add(feature.getKey());
            }
        }
    }
}
