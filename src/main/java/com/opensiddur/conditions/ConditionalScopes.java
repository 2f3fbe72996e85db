package com.opensiddur.conditions;

import com.opensiddur.models.ScopeOwner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conditional regions currently open during a compile, with the decision taken when each opened.
 * Regions may overlap in any order; content is excluded while any open region decided FALSE.
 */
public class ConditionalScopes {

    private final Map<ScopeOwner, Truth> open = new LinkedHashMap<>();
    private int falseCount;

    public void open(ScopeOwner owner, Truth decision) {
        Truth previous = open.put(owner, decision);
        if (previous == Truth.FALSE) {
            falseCount--;
        }
        if (decision == Truth.FALSE) {
            falseCount++;
        }
    }

    /**
     * @return false if no region with this owner is open
     */
    public boolean close(ScopeOwner owner) {
        if (!open.containsKey(owner)) {
            return false;
        }
        Truth decision = open.remove(owner);
        if (decision == Truth.FALSE) {
            falseCount--;
        }
        return true;
    }

    /**
     * Close every region opened during the given document visit; returns the ids closed.
     */
    public List<String> closeVisit(long visit) {
        List<ScopeOwner> owned = new ArrayList<>();
        for (ScopeOwner owner : open.keySet()) {
            if (owner.visit() == visit) {
                owned.add(owner);
            }
        }
        List<String> ids = new ArrayList<>();
        for (ScopeOwner owner : owned) {
            close(owner);
            ids.add(owner.id());
        }
        return ids;
    }

    public boolean isOpen(ScopeOwner owner) {
        return open.containsKey(owner);
    }

    public Truth decision(ScopeOwner owner) {
        return open.get(owner);
    }

    public boolean isExcluding() {
        return falseCount > 0;
    }

    public int openCount() {
        return open.size();
    }
}
