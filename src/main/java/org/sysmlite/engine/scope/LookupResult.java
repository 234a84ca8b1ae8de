package org.sysmlite.engine.scope;

import org.sysmlite.kerml.m3.Element;
import org.sysmlite.kerml.m3.Membership;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of looking a name up in a scope.
 *
 * {@link Status#PRUNED} means the only match was the skipped element; outer
 * scopes are consulted as if nothing was found.
 */
public final class LookupResult {

    public enum Status {
        FOUND,
        NOT_FOUND,
        AMBIGUOUS,
        PRUNED
    }

    public static final LookupResult NOT_FOUND = new LookupResult(Status.NOT_FOUND, List.of());
    public static final LookupResult PRUNED = new LookupResult(Status.PRUNED, List.of());

    private final Status status;
    private final List<Membership> candidates;

    private LookupResult(Status status, List<Membership> candidates) {
        this.status = status;
        this.candidates = List.copyOf(candidates);
    }

    public static LookupResult found(Membership membership) {
        return new LookupResult(Status.FOUND, List.of(membership));
    }

    public static LookupResult ambiguous(List<Membership> candidates) {
        return new LookupResult(Status.AMBIGUOUS, candidates);
    }

    /**
     * Classifies the memberships matching a name at one scope level. Several
     * memberships of the same element count as one candidate.
     */
    static LookupResult fromCandidates(List<Membership> memberships, LookupContext context) {
        Map<Element, Membership> distinct = new LinkedHashMap<>();
        boolean pruned = false;
        for (Membership membership : memberships) {
            Element element = membership.memberElement();
            if (element == null) {
                continue;
            }
            if (context.isSkipped(membership, element)) {
                pruned = true;
                continue;
            }
            if (context.accepts(element)) {
                distinct.putIfAbsent(element, membership);
            }
        }
        if (distinct.size() == 1) {
            return found(distinct.values().iterator().next());
        }
        if (distinct.size() > 1) {
            return ambiguous(new ArrayList<>(distinct.values()));
        }
        return pruned ? PRUNED : NOT_FOUND;
    }

    /**
     * Combines results of scopes at the same level, e.g. of several supertypes.
     */
    static LookupResult merge(List<LookupResult> results) {
        Map<Element, Membership> distinct = new LinkedHashMap<>();
        boolean pruned = false;
        for (LookupResult result : results) {
            switch (result.status) {
                case FOUND, AMBIGUOUS -> result.candidates.forEach(m -> distinct.putIfAbsent(m.memberElement(), m));
                case PRUNED -> pruned = true;
                default -> {
                    // nothing to add
                }
            }
        }
        if (distinct.size() == 1) {
            return found(distinct.values().iterator().next());
        }
        if (distinct.size() > 1) {
            return ambiguous(new ArrayList<>(distinct.values()));
        }
        return pruned ? PRUNED : NOT_FOUND;
    }

    public Status status() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isAmbiguous() {
        return status == Status.AMBIGUOUS;
    }

    /**
     * @return true if the lookup is settled at this level
     */
    public boolean isDecided() {
        return status == Status.FOUND || status == Status.AMBIGUOUS;
    }

    public Membership membership() {
        return isFound() ? candidates.get(0) : null;
    }

    public Element element() {
        return isFound() ? candidates.get(0).memberElement() : null;
    }

    public List<Membership> candidates() {
        return candidates;
    }

    @Override
    public String toString() {
        return status + (candidates.isEmpty() ? "" : candidates.toString());
    }
}
