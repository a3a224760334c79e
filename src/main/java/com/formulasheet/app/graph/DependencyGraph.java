package com.formulasheet.app.graph;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A set of ordered pairs (s, t) of names, read as "t depends on s":
 * s has to be evaluated before t. Call s a dependee of t and t a dependent of s.
 * <p>
 * For example, with pairs {(a,b), (a,c), (b,d), (d,d)}:
 * dependents(a) = {b, c}, dependents(d) = {d}, dependees(b) = {a}, dependees(d) = {b, d}.
 * <p>
 * Two adjacency maps mirror each other: t is in dependents[s] exactly when s is in
 * dependees[t]. Self loops are allowed; rejecting cycles is up to the caller.
 * Sets keep insertion order, so traversals are repeatable.
 */
public class DependencyGraph {

    // s -> every t with (s, t)
    private final Map<String, Set<String>> dependents = new HashMap<>();
    // t -> every s with (s, t)
    private final Map<String, Set<String>> dependees = new HashMap<>();
    private int size;

    /**
     * Number of ordered pairs in the graph.
     */
    public int size() {
        return size;
    }

    public int numDependees(String s) {
        return dependees.getOrDefault(s, Collections.emptySet()).size();
    }

    public boolean hasDependents(String s) {
        return !dependents.getOrDefault(s, Collections.emptySet()).isEmpty();
    }

    public boolean hasDependees(String s) {
        return !dependees.getOrDefault(s, Collections.emptySet()).isEmpty();
    }

    /**
     * A copy of the names that depend on {@code s}.
     */
    public Set<String> getDependents(String s) {
        return new LinkedHashSet<>(dependents.getOrDefault(s, Collections.emptySet()));
    }

    /**
     * A copy of the names {@code s} depends on.
     */
    public Set<String> getDependees(String s) {
        return new LinkedHashSet<>(dependees.getOrDefault(s, Collections.emptySet()));
    }

    /**
     * Adds (s, t) unless it is already present.
     */
    public void addDependency(String s, String t) {
        if (dependents.computeIfAbsent(s, k -> new LinkedHashSet<>()).add(t)) {
            dependees.computeIfAbsent(t, k -> new LinkedHashSet<>()).add(s);
            size++;
        }
    }

    /**
     * Removes (s, t) if it is present.
     */
    public void removeDependency(String s, String t) {
        Set<String> out = dependents.get(s);
        if (out != null && out.remove(t)) {
            Set<String> in = dependees.get(t);
            in.remove(s);
            if (in.isEmpty()) {
                dependees.remove(t);
            }
            if (out.isEmpty()) {
                dependents.remove(s);
            }
            size--;
        }
    }

    /**
     * Removes every pair (s, r), then adds (s, t) for each t in {@code newDependents}.
     */
    public void replaceDependents(String s, Iterable<String> newDependents) {
        for (String t : getDependents(s)) {
            removeDependency(s, t);
        }
        for (String t : newDependents) {
            addDependency(s, t);
        }
    }

    /**
     * Removes every pair (r, s), then adds (t, s) for each t in {@code newDependees}.
     */
    public void replaceDependees(String s, Iterable<String> newDependees) {
        for (String t : getDependees(s)) {
            removeDependency(t, s);
        }
        for (String t : newDependees) {
            addDependency(t, s);
        }
    }
}
