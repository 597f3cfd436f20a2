package com.rastertopo.server.labeling;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Provisional labels and the equivalences recorded between them, kept as a
 * disjoint-set forest. The root of every class is its smallest member, so
 * {@link #representative(int)} always answers the class minimum.
 */
public class EquivalenceClasses {

    // parents.get(label) is the parent of label; index 0 is the unused background slot
    private final List<Integer> parents = new ArrayList<>();

    public EquivalenceClasses() {
        parents.add(0);
    }

    /** Mints the next provisional label, starting at 1, as a class of its own. */
    public int newLabel() {
        int label = parents.size();
        parents.add(label);
        return label;
    }

    public int size() {
        return parents.size() - 1;
    }

    public void union(int a, int b) {
        int rootA = representative(a);
        int rootB = representative(b);
        if (rootA == rootB) {
            return;
        }
        if (rootA < rootB) {
            parents.set(rootB, rootA);
        } else {
            parents.set(rootA, rootB);
        }
    }

    public int representative(int label) {
        checkLabel(label);
        int root = label;
        while (parents.get(root) != root) {
            root = parents.get(root);
        }
        // path compression
        int current = label;
        while (current != root) {
            int next = parents.get(current);
            parents.set(current, root);
            current = next;
        }
        return root;
    }

    public int classCount() {
        int count = 0;
        for (int label = 1; label < parents.size(); label++) {
            if (parents.get(label) == label) {
                count++;
            }
        }
        return count;
    }

    /** Every class keyed by its representative. */
    public Map<Integer, SortedSet<Integer>> classes() {
        Map<Integer, SortedSet<Integer>> classes = new TreeMap<>();
        for (int label = 1; label < parents.size(); label++) {
            classes.computeIfAbsent(representative(label), k -> new TreeSet<>()).add(label);
        }
        return classes;
    }

    private void checkLabel(int label) {
        if (label < 1 || label >= parents.size()) {
            throw new IllegalArgumentException("Unknown provisional label " + label);
        }
    }
}
