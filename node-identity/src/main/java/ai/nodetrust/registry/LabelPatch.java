// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A minimal set of label changes: labels to set, and labels to remove.
 * A patch only names the labels it changes, and leaves all others alone.
 */
public class LabelPatch {

    private final Map<String, String> set;
    private final Set<String> removed;

    private LabelPatch(Map<String, String> set, Set<String> removed) {
        this.set = Collections.unmodifiableMap(set);
        this.removed = Collections.unmodifiableSet(removed);
    }

    /** Returns the labels set by this, in insertion order */
    public Map<String, String> set() { return set; }

    /** Returns the labels removed by this, in insertion order */
    public Set<String> removed() { return removed; }

    public boolean isEmpty() { return set.isEmpty() && removed.isEmpty(); }

    /** Returns a copy of the given labels with this patch applied */
    public Map<String, String> applyTo(Map<String, String> labels) {
        Map<String, String> patched = new LinkedHashMap<>(labels);
        patched.putAll(set);
        removed.forEach(patched::remove);
        return patched;
    }

    /** Returns a builder recording only the changes which differ from the given current labels */
    public static Builder against(Map<String, String> currentLabels) {
        return new Builder(currentLabels);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LabelPatch that = (LabelPatch) o;
        return set.equals(that.set) && removed.equals(that.removed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(set, removed);
    }

    @Override
    public String toString() {
        return "label patch setting " + set + ", removing " + removed;
    }

    public static class Builder {

        private final Map<String, String> current;
        private final Map<String, String> set = new LinkedHashMap<>();
        private final Set<String> removed = new LinkedHashSet<>();

        private Builder(Map<String, String> current) {
            this.current = Map.copyOf(current);
        }

        /** Sets the label to the given value, unless it already has this value */
        public Builder set(String key, String value) {
            Objects.requireNonNull(key);
            Objects.requireNonNull(value);
            removed.remove(key);
            if (value.equals(current.get(key)))
                set.remove(key);
            else
                set.put(key, value);
            return this;
        }

        /** Removes the label, unless it is already absent */
        public Builder remove(String key) {
            Objects.requireNonNull(key);
            set.remove(key);
            if (current.containsKey(key))
                removed.add(key);
            return this;
        }

        public LabelPatch build() {
            return new LabelPatch(new LinkedHashMap<>(set), new LinkedHashSet<>(removed));
        }

    }

}
