package pulsestream.domain;

import java.util.List;
import java.util.Objects;

/**
 * A named, pre-recorded sequence of event offsets in milliseconds from the start of the sequence.
 * The intervals between consecutive offsets are computed once, at construction.
 */
public final class ScenarioDefinition {
    private final String name;
    private final List<Long> offsets;
    private final List<Long> intervals;

    /**
     * @param name the scenario name
     * @param offsets non-negative, non-decreasing offsets; at least two are needed to yield an interval
     * @throws IllegalArgumentException if the offsets break those rules
     */
    public ScenarioDefinition(String name, List<Long> offsets) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(offsets, "offsets cannot be null");

        if (offsets.size() < 2) {
            throw new IllegalArgumentException(
                    "Scenario " + name + " needs at least two offsets, found " + offsets.size());
        }

        Long[] derived = new Long[offsets.size() - 1];
        long previous = -1;
        for (int i = 0; i < offsets.size(); i++) {
            Long offset = offsets.get(i);
            if (offset == null || offset < 0) {
                throw new IllegalArgumentException("Scenario " + name + " has an invalid offset at index " + i);
            }
            if (offset < previous) {
                throw new IllegalArgumentException(
                        "Scenario " + name + " offsets decrease at index " + i + " (" + previous + " -> " + offset + ")");
            }
            if (i > 0) {
                derived[i - 1] = offset - previous;
            }
            previous = offset;
        }

        this.offsets = List.copyOf(offsets);
        this.intervals = List.of(derived);
    }

    public String name() {
        return name;
    }

    public List<Long> offsets() {
        return offsets;
    }

    /**
     * @return the gaps between consecutive offsets; one fewer than the offsets
     */
    public List<Long> intervals() {
        return intervals;
    }

    /**
     * @return the number of events a full replay emits
     */
    public int eventCount() {
        return intervals.size();
    }

    /**
     * @return the offset of event {@code index} relative to the first recorded offset
     */
    public long relativeOffset(int index) {
        return offsets.get(index + 1) - offsets.get(0);
    }

    public long totalDurationMs() {
        return offsets.get(offsets.size() - 1) - offsets.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScenarioDefinition)) return false;
        ScenarioDefinition that = (ScenarioDefinition) o;
        return name.equals(that.name) && offsets.equals(that.offsets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, offsets);
    }

    @Override
    public String toString() {
        return "ScenarioDefinition{name=" + name + ", events=" + eventCount()
                + ", durationMs=" + totalDurationMs() + "}";
    }
}
