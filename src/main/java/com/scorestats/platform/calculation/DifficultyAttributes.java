package com.scorestats.platform.calculation;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Named numeric difficulty attributes of a beatmap under a mod combination, keyed by attribute id.
 * Immutable.
 */
public final class DifficultyAttributes {
    
    public static final int AIM = 1;
    public static final int SPEED = 3;
    public static final int OVERALL_DIFFICULTY = 5;
    public static final int APPROACH_RATE = 7;
    public static final int MAX_COMBO = 9;
    public static final int STAR_RATING = 11;
    public static final int FLASHLIGHT = 17;
    
    private final int rulesetId;
    private final Map<Integer, Double> values;
    
    public DifficultyAttributes(int rulesetId, Map<Integer, Double> values) {
        this.rulesetId = rulesetId;
        this.values = Map.copyOf(values);
    }
    
    public int getRulesetId() {
        return rulesetId;
    }
    
    public OptionalDouble get(int attributeId) {
        Double value = values.get(attributeId);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
    
    public Map<Integer, Double> asMap() {
        return values;
    }
    
    public boolean isEmpty() {
        return values.isEmpty();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DifficultyAttributes that)) {
            return false;
        }
        return rulesetId == that.rulesetId && values.equals(that.values);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(rulesetId, values);
    }
    
    @Override
    public String toString() {
        return "DifficultyAttributes(rulesetId=" + rulesetId + ", values=" + values + ")";
    }
}
