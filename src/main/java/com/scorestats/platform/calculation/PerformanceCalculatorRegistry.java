package com.scorestats.platform.calculation;

import com.scorestats.platform.model.Ruleset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Performance calculators by ruleset. A ruleset without a calculator never awards performance.
 */
@Component
public class PerformanceCalculatorRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(PerformanceCalculatorRegistry.class);
    
    private final Map<Ruleset, PerformanceCalculator> calculators = new EnumMap<>(Ruleset.class);
    
    @Autowired
    public PerformanceCalculatorRegistry(ObjectProvider<PerformanceCalculator> calculators) {
        this(calculators.orderedStream().toList());
    }
    
    public PerformanceCalculatorRegistry(List<PerformanceCalculator> calculators) {
        for (PerformanceCalculator calculator : calculators) {
            this.calculators.putIfAbsent(calculator.getRuleset(), calculator);
        }
        logger.info("Performance calculators available for {}", this.calculators.keySet());
    }
    
    public Optional<PerformanceCalculator> forRuleset(Ruleset ruleset) {
        return Optional.ofNullable(calculators.get(ruleset));
    }
}
