package com.scorestats.platform.processor;

import com.scorestats.platform.exception.ProcessorConfigurationException;
import com.scorestats.platform.model.Score;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The active processors, in execution order.
 */
public class ProcessorRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(ProcessorRegistry.class);
    
    private final List<ScoreProcessor> processors;
    
    public ProcessorRegistry(List<ScoreProcessor> registered, Collection<String> disabledNames) {
        Map<String, ScoreProcessor> enabled = new LinkedHashMap<>();
        for (ScoreProcessor processor : registered) {
            enabled.put(processor.getName(), processor);
        }
        
        List<String> disabled = new ArrayList<>();
        for (String name : disabledNames) {
            String trimmed = name.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (enabled.remove(trimmed) == null) {
                throw new ProcessorConfigurationException("Could not find matching processor to disable (\"" + trimmed + "\")");
            }
            disabled.add(trimmed);
        }
        
        List<ScoreProcessor> ordered = new ArrayList<>(enabled.values());
        ordered.sort(Comparator.comparingInt(ScoreProcessor::getOrder));
        this.processors = List.copyOf(ordered);
        
        logger.info("Active processors: {}", processors.stream().map(ScoreProcessor::getName).toList());
        logger.info("Disabled processors: {}", disabled);
    }
    
    public List<ScoreProcessor> getProcessors() {
        return processors;
    }
    
    /**
     * Processors which should run for the given score. The same list is used for revert and apply.
     */
    public List<ScoreProcessor> getEligibleProcessors(Score score) {
        return processors.stream()
            .filter(p -> isEligible(p, score))
            .toList();
    }
    
    public static boolean isEligible(ScoreProcessor processor, Score score) {
        if (!score.isPassed() && !processor.runOnFailedScores()) {
            return false;
        }
        return !score.isLegacyScore() || processor.runOnLegacyScores();
    }
}
