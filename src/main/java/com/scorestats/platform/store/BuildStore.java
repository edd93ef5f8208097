package com.scorestats.platform.store;

import com.scorestats.platform.model.Build;
import com.scorestats.platform.repository.BuildRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Process-local copy of the client builds table, rebuilt wholesale on the store refresh interval.
 */
@Component
public class BuildStore {
    
    private static final Logger logger = LoggerFactory.getLogger(BuildStore.class);
    
    private final BuildRepository buildRepository;
    private final StoreSettings settings;
    private final Clock clock;
    
    private volatile Map<Integer, Build> builds;
    private volatile long lastRefresh;
    
    @Autowired
    public BuildStore(BuildRepository buildRepository, StoreSettings settings, Clock clock) {
        this.buildRepository = buildRepository;
        this.settings = settings;
        this.clock = clock;
    }
    
    public Optional<Build> getBuild(int buildId) {
        return Optional.ofNullable(currentBuilds().get(buildId));
    }
    
    /**
     * Whether scores set on the given build may award performance.
     */
    public boolean allowsPerformance(Integer buildId) {
        return buildId != null && getBuild(buildId).map(Build::isAllowPerformance).orElse(false);
    }
    
    private Map<Integer, Build> currentBuilds() {
        long now = clock.millis();
        
        if (builds != null && now - lastRefresh <= settings.getRefreshIntervalMs()) {
            return builds;
        }
        
        synchronized (this) {
            if (builds == null || now - lastRefresh > settings.getRefreshIntervalMs()) {
                builds = buildRepository.findAll().stream()
                    .collect(Collectors.toUnmodifiableMap(Build::getBuildId, Function.identity()));
                lastRefresh = now;
                logger.debug("Rebuilt build store with {} builds", builds.size());
            }
            return builds;
        }
    }
}
