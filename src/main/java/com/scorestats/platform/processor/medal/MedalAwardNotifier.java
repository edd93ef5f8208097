package com.scorestats.platform.processor.medal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers award notifications synchronously to registered listeners, in registration order.
 * <p>
 * Delivery is in-process only. An award persisted just before a crash is never notified.
 */
@Component
public class MedalAwardNotifier {
    
    private static final Logger logger = LoggerFactory.getLogger(MedalAwardNotifier.class);
    
    private final List<MedalAwardListener> listeners = new CopyOnWriteArrayList<>();
    
    public void addListener(MedalAwardListener listener) {
        listeners.add(listener);
    }
    
    public void removeListener(MedalAwardListener listener) {
        listeners.remove(listener);
    }
    
    public void notifyAwarded(AwardedMedal awardedMedal) {
        for (MedalAwardListener listener : listeners) {
            try {
                listener.onMedalAwarded(awardedMedal);
            } catch (Exception e) {
                logger.error("Medal award listener failed for user {} medal {}",
                    awardedMedal.getUserId(), awardedMedal.getMedalId(), e);
            }
        }
    }
}
