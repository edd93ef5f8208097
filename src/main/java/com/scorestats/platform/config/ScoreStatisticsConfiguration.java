package com.scorestats.platform.config;

import com.scorestats.platform.processor.MaxComboProcessor;
import com.scorestats.platform.processor.PlayCountProcessor;
import com.scorestats.platform.processor.PlayTimeProcessor;
import com.scorestats.platform.processor.ProcessorRegistry;
import com.scorestats.platform.processor.RankedScoreProcessor;
import com.scorestats.platform.processor.ScorePerformanceProcessor;
import com.scorestats.platform.processor.ScoreProcessor;
import com.scorestats.platform.processor.TotalScoreProcessor;
import com.scorestats.platform.processor.UserRankCountProcessor;
import com.scorestats.platform.processor.UserTotalPerformanceProcessor;
import com.scorestats.platform.processor.medal.MedalProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

@Configuration
public class ScoreStatisticsConfiguration {
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    /**
     * Per-score transactions, read committed to keep lock contention between users low.
     */
    @Bean
    public TransactionTemplate scoreTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        return template;
    }
    
    /**
     * Every processor, in registration order. Ties in {@link ScoreProcessor#getOrder()} keep this order.
     */
    @Bean
    public ProcessorRegistry processorRegistry(
            ScorePerformanceProcessor scorePerformanceProcessor,
            UserTotalPerformanceProcessor userTotalPerformanceProcessor,
            PlayCountProcessor playCountProcessor,
            PlayTimeProcessor playTimeProcessor,
            TotalScoreProcessor totalScoreProcessor,
            MaxComboProcessor maxComboProcessor,
            RankedScoreProcessor rankedScoreProcessor,
            UserRankCountProcessor userRankCountProcessor,
            MedalProcessor medalProcessor,
            @Value("${score-statistics.disabled-processors:}") List<String> disabledProcessors) {
        List<ScoreProcessor> processors = List.of(
            scorePerformanceProcessor,
            userTotalPerformanceProcessor,
            playCountProcessor,
            playTimeProcessor,
            totalScoreProcessor,
            maxComboProcessor,
            rankedScoreProcessor,
            userRankCountProcessor,
            medalProcessor
        );
        
        return new ProcessorRegistry(processors, disabledProcessors);
    }
}
