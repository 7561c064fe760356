package com.worktime.backend.global.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorktimeConfig {

    private static final Logger log = LoggerFactory.getLogger(WorktimeConfig.class);

    @Bean
    public WorkRules workRules(WorktimeProperties properties) {
        WorkRules rules = properties.toWorkRules();
        log.info("Work rules loaded: maxDaily={}min maxWeekly={}min break={}min after {}min, rounding={}min/{}",
                rules.maxDailyMinutes(),
                rules.maxWeeklyMinutes(),
                rules.breakDurationMinutes(),
                rules.minimumBreakThresholdMinutes(),
                rules.roundingMinutes(),
                rules.roundingMethod());
        return rules;
    }
}
