package com.flagship.budget_reconciliation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock used wherever "today" matters: parser date fallbacks, due dates and the
 * overdue check.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock(@Value("${budget.time-zone:UTC}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }
}
