package com.worktime.backend.modules.calendar.application;

import com.worktime.backend.global.config.WorktimeProperties;
import com.worktime.backend.modules.calendar.domain.FixedHolidayCalendar;
import com.worktime.backend.modules.calendar.domain.HolidayCalendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CalendarConfig {

    private static final Logger log = LoggerFactory.getLogger(CalendarConfig.class);

    @Bean
    public HolidayCalendar holidayCalendar(WorktimeProperties properties) {
        WorktimeProperties.Calendar calendar = properties.calendar();
        FixedHolidayCalendar holidayCalendar = new FixedHolidayCalendar(
                calendar.weekendDays(),
                calendar.holidayDates()
        );
        log.info("Holiday calendar: weekend={} holidays={}", calendar.weekendDays(), holidayCalendar.getHolidays().size());
        return holidayCalendar;
    }
}
