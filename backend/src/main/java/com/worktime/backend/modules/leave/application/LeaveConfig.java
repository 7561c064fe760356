package com.worktime.backend.modules.leave.application;

import com.worktime.backend.global.config.WorktimeProperties;
import com.worktime.backend.modules.calendar.domain.HolidayCalendar;
import com.worktime.backend.modules.leave.domain.LeaveDayCounter;
import com.worktime.backend.modules.leave.domain.LeaveLifecycle;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LeaveConfig {

    @Bean
    public LeaveDayCounter leaveDayCounter(WorktimeProperties properties, HolidayCalendar holidayCalendar) {
        return new LeaveDayCounter(properties.leave().dayCounting(), holidayCalendar);
    }

    @Bean
    public LeaveLifecycle leaveLifecycle(LeaveDayCounter leaveDayCounter) {
        return new LeaveLifecycle(leaveDayCounter);
    }
}
