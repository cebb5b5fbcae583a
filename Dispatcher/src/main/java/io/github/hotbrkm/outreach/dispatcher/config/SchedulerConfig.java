package io.github.hotbrkm.outreach.dispatcher.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(DispatcherProperties properties) {
        ThreadPoolTaskScheduler taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(Math.max(1, properties.getSchedule().getSchedulerPoolSize()));
        taskScheduler.setThreadNamePrefix("outreach-scheduler-");
        taskScheduler.setBeanName("scheduler");
        taskScheduler.setWaitForTasksToCompleteOnShutdown(false);
        taskScheduler.initialize();
        return taskScheduler;
    }
}
