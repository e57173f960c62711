package com.copyleft.Treachery.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 방 카운트다운 틱 전용 스케줄러.
 */
@Slf4j
@Configuration
@EnableScheduling
public class SchedulingConfig {

    private static final int COUNTDOWN_POOL_SIZE = 4;

    @Bean
    @Primary
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(COUNTDOWN_POOL_SIZE);
        scheduler.setThreadNamePrefix("Room-Countdown-");
        scheduler.setRemoveOnCancelPolicy(true);

        // 남은 틱은 종료 시 버린다 (방은 메모리에만 있음)
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setAwaitTerminationSeconds(5);

        // 틱 하나가 실패해도 스케줄러 스레드는 살려둔다
        scheduler.setErrorHandler(t -> log.error("카운트다운 작업 실패", t));

        scheduler.initialize();
        return scheduler;
    }
}
