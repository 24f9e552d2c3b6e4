package dustin.backed.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 스레드 풀 설정
 * Performance Configuration
 * 브릿지 메시지 발행을 정산 락 밖에서 처리하기 위한 스레드 풀 설정
 */
@Configuration
public class PerformanceConfig {

    /**
     * 브릿지 메시지 발행용 스레드 풀
     * Bridge message publishing thread pool
     *
     * 단일 스레드: 정산 기록을 커밋 순서대로 발행
     */
    @Bean(name = "bridgeMessageExecutor")
    public Executor bridgeMessageExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10000);
        executor.setThreadNamePrefix("bridge-message-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
