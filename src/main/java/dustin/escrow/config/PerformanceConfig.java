package dustin.escrow.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 비동기 처리 설정
 * Async Executor Configuration
 *
 * 이벤트 발행은 정산 트랜잭션 커밋 이후 별도 스레드 풀에서 처리됩니다.
 */
@Configuration
public class PerformanceConfig {

    /**
     * 이벤트 발행용 스레드 풀
     * Event publisher thread pool
     */
    @Bean(name = "eventPublisherExecutor")
    public Executor eventPublisherExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        // 큐가 가득 차면 이벤트는 버려지고 로그만 남음
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("escrow-event-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
