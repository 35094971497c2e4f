package net.cronhook.bootstrap.autoconfigure;

import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 잡 타이머용 스레드: 발화 시각만 기다리는 타이머 스레드 1개 + 발화마다 스레드를 주는 워커 풀.
 * 스프링 {@code @Scheduled}가 가져가지 않도록 executor를 빈으로 직접 노출하지 않음.
 */
public class CronhookExecutors implements DisposableBean {
    private final ScheduledExecutorService timers;
    private final ExecutorService workers;

    public CronhookExecutors() {
        var timerFactory = new CustomizableThreadFactory("cronhook-timer-");
        timerFactory.setDaemon(true);
        var workerFactory = new CustomizableThreadFactory("cronhook-worker-");
        workerFactory.setDaemon(true);
        this.timers = Executors.newSingleThreadScheduledExecutor(timerFactory);
        // 발화마다 별도 스레드, 대기 큐 없음 (호출 시간은 runner timeout으로 제한)
        this.workers = Executors.newCachedThreadPool(workerFactory);
    }

    public ScheduledExecutorService timers() { return timers; }
    public ExecutorService workers() { return workers; }

    @Override
    public void destroy() {
        timers.shutdownNow();
        workers.shutdownNow();
    }
}
