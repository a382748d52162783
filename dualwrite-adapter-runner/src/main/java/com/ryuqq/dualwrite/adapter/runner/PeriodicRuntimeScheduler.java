package com.ryuqq.dualwrite.adapter.runner;

import com.ryuqq.dualwrite.application.runtime.Runtime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Runtime}을 고정 지연으로 반복 실행하는 스케줄러.
 *
 * <p>재시도 drain({@link RetryQueueRunner})과 검증 패스({@link ValidationSweep})를
 * 호출자 쓰기 경로와 분리된 전용 스레드에서 실행합니다.
 * 한 사이클의 예외는 로그만 남기고 다음 사이클을 계속 예약합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PeriodicRuntimeScheduler scheduler = new PeriodicRuntimeScheduler()
 *     .schedule("retry-drain", retryQueueRunner, retryQueueConfig.pollIntervalMs())
 *     .schedule("validation-sweep", validationSweep, config.syncIntervalMs());
 * scheduler.start();
 * ...
 * scheduler.shutdown();
 * </pre>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public final class PeriodicRuntimeScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PeriodicRuntimeScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final List<Registration> registrations = new ArrayList<>();
    private boolean started;

    public PeriodicRuntimeScheduler() {
        AtomicInteger threadNumber = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "dualwrite-scheduler-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runtime 등록. 이미 시작된 경우 즉시 예약됩니다.
     *
     * @param name 로그용 이름
     * @param runtime 반복 실행할 Runtime
     * @param intervalMs 사이클 간 지연 (밀리초, 양수여야 함)
     * @return this
     */
    public synchronized PeriodicRuntimeScheduler schedule(String name, Runtime runtime, long intervalMs) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive (current: " + intervalMs + ")");
        }
        Registration registration = new Registration(name, runtime, intervalMs);
        registrations.add(registration);
        if (started) {
            submit(registration);
        }
        return this;
    }

    /**
     * 등록된 모든 Runtime 예약 시작.
     *
     * @throws IllegalStateException 이미 종료된 경우
     */
    public synchronized void start() {
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("Scheduler has been shut down");
        }
        if (started) {
            return;
        }
        started = true;
        for (Registration registration : registrations) {
            submit(registration);
        }
        log.info("Started {} periodic runtime(s)", registrations.size());
    }

    private void submit(Registration registration) {
        scheduler.scheduleWithFixedDelay(() -> runCycle(registration),
            0, registration.intervalMs(), TimeUnit.MILLISECONDS);
    }

    private void runCycle(Registration registration) {
        try {
            registration.runtime().pump();
        } catch (Exception e) {
            log.error("Periodic runtime '{}' cycle failed", registration.name(), e);
        }
    }

    public synchronized boolean isRunning() {
        return started && !scheduler.isShutdown();
    }

    /**
     * 스케줄러 종료 (진행 중인 사이클 완료 대기).
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        scheduler.shutdown();
        if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
    }

    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Registration(String name, Runtime runtime, long intervalMs) {
    }
}
