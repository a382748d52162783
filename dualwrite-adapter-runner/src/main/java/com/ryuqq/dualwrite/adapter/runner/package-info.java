/**
 * Runner Adapter Layer - Dual-Write 엔진 구현체.
 *
 * <p>application 계층 포트의 구체적인 구현체와 이들이 공유하는 실행 인프라를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dualwrite.adapter.runner.SerializedDualWriteCoordinator} - 키 단위 직렬화 dual write</li>
 *   <li>{@link com.ryuqq.dualwrite.adapter.runner.RetryQueueRunner} - secondary 재시도 큐와 drain loop</li>
 *   <li>{@link com.ryuqq.dualwrite.adapter.runner.StoreSyncValidator} - 두 스토어 비교와 복구</li>
 *   <li>{@link com.ryuqq.dualwrite.adapter.runner.ValidationSweep} - 주기적 전체 검증</li>
 *   <li>{@link com.ryuqq.dualwrite.adapter.runner.DualWriteStatusService} - 상태 스냅샷</li>
 * </ul>
 *
 * <h2>공유 인프라</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dualwrite.adapter.runner.KeyedLeaseManager} - Coordinator, 재시도, 검증이 같은 인스턴스를 공유</li>
 *   <li>{@link com.ryuqq.dualwrite.adapter.runner.StoreInvoker} - 호출별 타임아웃</li>
 *   <li>{@link com.ryuqq.dualwrite.adapter.runner.PeriodicRuntimeScheduler} - Runtime 반복 실행</li>
 *   <li>{@link com.ryuqq.dualwrite.adapter.runner.DualWriteMetrics} - Micrometer 메트릭</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner
 *   ↓ implements
 * application (DualWriteCoordinator, RetryQueue, SyncValidator, Runtime, StatusProvider)
 *   ↓ depends on
 * core (model, outcome, retry, validation, config, spi)
 * </pre>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
package com.ryuqq.dualwrite.adapter.runner;
