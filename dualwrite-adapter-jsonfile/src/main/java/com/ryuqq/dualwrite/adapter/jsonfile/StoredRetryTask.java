package com.ryuqq.dualwrite.adapter.jsonfile;

import com.ryuqq.dualwrite.core.model.EntityKey;
import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.model.OperationKind;
import com.ryuqq.dualwrite.core.model.Payload;
import com.ryuqq.dualwrite.core.retry.RetryTask;
import com.ryuqq.dualwrite.core.retry.RetryTaskState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON document form of a {@link RetryTask}.
 *
 * <p>Kept separate from the domain record so the core model carries no
 * serialization annotations and the file format can evolve independently.</p>
 */
record StoredRetryTask(
    String operationId,
    String entityType,
    String entityKey,
    String kind,
    Map<String, Object> payload,
    long submittedAt,
    long sequence,
    int attemptCount,
    long nextAttemptAt,
    long createdAt,
    String lastError
) {

    static StoredRetryTask from(RetryTask task) {
        return new StoredRetryTask(
            task.operationId().getValue(),
            task.ref().entityType().getValue(),
            task.ref().entityKey().getValue(),
            task.kind().name(),
            new LinkedHashMap<>(task.payload().getFields()),
            task.submittedAt(),
            task.sequence(),
            task.attemptCount(),
            task.nextAttemptAt(),
            task.createdAt(),
            task.lastError()
        );
    }

    RetryTask toTask() {
        return new RetryTask(
            OperationId.of(operationId),
            new EntityRef(EntityType.of(entityType), EntityKey.of(entityKey)),
            OperationKind.valueOf(kind),
            payload == null ? Payload.empty() : Payload.of(payload),
            submittedAt,
            sequence,
            attemptCount,
            nextAttemptAt,
            createdAt,
            lastError,
            RetryTaskState.PENDING
        );
    }
}
