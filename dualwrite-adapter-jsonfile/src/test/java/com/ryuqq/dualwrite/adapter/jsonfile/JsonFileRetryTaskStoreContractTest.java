package com.ryuqq.dualwrite.adapter.jsonfile;

import com.ryuqq.dualwrite.core.spi.RetryTaskStore;
import com.ryuqq.dualwrite.testkit.contract.RetryTaskStoreContract;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

/**
 * JsonFileRetryTaskStore에 대한 RetryTaskStore 계약 테스트.
 */
class JsonFileRetryTaskStoreContractTest extends RetryTaskStoreContract {

    @TempDir
    Path tempDir;

    @Override
    protected RetryTaskStore createStore() {
        return new JsonFileRetryTaskStore(tempDir.resolve("retry-tasks.json"));
    }
}
