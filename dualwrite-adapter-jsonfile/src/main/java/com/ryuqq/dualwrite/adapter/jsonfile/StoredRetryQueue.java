package com.ryuqq.dualwrite.adapter.jsonfile;

import java.util.List;

/**
 * Whole-file snapshot: the sequence high-water mark plus every pending task.
 */
record StoredRetryQueue(long lastSequence, List<StoredRetryTask> tasks) {

    StoredRetryQueue {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
