package com.ryuqq.dualwrite.application.status;

/**
 * Source of engine status for health-check collaborators.
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public interface StatusProvider {

    DualWriteStatus snapshot();
}
