package com.questrail.chat.core;

import com.questrail.chat.api.ErrorCode;

/**
 * Capability of a room feature that depends on the room's channel being
 * attached.
 * <p>
 * The room composes its features through this interface; the lifecycle
 * manager itself knows nothing about features.
 */
public interface ContributesToRoomLifecycle
{
    /**
     * @return short feature name used in diagnostics
     */
    String featureName();

    /**
     * @return the code reported for this feature when the room fails to attach
     */
    ErrorCode attachmentErrorCode();

    /**
     * @return the code reported for this feature when the room fails to detach
     */
    ErrorCode detachmentErrorCode();

    /**
     * Releases everything the feature holds on the channel. Called once the
     * room has been released. Must be idempotent.
     */
    void dispose();
}
