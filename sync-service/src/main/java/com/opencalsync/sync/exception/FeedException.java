package com.opencalsync.sync.exception;

import com.opencalsync.common.exception.BusinessException;

/**
 * Base type for failures while acquiring or reading a calendar feed.
 * The reconciler catches these, marks the connection ERROR and carries on with the conflict rescan.
 */
public abstract class FeedException extends BusinessException {

    protected FeedException(String message, String errorCode) {
        super(message, errorCode);
    }

    protected FeedException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
