package com.bookwatch.monitor.alert;

import com.bookwatch.monitor.model.AlertDispatch;
import com.bookwatch.monitor.model.Severity;

/**
 * A notification transport. Implementations signal delivery failure by throwing;
 * the alert manager records the failure and carries on with the other channels.
 */
public interface AlertChannel {

    String name();

    /** Changes below this severity are not sent to this channel. */
    Severity minimumSeverity();

    void deliver(AlertDispatch dispatch);
}
