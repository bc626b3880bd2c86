package com.bookwatch.monitor.alert;

import com.bookwatch.monitor.config.MonitorProperties;
import com.bookwatch.monitor.model.AlertDispatch;
import com.bookwatch.monitor.model.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Always registered, so every qualifying alert has at least one channel.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LogAlertChannel implements AlertChannel {

    public static final String NAME = "log";

    private final MonitorProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Severity minimumSeverity() {
        return properties.getAlerting().getMinSeverity();
    }

    @Override
    public void deliver(AlertDispatch dispatch) {
        if (dispatch.severity().isAtLeast(Severity.HIGH)) {
            log.warn("[ALERT {}] {} ({})", dispatch.severity().label().toUpperCase(), dispatch.summary(),
                    dispatch.change().getSourceUrl());
        } else {
            log.info("[ALERT {}] {} ({})", dispatch.severity().label().toUpperCase(), dispatch.summary(),
                    dispatch.change().getSourceUrl());
        }
    }
}
