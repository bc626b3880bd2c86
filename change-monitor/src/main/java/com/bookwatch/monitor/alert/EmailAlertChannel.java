package com.bookwatch.monitor.alert;

import com.bookwatch.monitor.config.MonitorProperties;
import com.bookwatch.monitor.model.AlertDispatch;
import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Sends one plain-text mail per alert. Only created when
 * {@code change-monitor.alerting.email.enabled=true}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "change-monitor.alerting.email", name = "enabled", havingValue = "true")
public class EmailAlertChannel implements AlertChannel {

    public static final String NAME = "email";

    private final JavaMailSender mailSender;
    private final MonitorProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Severity minimumSeverity() {
        return properties.getAlerting().getEmail().getMinSeverity();
    }

    @Override
    public void deliver(AlertDispatch dispatch) {
        MonitorProperties.Alerting.Email email = properties.getAlerting().getEmail();
        Change change = dispatch.change();

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(email.getFrom());
        message.setTo(email.getTo().toArray(new String[0]));
        message.setSubject("[" + dispatch.severity().label().toUpperCase() + "] " + change.getChangeType().label()
                + " detected");
        message.setText(dispatch.summary()
                + "\n\nItem:     " + change.getItemId()
                + "\nURL:      " + change.getSourceUrl()
                + "\nField:    " + nullToDash(change.getFieldName())
                + "\nOld:      " + nullToDash(change.getOldValue())
                + "\nNew:      " + nullToDash(change.getNewValue())
                + "\nDetected: " + change.getDetectedAt());

        mailSender.send(message);
        log.info("Alert mail sent to {} recipients for change {}", email.getTo().size(), change.getChangeId());
    }

    private static String nullToDash(String value) {
        return value == null ? "-" : value;
    }
}
