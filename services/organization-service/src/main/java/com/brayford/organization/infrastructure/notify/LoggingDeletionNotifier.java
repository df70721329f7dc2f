package com.brayford.organization.infrastructure.notify;

import com.brayford.lifecycle.notification.DeletionNotification;
import com.brayford.lifecycle.port.DeletionNotifier;
import com.brayford.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stand-in for the email provider: writes each notification to the log with links and tokens
 * redacted and the recipient address masked.
 */
@Component
public class LoggingDeletionNotifier implements DeletionNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeletionNotifier.class);

    private final SensitiveDataRedactor redactor;

    public LoggingDeletionNotifier(SensitiveDataRedactor redactor) {
        this.redactor = redactor;
    }

    @Override
    public void send(DeletionNotification notification) {
        log.info("Email [{}] to {} for organization {}: {}",
                notification.templateAlias(),
                SensitiveDataRedactor.maskEmail(notification.recipient()),
                notification.organizationId(),
                redactor.redact(notification.templateData()));
    }
}
