package uk.gegc.inventra.shared.email.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.inventra.shared.email.EmailAddressMasker;
import uk.gegc.inventra.shared.email.EmailService;

/**
 * Logs email send attempts without delivering anything.
 * Activated when app.email.provider=noop (the default).
 */
@Slf4j
public class NoopEmailService implements EmailService {

    public NoopEmailService() {
        log.info("NoopEmailService initialized - emails will be logged but not sent");
    }

    @Override
    public boolean sendPlainTextEmail(String to, String subject, String body) {
        log.info("[NOOP] Would send plain text email to: {} with subject: {}", EmailAddressMasker.mask(to), subject);
        return true;
    }
}
