package uk.gegc.inventra.shared.email.impl;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import uk.gegc.inventra.shared.email.EmailAddressMasker;
import uk.gegc.inventra.shared.email.EmailService;

/**
 * SMTP delivery through Spring's {@link JavaMailSender}. Activated when app.email.provider=smtp.
 */
@Slf4j
@Service
@Primary
@ConditionalOnProperty(name = "app.email.provider", havingValue = "smtp")
@RequiredArgsConstructor
public class SmtpEmailService implements EmailService {

    private final JavaMailSender mailSender;

    @Value("${spring.mail.username:}")
    private String fromEmail;

    @PostConstruct
    void verifyEmailConfiguration() {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled: spring.mail.username is not configured");
        } else {
            log.info("Email service enabled with sender: {}", fromEmail);
        }
    }

    @Override
    public boolean sendPlainTextEmail(String to, String subject, String body) {
        if (fromEmail == null || fromEmail.isBlank()) {
            log.warn("Email service disabled - skipping email to: {}", EmailAddressMasker.mask(to));
            return false;
        }

        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(fromEmail);
            message.setTo(to);
            message.setSubject(subject);
            message.setText(body);

            mailSender.send(message);
            log.info("Email '{}' sent to: {}", subject, EmailAddressMasker.mask(to));
            return true;
        } catch (MailException e) {
            log.error("Failed to send email '{}' to: {}", subject, EmailAddressMasker.mask(to), e);
            return false;
        }
    }
}
