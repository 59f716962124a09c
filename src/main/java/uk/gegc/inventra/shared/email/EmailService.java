package uk.gegc.inventra.shared.email;

public interface EmailService {

    /**
     * Sends a plain-text email. Implementations log delivery failures instead of throwing.
     *
     * @return {@code true} when the message was handed to the transport
     */
    boolean sendPlainTextEmail(String to, String subject, String body);
}
