package com.mimecast.sendeml.smtp.session;

/**
 * SMTP client session states.
 *
 * <p>Per message states repeat for every message sent on the connection, separated by {@link #RESET}.
 */
public enum SessionState {
    CONNECTED,
    GREETED,
    MAIL_FROM,
    RCPT_TO,
    DATA,
    BODY,
    TERMINATOR,
    RESET,
    QUIT,
    CLOSED
}
