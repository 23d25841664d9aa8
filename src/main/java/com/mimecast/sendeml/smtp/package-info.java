/**
 * Minimal synchronous SMTP client.
 *
 * <p>One connection, one command in flight at a time.
 * <br>{@link com.mimecast.sendeml.smtp.ReplyParser} reads replies and
 * {@link com.mimecast.sendeml.smtp.SmtpSession} sequences the commands.
 *
 * <h2>Client example:</h2>
 * <pre>
 *     Settings settings = SettingsLoader.load("settings.json");
 *
 *     try (Connection connection = Connection.open(settings.getSmtpHost(), settings.getSmtpPort(), 0, SessionContext.SEQUENTIAL)) {
 *         SessionResult result = new SmtpSession(connection, settings, new MessageTransformer()).run();
 *     }
 * </pre>
 */
package com.mimecast.sendeml.smtp;
