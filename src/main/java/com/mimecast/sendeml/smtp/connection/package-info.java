/**
 * SMTP client connection handling.
 *
 * <h2>Connection Lifecycle</h2>
 * <ol>
 *   <li><strong>Open</strong> - {@code Connection.open(host, port, timeout, context)}</li>
 *   <li><strong>Exchange</strong> - {@code connection.send(command)} writes and waits for the reply</li>
 *   <li><strong>Close</strong> - {@code connection.close()} releases the socket</li>
 * </ol>
 *
 * <p>A read timeout, when configured, applies to the whole connection.
 */
package com.mimecast.sendeml.smtp.connection;
