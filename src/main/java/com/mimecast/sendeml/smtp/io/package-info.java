/**
 * Handles the low-level input stream for SMTP communication.
 *
 * <p>The following streams are available:
 * <ul>
 *     <li>{@link com.mimecast.sendeml.smtp.io.LineInputStream} - Reads lines from the socket.</li>
 * </ul>
 */
package com.mimecast.sendeml.smtp.io;
