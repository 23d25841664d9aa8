/**
 * Byte level handling of raw RFC 5322 messages.
 *
 * <p>Only the header and body boundary and the lines of two header fields are inspected.
 * <br>Everything else is carried through byte for byte.
 *
 * <p>The following classes are available:
 * <ul>
 *     <li>{@link com.mimecast.sendeml.mime.LineScanner} - Splits buffers into LF terminated lines.</li>
 *     <li>{@link com.mimecast.sendeml.mime.MessageSplitter} - Finds the blank line between header and body.</li>
 *     <li>{@link com.mimecast.sendeml.mime.MessageTransformer} - Produces the bytes to transmit.</li>
 * </ul>
 */
package com.mimecast.sendeml.mime;
