/**
 * Raw EML sender for SMTP interoperability testing.
 *
 * <p>Sends byte exact EML files to an SMTP server, optionally refreshing the <i>Date:</i>
 * and <i>Message-ID:</i> header lines before transmission.
 *
 * <h2>Usage:</h2>
 * <pre>
 *     java -jar sendeml.jar settings1.json settings2.json
 *     java -jar sendeml.jar --version
 * </pre>
 *
 * @see com.mimecast.sendeml.config.SettingsLoader
 * @see com.mimecast.sendeml.main.SettingsProcessor
 */
package com.mimecast.sendeml;
