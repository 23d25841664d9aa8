/**
 * Settings file loading and validation.
 *
 * <p>Settings are JSON files, comments are allowed.
 * <br>Required keys: <i>smtpHost</i>, <i>smtpPort</i>, <i>fromAddress</i>, <i>toAddresses</i>, <i>emlFiles</i>.
 * <br>Optional keys: <i>updateDate</i> (true), <i>updateMessageId</i> (true), <i>useParallel</i> (false),
 * <i>timeout</i> (0, milliseconds).
 */
package com.mimecast.sendeml.config;
