/**
 * Session state and per worker context.
 */
package com.mimecast.sendeml.smtp.session;
