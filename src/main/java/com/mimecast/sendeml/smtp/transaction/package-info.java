/**
 * SMTP transactions recorded per connection.
 */
package com.mimecast.sendeml.smtp.transaction;
