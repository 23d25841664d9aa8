/**
 * Header line matching and rewriting.
 */
package com.mimecast.sendeml.mime.headers;
