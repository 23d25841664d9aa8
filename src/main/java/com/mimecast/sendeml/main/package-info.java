/**
 * Settings file processing and session orchestration.
 *
 * <p>{@link com.mimecast.sendeml.main.SettingsProcessor} handles one settings file at a time.
 * <br>{@link com.mimecast.sendeml.main.SessionRunner} runs the sessions of a settings file,
 * sequentially on one connection or in parallel with one connection per EML file.
 */
package com.mimecast.sendeml.main;
