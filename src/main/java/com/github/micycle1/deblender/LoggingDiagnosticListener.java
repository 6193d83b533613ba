package com.github.micycle1.deblender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards diagnostic events to SLF4J at WARN level.
 */
public class LoggingDiagnosticListener implements DiagnosticListener {

	private static final Logger logger = LoggerFactory.getLogger(LoggingDiagnosticListener.class);

	@Override
	public void onEvent(DiagnosticEvent event) {
		logger.warn("{}", event);
	}
}
