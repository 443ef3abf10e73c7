/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.logging;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.MDC;

import io.dapgateway.json.DapJsonMapper;

/**
 * Lightweight helper to emit structured session lifecycle logs and manage MDC fields.
 */
public final class DapLogging {

	public static final String MDC_SESSION_ID = "dapSessionId";

	private DapLogging() {
	}

	public static void put(String key, String value) {
		if (key != null && value != null) {
			MDC.put(key, value);
		}
	}

	public static void remove(String key) {
		if (key != null) {
			MDC.remove(key);
		}
	}

	/**
	 * Runs the action with the given MDC entry, restoring the previous value afterwards
	 * so nested calls keep the outer entry.
	 */
	public static void withMdc(String key, String value, Runnable action) {
		String previous = MDC.get(key);
		put(key, value);
		try {
			action.run();
		}
		finally {
			if (previous == null) {
				remove(key);
			}
			else {
				MDC.put(key, previous);
			}
		}
	}

	/**
	 * Emits a single-line JSON lifecycle event at info level.
	 * @param logger SLF4J logger
	 * @param jsonMapper mapper used to render the line
	 * @param event event name (e.g. "S_LAUNCH_TRANSLATED")
	 * @param sessionId session id (optional)
	 * @param request map with {command, seq} of the message concerned (optional)
	 * @param outcome map with {status, cause, ...} (optional)
	 */
	public static void logEvent(Logger logger, DapJsonMapper jsonMapper, String event, String sessionId,
			Map<String, Object> request, Map<String, Object> outcome) {
		try {
			Map<String, Object> o = new LinkedHashMap<>();
			o.put("event", event);
			o.put("ts", Instant.now().toString());
			o.put("thread", Thread.currentThread().getName());
			if (sessionId != null) {
				o.put("sessionId", sessionId);
			}
			if (request != null) {
				o.put("request", request);
			}
			if (outcome != null) {
				o.put("outcome", outcome);
			}
			logger.info(jsonMapper.writeValueAsString(o));
		}
		catch (Exception e) {
			logger.warn("Failed to emit structured session log: {}", e.getMessage());
		}
	}

	public static Map<String, Object> request(String command, int seq) {
		Map<String, Object> request = new LinkedHashMap<>();
		request.put("command", command);
		request.put("seq", seq);
		return request;
	}

	public static Map<String, Object> outcome(String status, String cause) {
		Map<String, Object> outcome = new LinkedHashMap<>();
		outcome.put("status", status);
		if (cause != null) {
			outcome.put("cause", cause);
		}
		return outcome;
	}

}
