/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.dapgateway.util;

/**
 * Assertion utility class that assists in validating arguments.
 */
public final class Assert {

	private Assert() {
	}

	/**
	 * Assert that an object is not {@code null}.
	 * @param object the object to check
	 * @param message the exception message to use if the assertion fails
	 * @throws IllegalArgumentException if the object is {@code null}
	 */
	public static void notNull(Object object, String message) {
		if (object == null) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * Assert that the given String contains valid text content.
	 * @param text the String to check
	 * @param message the exception message to use if the assertion fails
	 * @throws IllegalArgumentException if the text is null or blank
	 */
	public static void hasText(String text, String message) {
		if (text == null || text.trim().isEmpty()) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * Assert a boolean expression.
	 * @param expression a boolean expression
	 * @param message the exception message to use if the assertion fails
	 */
	public static void isTrue(boolean expression, String message) {
		if (!expression) {
			throw new IllegalArgumentException(message);
		}
	}

}
