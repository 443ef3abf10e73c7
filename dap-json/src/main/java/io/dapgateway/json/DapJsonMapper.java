/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.dapgateway.json;

import java.io.IOException;

/**
 * Abstraction for JSON serialization/deserialization to decouple the gateway from a
 * specific JSON library. Implementations are discovered through {@link DapJsonMapperSupplier}.
 */
public interface DapJsonMapper {

	/**
	 * Deserialize JSON string into a target type.
	 * @param content JSON as String
	 * @param type target class
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(String content, Class<T> type) throws IOException;

	/**
	 * Deserialize JSON string into a parameterized target type.
	 * @param content JSON as String
	 * @param type target type
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(String content, TypeRef<T> type) throws IOException;

	/**
	 * Convert a value to a given type, useful for mapping nested JSON structures such as
	 * untyped request arguments.
	 * @param fromValue source value
	 * @param type target class
	 * @return converted value
	 * @param <T> generic type
	 * @throws IllegalArgumentException if the value cannot be converted
	 */
	<T> T convertValue(Object fromValue, Class<T> type);

	/**
	 * Convert a value to a given parameterized type.
	 * @param fromValue source value
	 * @param type target type
	 * @return converted value
	 * @param <T> generic type
	 * @throws IllegalArgumentException if the value cannot be converted
	 */
	<T> T convertValue(Object fromValue, TypeRef<T> type);

	/**
	 * Serialize an object to JSON string.
	 * @param value object to serialize
	 * @return JSON as String
	 * @throws IOException on serialization errors
	 */
	String writeValueAsString(Object value) throws IOException;

	/**
	 * Returns the default {@link DapJsonMapper}, resolved once from the classpath.
	 * @return the default mapper
	 * @throws IllegalStateException if no implementation is available
	 */
	static DapJsonMapper getDefault() {
		return DapJsonInternal.getDefaultMapper();
	}

}
