/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.dapgateway.json.jackson;

import java.io.IOException;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.dapgateway.json.DapJsonMapper;
import io.dapgateway.json.TypeRef;

/**
 * Jackson-based implementation of {@link DapJsonMapper}. Delegates to a Jackson
 * {@link ObjectMapper}.
 */
public final class JacksonDapJsonMapper implements DapJsonMapper {

	private final ObjectMapper objectMapper;

	/**
	 * Constructs a mapper with a default {@link ObjectMapper} that tolerates unknown
	 * properties, as protocol payloads routinely carry fields this gateway never reads.
	 */
	public JacksonDapJsonMapper() {
		this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
	}

	/**
	 * Constructs a new JacksonDapJsonMapper instance with the given ObjectMapper.
	 * @param objectMapper the ObjectMapper to be used for JSON serialization and
	 * deserialization. Must not be null.
	 * @throws IllegalArgumentException if the provided ObjectMapper is null.
	 */
	public JacksonDapJsonMapper(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	/**
	 * Returns the underlying Jackson {@link ObjectMapper} used for JSON serialization and
	 * deserialization.
	 * @return the ObjectMapper instance
	 */
	public ObjectMapper getObjectMapper() {
		return objectMapper;
	}

	@Override
	public <T> T readValue(String content, Class<T> type) throws IOException {
		return objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(String content, TypeRef<T> type) throws IOException {
		JavaType javaType = objectMapper.getTypeFactory().constructType(type.getType());
		return objectMapper.readValue(content, javaType);
	}

	@Override
	public <T> T convertValue(Object fromValue, Class<T> type) {
		return objectMapper.convertValue(fromValue, type);
	}

	@Override
	public <T> T convertValue(Object fromValue, TypeRef<T> type) {
		JavaType javaType = objectMapper.getTypeFactory().constructType(type.getType());
		return objectMapper.convertValue(fromValue, javaType);
	}

	@Override
	public String writeValueAsString(Object value) throws IOException {
		return objectMapper.writeValueAsString(value);
	}

}
