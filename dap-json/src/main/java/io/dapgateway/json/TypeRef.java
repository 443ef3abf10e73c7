/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.dapgateway.json;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures generic type information at runtime for parameterized JSON targets, e.g.
 * {@code new TypeRef<Map<String, Object>>() {}}.
 *
 * @param <T> the captured type
 */
public abstract class TypeRef<T> {

	private final Type type;

	protected TypeRef() {
		Type superClass = getClass().getGenericSuperclass();
		if (!(superClass instanceof ParameterizedType)) {
			throw new IllegalStateException("TypeRef must be created with a type argument");
		}
		this.type = ((ParameterizedType) superClass).getActualTypeArguments()[0];
	}

	public Type getType() {
		return this.type;
	}

}
