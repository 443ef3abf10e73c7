/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.dapgateway.json.jackson;

import io.dapgateway.json.DapJsonMapper;
import io.dapgateway.json.DapJsonMapperSupplier;

/**
 * {@link DapJsonMapperSupplier} registered in {@code META-INF/services}, making the
 * Jackson mapper the default whenever this module is on the classpath.
 */
public class JacksonDapJsonMapperSupplier implements DapJsonMapperSupplier {

	@Override
	public DapJsonMapper get() {
		return new JacksonDapJsonMapper();
	}

}
