/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.dapgateway.json;

import java.util.function.Supplier;

/**
 * Strategy interface for resolving a {@link DapJsonMapper} through
 * {@link java.util.ServiceLoader}.
 */
public interface DapJsonMapperSupplier extends Supplier<DapJsonMapper> {

}
