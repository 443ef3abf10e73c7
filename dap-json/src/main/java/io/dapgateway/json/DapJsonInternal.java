/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.dapgateway.json;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Resolves and caches the default {@link DapJsonMapper} from the
 * {@link DapJsonMapperSupplier} providers registered on the classpath.
 */
final class DapJsonInternal {

	private static volatile DapJsonMapper defaultJsonMapper;

	private DapJsonInternal() {
	}

	static DapJsonMapper getDefaultMapper() {
		DapJsonMapper mapper = defaultJsonMapper;
		if (mapper == null) {
			synchronized (DapJsonInternal.class) {
				mapper = defaultJsonMapper;
				if (mapper == null) {
					mapper = loadMapper(ServiceLoader.load(DapJsonMapperSupplier.class).iterator());
					defaultJsonMapper = mapper;
				}
			}
		}
		return mapper;
	}

	/**
	 * Returns the mapper of the first provider that yields one. A provider that cannot
	 * be instantiated, or whose supplier fails, is skipped.
	 * @throws IllegalStateException if no provider yields a mapper; skipped failures are
	 * attached as suppressed exceptions
	 */
	static DapJsonMapper loadMapper(Iterator<DapJsonMapperSupplier> providers) {
		List<Throwable> failures = new ArrayList<>();
		while (true) {
			DapJsonMapperSupplier supplier;
			try {
				if (!providers.hasNext()) {
					break;
				}
				supplier = providers.next();
			}
			catch (ServiceConfigurationError e) {
				failures.add(e);
				continue;
			}
			try {
				DapJsonMapper mapper = supplier.get();
				if (mapper != null) {
					return mapper;
				}
			}
			catch (RuntimeException e) {
				failures.add(e);
			}
		}

		IllegalStateException error = new IllegalStateException(failures.isEmpty()
				? "No DapJsonMapperSupplier found on the classpath"
				: "No DapJsonMapperSupplier could provide a mapper (" + failures.size() + " failed)");
		for (Throwable failure : failures) {
			error.addSuppressed(failure);
		}
		throw error;
	}

}
