/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.session;

import java.util.function.UnaryOperator;

import io.dapgateway.util.Assert;

/**
 * Mutex-guarded value. Transformations run one at a time, so a transformation may
 * perform side effects exactly once for the state it observed.
 *
 * @param <S> state type
 */
final class StateCell<S> {

	private volatile S value;

	StateCell(S initial) {
		Assert.notNull(initial, "initial state must not be null");
		this.value = initial;
	}

	S get() {
		return this.value;
	}

	/**
	 * Applies the transformation to the current value and stores its result.
	 * @return the resulting value
	 */
	synchronized S transform(UnaryOperator<S> transformation) {
		S next = transformation.apply(this.value);
		Assert.notNull(next, "transformation must not return null");
		this.value = next;
		return next;
	}

}
