/*
 * Copyright 2025-2025 the original author or authors.
 */
package io.dapgateway.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.atomic.AtomicBoolean;

import io.dapgateway.spec.DebugTransport;
import io.dapgateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DebugTransport} over a connected client socket. The socket is closed at most
 * once.
 */
public class SocketDebugTransport implements DebugTransport {

	private static final Logger logger = LoggerFactory.getLogger(SocketDebugTransport.class);

	private final Socket socket;

	private final AtomicBoolean closed = new AtomicBoolean(false);

	public SocketDebugTransport(Socket socket) {
		Assert.notNull(socket, "socket must not be null");
		this.socket = socket;
	}

	@Override
	public InputStream getInputStream() throws IOException {
		return this.socket.getInputStream();
	}

	@Override
	public OutputStream getOutputStream() throws IOException {
		return this.socket.getOutputStream();
	}

	@Override
	public void close() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		try {
			this.socket.close();
			logger.debug("Closed debug client socket {}", this.socket.getRemoteSocketAddress());
		}
		catch (IOException e) {
			logger.warn("Failed to close debug client socket {}: {}", this.socket.getRemoteSocketAddress(),
					e.getMessage());
		}
	}

	@Override
	public boolean isClosed() {
		return this.closed.get();
	}

}
