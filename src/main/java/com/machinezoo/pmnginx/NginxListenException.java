// Part of PMNginx
package com.machinezoo.pmnginx;

/**
 * Thrown when {@link NginxServer} cannot bind its listening socket.
 * The server is already stopped when this exception reaches the caller.
 */
public class NginxListenException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	public NginxListenException(String message, Throwable cause) {
		super(message, cause);
	}
}
