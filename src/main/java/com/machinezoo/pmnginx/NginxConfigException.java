// Part of PMNginx
package com.machinezoo.pmnginx;

/**
 * Thrown when configuration cannot be turned into a usable {@link ServerConfig}.
 */
public class NginxConfigException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	public NginxConfigException(String message) {
		super(message);
	}
	public NginxConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
