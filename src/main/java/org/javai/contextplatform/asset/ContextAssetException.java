package org.javai.contextplatform.asset;

/**
 * Base class for failures raised by the context asset platform.
 */
public class ContextAssetException extends RuntimeException {

	public ContextAssetException(String message) {
		super(message);
	}

	public ContextAssetException(String message, Throwable cause) {
		super(message, cause);
	}
}
