package com.sop.network.export;

/**
 * Runtime exception thrown when a network or one of its views cannot be
 * serialized or written.
 */
public class NetworkExportException extends RuntimeException {

    public NetworkExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
