// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust;

/**
 * Thrown on malformed address, IP or configuration input.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) { super(message); }

    public ValidationException(String message, Throwable cause) { super(message, cause); }

}
