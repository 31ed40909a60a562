package org.calista.streetsense.ai.core;

/**
 * The intent catalog could not be loaded. Unchecked: a broken catalog is a deployment error, not
 * something a caller of {@link ClassifierEngine.Builder#build()} can recover from.
 */
public final class CatalogException extends RuntimeException {

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
