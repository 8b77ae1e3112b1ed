package com.di.chunkmutator.catalog;

/**
 * The segment list could not be read. Fatal to a run: nothing is mutated.
 */
public class CatalogUnavailableException extends RuntimeException {

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
