package com.sop.network.resolve;

import java.io.IOException;

/**
 * Finds the raw text of the document identified by a reference code.
 * How the code is matched against available documents is entirely up to the implementation.
 */
@FunctionalInterface
public interface DocumentLocator {

    /**
     * @return the document, or {@link LocatorResult#notFound()} when there is none
     * @throws IOException if the document exists but could not be read
     */
    LocatorResult locate(String referenceCode) throws IOException;
}
