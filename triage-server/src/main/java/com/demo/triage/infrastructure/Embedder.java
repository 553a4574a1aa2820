package com.demo.triage.infrastructure;

/**
 * Maps text to a fixed-length vector.
 */
public interface Embedder {

    /**
     * @throws com.demo.triage.exception.CollaboratorException on timeout, transport failure or malformed response
     */
    double[] embed(String text);
}
