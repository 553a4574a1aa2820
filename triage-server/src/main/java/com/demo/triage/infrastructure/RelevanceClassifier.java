package com.demo.triage.infrastructure;

import com.demo.triage.domain.ClassificationResult;

/**
 * Decides whether a chat message deserves operator attention.
 */
public interface RelevanceClassifier {

    /**
     * @return a well-formed result
     * @throws com.demo.triage.exception.CollaboratorException on timeout, transport failure or malformed response
     */
    ClassificationResult classify(String text);
}
