package com.delta.extractor.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Fields pulled out of a versioned script. The signature timestamp is required, so a record
 * without it cannot exist; the function bodies are optional.
 */
public record ExtractedFields(
    String signatureTimestamp,
    Optional<String> decipherFunction,
    Optional<String> throttleFunction
) {
    public ExtractedFields {
        Objects.requireNonNull(signatureTimestamp, "signatureTimestamp");
        decipherFunction = decipherFunction == null ? Optional.empty() : decipherFunction;
        throttleFunction = throttleFunction == null ? Optional.empty() : throttleFunction;
    }
}
