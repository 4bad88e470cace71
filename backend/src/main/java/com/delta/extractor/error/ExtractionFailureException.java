package com.delta.extractor.error;

public class ExtractionFailureException extends ExtractorException {
    private final String field;

    public ExtractionFailureException(String field, String message) {
        super(ErrorKind.EXTRACTION_FAILURE, message);
        this.field = field;
    }

    public ExtractionFailureException(String field, String message, Throwable cause) {
        super(ErrorKind.EXTRACTION_FAILURE, message, cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
