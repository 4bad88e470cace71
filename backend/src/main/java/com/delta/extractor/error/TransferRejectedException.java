package com.delta.extractor.error;

public class TransferRejectedException extends ExtractorException {
    private final String jobId;

    public TransferRejectedException(String jobId, String reason) {
        super(ErrorKind.TERMINAL_REQUEST, "Transfer " + jobId + " rejected: " + reason);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
