package com.delta.extractor.error;

/**
 * Raised when shutdown stops a transfer between chunks. The last checkpoint is kept.
 */
public class TransferDrainedException extends ExtractorException {
    private final long bytesCompleted;

    public TransferDrainedException(String jobId, long bytesCompleted) {
        super(ErrorKind.TRANSIENT_NETWORK, "Transfer " + jobId + " drained at byte " + bytesCompleted);
        this.bytesCompleted = bytesCompleted;
    }

    public long bytesCompleted() {
        return bytesCompleted;
    }
}
