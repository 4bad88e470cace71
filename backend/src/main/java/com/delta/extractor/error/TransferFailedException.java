package com.delta.extractor.error;

import com.delta.extractor.model.ResourceDescriptor;

/**
 * Transfer failure handed back to the orchestrator. The job record and partial output stay
 * on disk so the same job id can be resumed.
 */
public class TransferFailedException extends ExtractorException {
    private final String jobId;
    private final ResourceDescriptor descriptor;

    public TransferFailedException(ErrorKind kind, String jobId, ResourceDescriptor descriptor, Throwable cause) {
        super(kind, "Transfer " + jobId + " failed for " + describe(descriptor) + ": " + messageOf(cause), cause);
        this.jobId = jobId;
        this.descriptor = descriptor;
    }

    public String jobId() {
        return jobId;
    }

    public ResourceDescriptor descriptor() {
        return descriptor;
    }

    private static String describe(ResourceDescriptor descriptor) {
        return descriptor == null ? "<no descriptor>" : descriptor.resourceId();
    }

    private static String messageOf(Throwable cause) {
        return cause == null ? "unknown" : cause.getMessage();
    }
}
