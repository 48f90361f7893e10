package com.fieldservice.scheduling.exception;

/**
 * A job or contractor referenced by id does not exist.
 */
public class NotFoundException extends SchedulingException {

    public NotFoundException(String code, String message) {
        super(code, message);
    }

    public static NotFoundException job(Long jobId) {
        return new NotFoundException("JOB_NOT_FOUND", "Job " + jobId + " not found");
    }

    public static NotFoundException contractor(Long contractorId) {
        return new NotFoundException("CONTRACTOR_NOT_FOUND", "Contractor " + contractorId + " not found");
    }
}
