package com.contextbus.session;

/**
 * Thrown when a job key already has an unexpired session. Not retried.
 */
public class AlreadyRunningException extends RuntimeException {

    private final String jobKey;
    private final String activeSessionId;

    public AlreadyRunningException(String jobKey, String activeSessionId) {
        super("job " + jobKey + " is already running in session " + activeSessionId);
        this.jobKey = jobKey;
        this.activeSessionId = activeSessionId;
    }

    public String getJobKey() {
        return jobKey;
    }

    public String getActiveSessionId() {
        return activeSessionId;
    }
}
