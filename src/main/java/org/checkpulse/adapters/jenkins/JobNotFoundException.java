package org.checkpulse.adapters.jenkins;

public class JobNotFoundException extends Exception {

    public JobNotFoundException(String jobName) {
        super("status for job " + jobName + " is not available");
    }
}
