package cn.edu.zju.daily.policyflux.trainer;

import lombok.Getter;

/** A trainer unit failed to complete its part of an update round. */
@Getter
public class TrainerFailureException extends RuntimeException {

    public enum Cause {
        /** The trainer replied with an error payload. */
        ERROR_REPLY,
        /** The connection to the trainer was lost, usually because it died. */
        CRASHED,
        /** The trainer did not reply before the round deadline. */
        TIMED_OUT
    }

    private final String trainerId;
    private final Cause failure;

    public TrainerFailureException(String trainerId, Cause failure, String message) {
        super(trainerId + ": " + message);
        this.trainerId = trainerId;
        this.failure = failure;
    }

    public TrainerFailureException(
            String trainerId, Cause failure, String message, Throwable cause) {
        super(trainerId + ": " + message, cause);
        this.trainerId = trainerId;
        this.failure = failure;
    }
}
