package cn.edu.zju.daily.policyflux.trainer;

import java.io.Closeable;
import java.time.Duration;

/** The manager's end of the connection to one trainer unit. */
public interface TrainerChannel extends Closeable {

    String getTrainerId();

    /**
     * @throws TrainerFailureException if the message cannot be delivered
     */
    void send(TrainerMessage message);

    /**
     * Waits for the trainer's next reply.
     *
     * @param timeout how long to wait, or null to wait indefinitely
     * @throws TrainerFailureException if the trainer died or did not reply in time
     */
    TrainerMessage receive(Duration timeout);

    @Override
    void close();
}
