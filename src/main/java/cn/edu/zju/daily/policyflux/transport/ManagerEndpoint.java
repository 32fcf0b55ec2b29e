package cn.edu.zju.daily.policyflux.transport;

import cn.edu.zju.daily.policyflux.trainer.TrainerMessage;
import java.io.Closeable;
import java.time.Duration;
import java.util.List;

/**
 * The manager's side of a multi-node message transport. Trainer nodes are addressed by name; the
 * transport itself (broker, sockets, ...) is up to the implementation.
 */
public interface ManagerEndpoint extends Closeable {

    /** Name of the training cluster this endpoint belongs to. */
    String getGroup();

    /** Names of the trainer nodes reachable through this endpoint, in a fixed order. */
    List<String> getWorkers();

    void send(String destination, TrainerMessage message);

    /**
     * Waits for the next message from any trainer node.
     *
     * @param timeout how long to wait, or null to wait indefinitely
     * @return the message and its sender, or null on timeout
     */
    Envelope receive(Duration timeout);

    @Override
    void close();
}
