package cn.edu.zju.daily.policyflux.transport;

import cn.edu.zju.daily.policyflux.trainer.TrainerMessage;
import java.io.Closeable;

/** A trainer node's side of a multi-node message transport. */
public interface TrainerEndpoint extends Closeable {

    String getName();

    /** Blocks until the manager sends the next message. */
    TrainerMessage receive() throws InterruptedException;

    void reply(TrainerMessage message);

    @Override
    void close();
}
