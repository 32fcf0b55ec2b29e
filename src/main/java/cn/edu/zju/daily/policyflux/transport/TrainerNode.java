package cn.edu.zju.daily.policyflux.transport;

import cn.edu.zju.daily.policyflux.trainer.TrainerMessage;
import cn.edu.zju.daily.policyflux.trainer.TrainerUnit;
import lombok.extern.slf4j.Slf4j;

/** Serves a {@link TrainerUnit} over a {@link TrainerEndpoint} until told to exit. */
@Slf4j
public class TrainerNode implements Runnable {

    private final TrainerUnit unit;
    private final TrainerEndpoint endpoint;

    public TrainerNode(TrainerUnit unit, TrainerEndpoint endpoint) {
        this.unit = unit;
        this.endpoint = endpoint;
    }

    @Override
    public void run() {
        LOG.info("Trainer node {} started", endpoint.getName());
        try (TrainerEndpoint ignored = endpoint) {
            while (!unit.isExited()) {
                TrainerMessage reply = unit.handle(endpoint.receive());
                if (reply != null) {
                    endpoint.reply(reply);
                }
            }
        } catch (InterruptedException e) {
            LOG.warn("Trainer node {} interrupted", endpoint.getName());
            Thread.currentThread().interrupt();
        }
    }
}
