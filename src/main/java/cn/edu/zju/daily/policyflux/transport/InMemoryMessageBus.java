package cn.edu.zju.daily.policyflux.transport;

import cn.edu.zju.daily.policyflux.trainer.PickleMessageCodec;
import cn.edu.zju.daily.policyflux.trainer.TrainerMessage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.tuple.Pair;

/**
 * A single-host message bus connecting one manager endpoint to a fixed set of trainer endpoints.
 * Messages are pickled on send, so both sides only ever see their own copies.
 *
 * <p>Trainers are named {@code <group>.TRAINER.<i>}.
 */
@Slf4j
public class InMemoryMessageBus {

    private final String group;
    private final PickleMessageCodec codec = new PickleMessageCodec();
    private final Map<String, BlockingQueue<byte[]>> trainerQueues = new LinkedHashMap<>();
    private final BlockingQueue<Pair<String, byte[]>> managerQueue = new LinkedBlockingQueue<>();
    private volatile boolean closed = false;

    public InMemoryMessageBus(String group, int numTrainers) {
        if (numTrainers < 1) {
            throw new IllegalArgumentException("numTrainers must be positive, got " + numTrainers);
        }
        this.group = group;
        for (int i = 0; i < numTrainers; i++) {
            trainerQueues.put(group + ".TRAINER." + i, new LinkedBlockingQueue<>());
        }
    }

    public List<String> getTrainerNames() {
        return Collections.unmodifiableList(new ArrayList<>(trainerQueues.keySet()));
    }

    public ManagerEndpoint managerEndpoint() {
        return new BusManagerEndpoint();
    }

    public TrainerEndpoint trainerEndpoint(String name) {
        if (!trainerQueues.containsKey(name)) {
            throw new IllegalArgumentException(
                    "Unknown trainer " + name + ", expected one of " + trainerQueues.keySet());
        }
        return new BusTrainerEndpoint(name);
    }

    private byte[] encode(TrainerMessage message) {
        try {
            return codec.encode(message);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private TrainerMessage decode(byte[] bytes) {
        try {
            return codec.decode(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Message bus " + group + " is closed");
        }
    }

    private class BusManagerEndpoint implements ManagerEndpoint {

        @Override
        public String getGroup() {
            return group;
        }

        @Override
        public List<String> getWorkers() {
            return getTrainerNames();
        }

        @Override
        public void send(String destination, TrainerMessage message) {
            ensureOpen();
            BlockingQueue<byte[]> queue = trainerQueues.get(destination);
            if (queue == null) {
                throw new IllegalArgumentException("Unknown destination " + destination);
            }
            queue.add(encode(message));
        }

        @Override
        public Envelope receive(Duration timeout) {
            ensureOpen();
            try {
                Pair<String, byte[]> received =
                        timeout == null
                                ? managerQueue.take()
                                : managerQueue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (received == null) {
                    return null;
                }
                return new Envelope(decode(received.getRight()), received.getLeft());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }

        @Override
        public void close() {
            closed = true;
            LOG.info("Closed manager endpoint of group {}", group);
        }
    }

    private class BusTrainerEndpoint implements TrainerEndpoint {

        private final String name;

        private BusTrainerEndpoint(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public TrainerMessage receive() throws InterruptedException {
            return decode(trainerQueues.get(name).take());
        }

        @Override
        public void reply(TrainerMessage message) {
            managerQueue.add(Pair.of(name, encode(message)));
        }

        @Override
        public void close() {
            LOG.debug("Closed trainer endpoint {}", name);
        }
    }
}
