package cn.edu.zju.daily.policyflux.trainer;

import static cn.edu.zju.daily.policyflux.trainer.TrainerFailureException.Cause.CRASHED;
import static cn.edu.zju.daily.policyflux.trainer.TrainerFailureException.Cause.ERROR_REPLY;
import static cn.edu.zju.daily.policyflux.trainer.TrainerFailureException.Cause.TIMED_OUT;

import cn.edu.zju.daily.policyflux.utils.ThreadUtils;
import java.io.EOFException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link TrainerChannel} over a {@link FramedPipe}. Replies are read by a background thread so
 * that the manager can wait with a deadline, and a closed pipe is reported as a crash rather than
 * as a slow trainer. A frame that does not decode is reported as an error reply.
 */
@Slf4j
public class PipeTrainerChannel implements TrainerChannel {

    private final String trainerId;
    private final FramedPipe pipe;
    private final Runnable onClose;
    private final BlockingQueue<Inbound> inbox = new LinkedBlockingQueue<>();
    private volatile boolean closed = false;

    /**
     * @param onClose releases whatever runs the trainer (e.g. destroys its process)
     */
    public PipeTrainerChannel(String trainerId, FramedPipe pipe, Runnable onClose) {
        this.trainerId = trainerId;
        this.pipe = pipe;
        this.onClose = onClose;
        ThreadUtils.startDaemon("reader-" + trainerId, this::readReplies);
    }

    private void readReplies() {
        try {
            while (!closed) {
                try {
                    inbox.put(Inbound.reply(pipe.receive()));
                } catch (MalformedMessageException e) {
                    // the frame was consumed whole, so the stream is still in step
                    LOG.error("{}: malformed reply", trainerId, e);
                    inbox.put(Inbound.failure(ERROR_REPLY, "malformed reply", e));
                }
            }
        } catch (EOFException e) {
            inbox.add(Inbound.failure(CRASHED, "connection lost", e));
        } catch (IOException e) {
            if (!closed) {
                LOG.error("{}: failed to read reply", trainerId, e);
            }
            inbox.add(Inbound.failure(CRASHED, "connection lost", e));
        } catch (RuntimeException e) {
            LOG.error("{}: reply reader failed", trainerId, e);
            inbox.add(Inbound.failure(CRASHED, "reply reader failed", e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String getTrainerId() {
        return trainerId;
    }

    @Override
    public void send(TrainerMessage message) {
        if (closed) {
            throw new IllegalStateException("Channel to " + trainerId + " is closed");
        }
        try {
            pipe.send(message);
        } catch (IOException e) {
            throw new TrainerFailureException(
                    trainerId, CRASHED, "cannot send " + message.getType(), e);
        }
    }

    @Override
    public TrainerMessage receive(Duration timeout) {
        Inbound inbound;
        try {
            inbound =
                    timeout == null
                            ? inbox.take()
                            : inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrainerFailureException(trainerId, TIMED_OUT, "interrupted while waiting", e);
        }
        if (inbound == null) {
            throw new TrainerFailureException(
                    trainerId, TIMED_OUT, "no reply within " + timeout.toMillis() + " ms");
        }
        if (inbound.failure != null) {
            if (inbound.cause == CRASHED) {
                // keep reporting the failure to later receivers
                inbox.add(inbound);
            }
            throw new TrainerFailureException(
                    trainerId, inbound.cause, inbound.description, inbound.failure);
        }
        return inbound.message;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            pipe.close();
        } catch (IOException e) {
            LOG.warn("{}: failed to close pipe: {}", trainerId, e.getMessage());
        } finally {
            onClose.run();
        }
    }

    private static class Inbound {
        private final TrainerMessage message;
        private final Exception failure;
        private final TrainerFailureException.Cause cause;
        private final String description;

        private Inbound(
                TrainerMessage message,
                Exception failure,
                TrainerFailureException.Cause cause,
                String description) {
            this.message = message;
            this.failure = failure;
            this.cause = cause;
            this.description = description;
        }

        static Inbound reply(TrainerMessage message) {
            return new Inbound(message, null, null, null);
        }

        static Inbound failure(
                TrainerFailureException.Cause cause, String description, Exception failure) {
            return new Inbound(null, failure, cause, description);
        }
    }
}
