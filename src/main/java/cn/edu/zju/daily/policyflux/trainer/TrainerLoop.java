package cn.edu.zju.daily.policyflux.trainer;

import java.io.EOFException;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;

/** Serves a {@link TrainerUnit} over a {@link FramedPipe} until told to exit. */
@Slf4j
public class TrainerLoop implements Runnable {

    private final TrainerUnit unit;
    private final FramedPipe pipe;

    public TrainerLoop(TrainerUnit unit, FramedPipe pipe) {
        this.unit = unit;
        this.pipe = pipe;
    }

    @Override
    public void run() {
        // The pipe is closed on every exit path, so the manager sees end-of-stream instead of
        // waiting forever when this loop dies.
        try (FramedPipe ignored = pipe) {
            while (!unit.isExited()) {
                TrainerMessage reply = unit.handle(pipe.receive());
                if (reply != null) {
                    pipe.send(reply);
                }
            }
        } catch (EOFException e) {
            LOG.warn("{}: manager closed the pipe without EXIT", unit.getTrainerId());
        } catch (IOException e) {
            LOG.error("{}: pipe failure", unit.getTrainerId(), e);
        }
    }
}
