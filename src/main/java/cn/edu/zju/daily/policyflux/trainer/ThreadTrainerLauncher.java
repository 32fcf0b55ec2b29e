package cn.edu.zju.daily.policyflux.trainer;

import cn.edu.zju.daily.policyflux.utils.ThreadUtils;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs each trainer unit on its own thread inside this JVM, connected through in-memory byte
 * pipes. Messages take the same framed, pickled path as with {@link ProcessTrainerLauncher}, so
 * trainer and manager never share objects.
 */
@Slf4j
public class ThreadTrainerLauncher implements TrainerLauncher {

    private static final int PIPE_BUFFER_BYTES = 1 << 16;

    @Override
    public TrainerChannel launch(String trainerId, Map<String, String> policyFactories) {
        try {
            PipedOutputStream toTrainer = new PipedOutputStream();
            PipedInputStream trainerIn = new PipedInputStream(toTrainer, PIPE_BUFFER_BYTES);
            PipedOutputStream trainerOut = new PipedOutputStream();
            PipedInputStream fromTrainer = new PipedInputStream(trainerOut, PIPE_BUFFER_BYTES);

            TrainerUnit unit =
                    new TrainerUnit(trainerId, TrainerLauncher.createPolicies(policyFactories));
            Thread thread =
                    ThreadUtils.startDaemon(
                            "trainer-" + trainerId,
                            new TrainerLoop(unit, new FramedPipe(trainerIn, trainerOut)));
            LOG.info("Started {} on thread {}", trainerId, thread.getName());

            return new PipeTrainerChannel(
                    trainerId, new FramedPipe(fromTrainer, toTrainer), () -> {});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to connect pipes for " + trainerId, e);
        }
    }
}
