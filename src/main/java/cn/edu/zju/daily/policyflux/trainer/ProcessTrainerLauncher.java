package cn.edu.zju.daily.policyflux.trainer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Forks one JVM per trainer unit running {@link TrainerProcessMain}. The child's stdin and stdout
 * form the byte pipe; its stderr (and therefore its log) is inherited from this process.
 */
@Slf4j
public class ProcessTrainerLauncher implements TrainerLauncher {

    private static final long EXIT_GRACE_MILLIS = 5000;

    private final String javaExecutable;
    private final String classPath;
    private final List<String> jvmOptions;

    public ProcessTrainerLauncher(List<String> jvmOptions) {
        this(
                Paths.get(System.getProperty("java.home"), "bin", "java").toString(),
                System.getProperty("java.class.path"),
                jvmOptions);
    }

    public ProcessTrainerLauncher(String javaExecutable, String classPath, List<String> jvmOptions) {
        this.javaExecutable = javaExecutable;
        this.classPath = classPath;
        this.jvmOptions = jvmOptions == null ? List.of() : List.copyOf(jvmOptions);
    }

    public List<String> buildCommand(String trainerId, Map<String, String> policyFactories) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(classPath);
        command.add(TrainerProcessMain.class.getName());
        command.add(trainerId);
        policyFactories.forEach((name, factoryClass) -> command.add(name + "=" + factoryClass));
        return command;
    }

    @Override
    public TrainerChannel launch(String trainerId, Map<String, String> policyFactories) {
        List<String> command = buildCommand(trainerId, policyFactories);
        Process process;
        try {
            process =
                    new ProcessBuilder(command)
                            .redirectError(ProcessBuilder.Redirect.INHERIT)
                            .start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start trainer process " + trainerId, e);
        }
        LOG.info("Started {} as process {}", trainerId, process.pid());
        FramedPipe pipe = new FramedPipe(process.getInputStream(), process.getOutputStream());
        return new PipeTrainerChannel(trainerId, pipe, () -> reap(trainerId, process));
    }

    private static void reap(String trainerId, Process process) {
        try {
            if (!process.waitFor(EXIT_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                LOG.warn("{} did not exit in {} ms, destroying it", trainerId, EXIT_GRACE_MILLIS);
                process.destroyForcibly();
            } else {
                LOG.info("{} exited with code {}", trainerId, process.exitValue());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
}
