package cn.edu.zju.daily.policyflux.trainer;

import java.io.FileDescriptor;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of a forked trainer process.
 *
 * <p>Usage: {@code TrainerProcessMain <trainerId> <policyName>=<factoryClass>...}
 */
@Slf4j
public class TrainerProcessMain {

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println(
                    "Usage: TrainerProcessMain <trainerId> <policyName>=<factoryClass>...");
            System.exit(2);
        }
        String trainerId = args[0];
        Map<String, String> policyFactories = parseFactories(args);

        // Anything printed by policy code must not corrupt the message pipe.
        FileOutputStream pipeOut = new FileOutputStream(FileDescriptor.out);
        System.setOut(System.err);

        TrainerUnit unit =
                new TrainerUnit(trainerId, TrainerLauncher.createPolicies(policyFactories));
        LOG.info("{} hosting {}", trainerId, policyFactories.keySet());
        new TrainerLoop(unit, new FramedPipe(new FileInputStream(FileDescriptor.in), pipeOut))
                .run();
        System.exit(unit.isExited() ? 0 : 1);
    }

    static Map<String, String> parseFactories(String[] args) {
        Map<String, String> policyFactories = new LinkedHashMap<>();
        for (int i = 1; i < args.length; i++) {
            int split = args[i].indexOf('=');
            if (split <= 0 || split == args[i].length() - 1) {
                throw new IllegalArgumentException(
                        "Expected <policyName>=<factoryClass>, got " + args[i]);
            }
            policyFactories.put(args[i].substring(0, split), args[i].substring(split + 1));
        }
        return policyFactories;
    }
}
