package cn.edu.zju.daily.policyflux.utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Parameters regarding policy management. */
@Data
@NoArgsConstructor
@Slf4j
public class Parameters implements Serializable {

    public static Parameters load(String path, boolean isResource) {
        Yaml yaml = new Yaml(new Constructor(Parameters.class, new LoaderOptions()));
        if (isResource) {
            String url = path.startsWith("/") ? path : "/" + path;
            LOG.info("Reading params from resource {}", url);
            try (InputStream in = Parameters.class.getResourceAsStream(url)) {
                if (in == null) {
                    throw new IllegalArgumentException("Resource not found: " + url);
                }
                return yaml.load(in);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        } else {
            LOG.info("Reading params from file {}", path);
            try (InputStream in = Files.newInputStream(Paths.get(path))) {
                return yaml.load(in);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    // ======================
    // Topology
    // ======================
    /** "simple", "multi-process" or "distributed". */
    private String managerType = "simple";

    /** Number of trainer groups for the multi-process manager. */
    private int numTrainers = 1;

    /** Name of the training cluster for the distributed manager. */
    private String group = "POLICY_GROUP";

    /** Policy name to the class name of its policy factory, for forked trainers. */
    private Map<String, String> policyFactories = new LinkedHashMap<>();

    /** JVM options of forked trainer processes. */
    private List<String> trainerJvmOptions = new ArrayList<>();

    // ======================
    // Update conditions
    // ======================
    /** Policy name to the number of new experiences that triggers an update. Defaults to 1. */
    private Map<String, Integer> updateTrigger = new LinkedHashMap<>();

    /** Policy name to the number of experiences required before the first update. Defaults to 1. */
    private Map<String, Integer> warmup = new LinkedHashMap<>();

    /** Deadline for all trainer replies of a round in millis; 0 waits forever. */
    private long roundTimeoutMillis;

    // ======================
    // Checkpoints
    // ======================
    /** Directory to restore policies from at start-up; empty disables loading. */
    private String loadDir;

    private String checkpointDir;

    /** Checkpoint updated policies every this many versions; 0 disables checkpointing. */
    private int checkpointEvery;
}
