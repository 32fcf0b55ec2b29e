package cn.edu.zju.daily.policyflux.policy;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.SerializationUtils;

/** Saves and loads policy states as one file per policy, named after the policy. */
@Slf4j
public class PolicyCheckpointer {

    private final Path directory;

    public PolicyCheckpointer(Path directory) {
        this.directory = directory;
    }

    public Path pathOf(String policyName) {
        return directory.resolve(policyName);
    }

    /**
     * Loads the saved state of a policy.
     *
     * @return the state, or empty if no checkpoint exists for the policy
     */
    public Optional<PolicyState> load(String policyName) {
        Path path = pathOf(policyName);
        if (!Files.isRegularFile(path)) {
            LOG.warn("Policy {} is skipped because no checkpoint is found at {}", policyName, path);
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            PolicyState state = SerializationUtils.deserialize(in);
            LOG.info("Loaded policy {} from {}", policyName, path);
            return Optional.of(state);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint " + path, e);
        }
    }

    /** Loads every available checkpoint into the given policies; missing ones are skipped. */
    public void loadInto(Map<String, ? extends TrainablePolicy> policies) {
        policies.forEach((name, policy) -> load(name).ifPresent(policy::setState));
    }

    public void save(String policyName, PolicyState state) {
        Path path = pathOf(policyName);
        try {
            Files.createDirectories(directory);
            try (OutputStream out = Files.newOutputStream(path)) {
                SerializationUtils.serialize(state, out);
            }
            LOG.debug("Saved policy {} to {}", policyName, path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write checkpoint " + path, e);
        }
    }

    public void saveAll(Map<String, PolicyState> states) {
        states.forEach(this::save);
    }
}
