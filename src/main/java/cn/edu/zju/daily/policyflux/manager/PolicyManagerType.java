package cn.edu.zju.daily.policyflux.manager;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Execution topologies a policy manager can be configured with. */
public enum PolicyManagerType {
    SIMPLE("simple"),
    MULTI_PROCESS("multi-process"),
    DISTRIBUTED("distributed");

    private final String configName;

    PolicyManagerType(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * @throws IllegalArgumentException naming the value and the supported ones
     */
    public static PolicyManagerType fromString(String value) {
        for (PolicyManagerType type : values()) {
            if (type.configName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
                "Unsupported policy manager type: "
                        + value
                        + ". Supported types: "
                        + Arrays.stream(values())
                                .map(PolicyManagerType::getConfigName)
                                .collect(Collectors.joining(", ")));
    }
}
