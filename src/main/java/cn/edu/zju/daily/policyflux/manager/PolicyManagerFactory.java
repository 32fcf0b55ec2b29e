package cn.edu.zju.daily.policyflux.manager;

import cn.edu.zju.daily.policyflux.policy.Policy;
import cn.edu.zju.daily.policyflux.trainer.ProcessTrainerLauncher;
import cn.edu.zju.daily.policyflux.trainer.TrainerLauncher;
import cn.edu.zju.daily.policyflux.trainer.TrainerTracker;
import cn.edu.zju.daily.policyflux.transport.ManagerEndpoint;
import cn.edu.zju.daily.policyflux.utils.Parameters;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/** Builds the policy manager variant selected by {@link Parameters#getManagerType()}. */
@Slf4j
public class PolicyManagerFactory {

    private final Parameters params;
    private Consumer<List<TrainerTracker>> postUpdate;
    private TrainerLauncher launcher;
    private ManagerEndpoint endpoint;

    public PolicyManagerFactory(Parameters params) {
        this.params = params;
    }

    public PolicyManagerFactory postUpdate(Consumer<List<TrainerTracker>> postUpdate) {
        this.postUpdate = postUpdate;
        return this;
    }

    /** Overrides how the multi-process manager starts trainers; forks JVMs by default. */
    public PolicyManagerFactory launcher(TrainerLauncher launcher) {
        this.launcher = launcher;
        return this;
    }

    /** The transport of the distributed manager. Required for that type. */
    public PolicyManagerFactory endpoint(ManagerEndpoint endpoint) {
        this.endpoint = endpoint;
        return this;
    }

    ManagerOptions options() {
        ManagerOptions options =
                ManagerOptions.defaults()
                        .updateTrigger(params.getUpdateTrigger())
                        .warmup(params.getWarmup())
                        .postUpdate(postUpdate);
        if (params.getRoundTimeoutMillis() > 0) {
            options.roundTimeout(Duration.ofMillis(params.getRoundTimeoutMillis()));
        }
        if (StringUtils.isNotBlank(params.getLoadDir())) {
            options.loadDir(Paths.get(params.getLoadDir()));
        }
        if (StringUtils.isNotBlank(params.getCheckpointDir())) {
            options.checkpoint(Paths.get(params.getCheckpointDir()), params.getCheckpointEvery());
        }
        return options;
    }

    public PolicyManager create(Map<String, ? extends Policy> policies) {
        PolicyManagerType type = PolicyManagerType.fromString(params.getManagerType());
        LOG.info("Creating {} policy manager for policies {}", type.getConfigName(), policies.keySet());
        switch (type) {
            case SIMPLE:
                return new LocalPolicyManager(policies, options());
            case MULTI_PROCESS:
                return new MultiProcessPolicyManager(
                        policies,
                        params.getNumTrainers(),
                        params.getPolicyFactories(),
                        launcher != null
                                ? launcher
                                : new ProcessTrainerLauncher(params.getTrainerJvmOptions()),
                        options());
            case DISTRIBUTED:
                if (endpoint == null) {
                    throw new PolicyConfigurationException(
                            "The distributed policy manager of group "
                                    + params.getGroup()
                                    + " needs a manager endpoint");
                }
                return new DistributedPolicyManager(policies, endpoint, options());
            default:
                throw new IllegalStateException("Unhandled manager type " + type);
        }
    }
}
