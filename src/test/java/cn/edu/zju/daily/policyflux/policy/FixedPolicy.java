package cn.edu.zju.daily.policyflux.policy;

/** A policy without a model, which a policy manager must reject. */
public class FixedPolicy implements Policy {

    private final String name;

    public FixedPolicy(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public double[] chooseAction(double[] state) {
        return new double[] {0};
    }
}
