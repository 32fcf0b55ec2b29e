package cn.edu.zju.daily.policyflux.policy;

/** A policy that maps states to actions. */
public interface Policy {

    String getName();

    double[] chooseAction(double[] state);
}
