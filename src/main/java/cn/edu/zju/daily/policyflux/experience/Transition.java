package cn.edu.zju.daily.policyflux.experience;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One state/action/reward transition produced by a rollout. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Transition implements Serializable {

    private double[] state;
    private double[] action;
    private double reward;
    private double[] nextState;

    /** Whether the episode ended with this transition. */
    private boolean terminal;
}
