package cn.edu.zju.daily.policyflux.trainer;

import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import cn.edu.zju.daily.policyflux.policy.PolicyState;
import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The single message schema of the trainer protocol. Which fields are set depends on {@link
 * #type}:
 *
 * <ul>
 *   <li>{@code INIT_POLICY_STATE}: {@code policyStates}
 *   <li>{@code LEARN}: {@code experiences} of the trainer's policies that are due for an update
 *   <li>{@code EXIT}: nothing
 *   <li>{@code INIT_ACK}: {@code trainerId}
 *   <li>{@code LEARN_RESULT}: {@code trainerId}, {@code policyStates} of the updated policies only,
 *       {@code tracker}
 *   <li>{@code ERROR}: {@code trainerId}, {@code error}
 * </ul>
 */
@Data
@NoArgsConstructor
public class TrainerMessage implements Serializable {

    private MessageType type;
    private String trainerId;
    private Map<String, PolicyState> policyStates = Collections.emptyMap();
    private Map<String, ExperienceBatch> experiences = Collections.emptyMap();
    private TrainerTracker tracker;
    private String error;

    public TrainerMessage(MessageType type) {
        this.type = type;
    }

    public static TrainerMessage init(Map<String, PolicyState> policyStates) {
        TrainerMessage message = new TrainerMessage(MessageType.INIT_POLICY_STATE);
        message.setPolicyStates(policyStates);
        return message;
    }

    public static TrainerMessage learn(Map<String, ExperienceBatch> experiences) {
        TrainerMessage message = new TrainerMessage(MessageType.LEARN);
        message.setExperiences(experiences);
        return message;
    }

    public static TrainerMessage exit() {
        return new TrainerMessage(MessageType.EXIT);
    }

    public static TrainerMessage initAck(String trainerId) {
        TrainerMessage message = new TrainerMessage(MessageType.INIT_ACK);
        message.setTrainerId(trainerId);
        return message;
    }

    public static TrainerMessage learnResult(
            String trainerId, Map<String, PolicyState> policyStates, TrainerTracker tracker) {
        TrainerMessage message = new TrainerMessage(MessageType.LEARN_RESULT);
        message.setTrainerId(trainerId);
        message.setPolicyStates(policyStates);
        message.setTracker(tracker);
        return message;
    }

    public static TrainerMessage error(String trainerId, String error) {
        TrainerMessage message = new TrainerMessage(MessageType.ERROR);
        message.setTrainerId(trainerId);
        message.setError(error);
        return message;
    }
}
