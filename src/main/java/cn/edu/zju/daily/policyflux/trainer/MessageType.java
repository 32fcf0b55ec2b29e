package cn.edu.zju.daily.policyflux.trainer;

/** Tags of the messages exchanged between a policy manager and its trainer units. */
public enum MessageType {
    // manager -> trainer
    INIT_POLICY_STATE,
    LEARN,
    EXIT,

    // trainer -> manager
    INIT_ACK,
    LEARN_RESULT,
    ERROR
}
