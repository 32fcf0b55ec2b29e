package cn.edu.zju.daily.policyflux.transport;

import cn.edu.zju.daily.policyflux.trainer.TrainerMessage;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/** A received message together with the name of the peer that sent it. */
@Getter
@ToString
@AllArgsConstructor
public class Envelope {
    private final TrainerMessage message;
    private final String sender;
}
