package cn.edu.zju.daily.policyflux.manager;

/** The policies or settings handed to a policy manager are unusable. */
public class PolicyConfigurationException extends RuntimeException {

    public PolicyConfigurationException(String message) {
        super(message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
