package cn.edu.zju.daily.policyflux.manager;

/** A policy manager was used after {@code exit()}, or after a round it could not complete. */
public class ManagerClosedException extends IllegalStateException {

    public ManagerClosedException(String message) {
        super(message);
    }
}
