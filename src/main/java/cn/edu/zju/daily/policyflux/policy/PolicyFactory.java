package cn.edu.zju.daily.policyflux.policy;

import cn.edu.zju.daily.policyflux.manager.PolicyConfigurationException;
import java.lang.reflect.InvocationTargetException;

/**
 * Creates trainable policies inside a trainer unit. Factories are referenced by class name so that
 * a forked trainer process can instantiate them, hence the public no-arg constructor requirement.
 */
public interface PolicyFactory {

    TrainablePolicy create(String policyName);

    static PolicyFactory forClassName(String className) {
        try {
            Class<?> clazz = Class.forName(className);
            if (!PolicyFactory.class.isAssignableFrom(clazz)) {
                throw new PolicyConfigurationException(
                        className + " does not implement " + PolicyFactory.class.getName());
            }
            return (PolicyFactory) clazz.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException
                | NoSuchMethodException
                | InstantiationException
                | IllegalAccessException
                | InvocationTargetException e) {
            throw new PolicyConfigurationException(
                    "Cannot instantiate policy factory " + className, e);
        }
    }
}
