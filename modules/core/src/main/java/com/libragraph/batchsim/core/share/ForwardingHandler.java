package com.libragraph.batchsim.core.share;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;

/**
 * Proxy handler that forwards every interface call to the manager.
 * {@code Object} methods are answered locally.
 */
final class ForwardingHandler implements InvocationHandler {

    private final SharedInputManager manager;
    private final String tag;
    private final Object target;

    ForwardingHandler(SharedInputManager manager, String tag, Object target) {
        this.manager = manager;
        this.tag = tag;
        this.target = target;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            switch (method.getName()) {
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "toString":
                    return "SharedInput[" + tag + "]";
                default:
                    return method.invoke(target, args);
            }
        }
        return manager.invoke(tag, target, method, args);
    }
}
