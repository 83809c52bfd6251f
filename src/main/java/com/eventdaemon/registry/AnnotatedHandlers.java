package com.eventdaemon.registry;

import com.eventdaemon.gateway.EventPayload;
import com.eventdaemon.gateway.GatewayConnection;
import com.eventdaemon.loader.HandlerLoader;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.concurrent.CompletionStage;

/** Adapts {@link OnEvent} methods of a handler object to {@link EventHandler}s. */
final class AnnotatedHandlers {

    private AnnotatedHandlers() {}

    /** Records every {@link OnEvent} method of {@code target}, in method-name order. */
    static void register(Object target, HandlerRegistrar registrar) {
        for (Method method : HandlerLoader.annotatedMethods(target.getClass())) {
            String eventName = method.getAnnotation(OnEvent.class).value();
            String name = target.getClass().getName() + "#" + method.getName();
            registrar.collect(eventName).apply(name, adapt(target, method));
        }
    }

    static EventHandler adapt(Object target, Method method) {
        if (!Arrays.equals(method.getParameterTypes(), new Class<?>[] {GatewayConnection.class, EventPayload.class})) {
            throw new IllegalArgumentException("@OnEvent method " + method.getName()
                    + " must take (GatewayConnection, EventPayload)");
        }
        method.setAccessible(true);
        Class<?> returnType = method.getReturnType();
        if (returnType == void.class) {
            return (SyncEventHandler) (connection, payload) -> invoke(target, method, connection, payload);
        }
        if (CompletionStage.class.isAssignableFrom(returnType)) {
            return (AsyncEventHandler) (connection, payload) ->
                    (CompletionStage<?>) invoke(target, method, connection, payload);
        }
        throw new IllegalArgumentException("@OnEvent method " + method.getName()
                + " must return void or a CompletionStage, not " + returnType.getName());
    }

    private static Object invoke(Object target, Method method, GatewayConnection connection, EventPayload payload)
            throws Exception {
        try {
            return method.invoke(target, connection, payload);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
