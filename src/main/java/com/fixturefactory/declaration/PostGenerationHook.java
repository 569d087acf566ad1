package com.fixturefactory.declaration;

import java.util.Map;

/**
 * Callback run once the object exists.
 * <p>
 * The instance is the model object for BUILD and CREATE and a
 * {@link com.fixturefactory.strategy.StubObject} for STUB.
 */
@FunctionalInterface
public interface PostGenerationHook {

    /**
     * @param instance  the generated object or stub
     * @param create    whether the object was persisted (CREATE strategy)
     * @param extracted call-time value passed under the hook's own name, {@code null} if none
     * @param kwargs    call-time values passed as {@code hookName__key}, keyed by {@code key}
     */
    void call(Object instance, boolean create, Object extracted, Map<String, Object> kwargs);
}
