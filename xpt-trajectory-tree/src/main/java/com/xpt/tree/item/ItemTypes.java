package com.xpt.tree.item;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of item type names to factories. Loading recreates items by the type name stored with
 * each leaf. {@link Parameter} and {@link Result} are always registered.
 */
public final class ItemTypes {

    private static final Map<String, Supplier<? extends ItemContract>> FACTORIES = new ConcurrentHashMap<>();

    static {
        FACTORIES.put(Parameter.TYPE_NAME, Parameter::new);
        FACTORIES.put(Result.TYPE_NAME, Result::new);
    }

    private ItemTypes() {
    }

    public static void register(String typeName, Supplier<? extends ItemContract> factory) {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(factory, "factory");
        FACTORIES.put(typeName, factory);
    }

    public static boolean isRegistered(String typeName) {
        return typeName != null && FACTORIES.containsKey(typeName);
    }

    /**
     * Creates an empty item of the given type.
     *
     * @throws IllegalArgumentException if the type is not registered
     */
    public static ItemContract create(String typeName) {
        Supplier<? extends ItemContract> factory = typeName == null ? null : FACTORIES.get(typeName);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown item type: " + typeName + "; registered: " + FACTORIES.keySet());
        }
        return factory.get();
    }
}
