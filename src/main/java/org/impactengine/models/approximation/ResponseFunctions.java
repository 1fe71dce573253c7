package org.impactengine.models.approximation;

import org.impactengine.api.registry.Registry;

/**
 * Process-wide registry of response functions, preloaded with {@code linear}.
 */
public final class ResponseFunctions {

    private static final Registry<ResponseFunction> REGISTRY = new Registry<>("response function", ResponseFunction.class);

    static {
        REGISTRY.register(LinearResponse.NAME, LinearResponse.class);
    }

    private ResponseFunctions() {
    }

    /**
     * @throws org.impactengine.api.registry.UnknownKeyException listing the available functions
     */
    public static ResponseFunction get(String name) {
        return REGISTRY.get(name);
    }

    public static boolean contains(String name) {
        return REGISTRY.contains(name);
    }

    /**
     * Registers a custom response function class.
     *
     * @throws org.impactengine.api.registry.ContractViolationException if the class is not a usable response function
     */
    public static void register(String name, Class<?> implementation) {
        REGISTRY.register(name, implementation);
    }

    public static Registry<ResponseFunction> registry() {
        return REGISTRY;
    }
}
