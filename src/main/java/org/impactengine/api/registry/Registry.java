package org.impactengine.api.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name-to-implementation map for one adapter capability.
 * <p>
 * Implementations are registered as classes. The capability contract is checked once,
 * at registration: the class must implement the contract interface, be concrete and
 * expose a public no-argument constructor. Lookups never re-check and always return a
 * fresh instance.
 * <p>
 * <strong>Lifecycle:</strong> registries are populated at process start (see
 * {@code BuiltinAdapters}) and only read while pipelines run. Registering the same key
 * twice replaces the earlier entry. There is no removal.
 * <p>
 * <strong>Thread Safety:</strong> registration and lookup are synchronized, so a registry
 * may be shared by concurrent runs once populated.
 *
 * @param <T> the capability contract
 */
public class Registry<T> {

    private static final Logger log = LoggerFactory.getLogger(Registry.class);

    private final String name;
    private final Class<T> contract;
    private final Map<String, Class<? extends T>> entries = new LinkedHashMap<>();

    /**
     * Creates an empty registry.
     *
     * @param name     human-readable name used in error messages (e.g. "model")
     * @param contract the interface every registered class must implement
     */
    public Registry(String name, Class<T> contract) {
        this.name = name;
        this.contract = contract;
    }

    /**
     * Registers an implementation class under a key.
     *
     * @param key            lookup key, e.g. {@code "subclassification"}
     * @param implementation implementation class
     * @throws ContractViolationException if the class does not satisfy the contract
     * @throws IllegalArgumentException   if the key is blank
     */
    public synchronized void register(String key, Class<?> implementation) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Registry key cannot be null or blank");
        }
        Class<? extends T> checked = checkContract(key, implementation);
        Class<? extends T> previous = entries.put(key, checked);
        if (previous != null && previous != checked) {
            log.debug("Replaced {} '{}': {} -> {}", name, key, previous.getName(), checked.getName());
        }
    }

    /**
     * Registers an implementation by fully qualified class name, as used for extension
     * adapters declared in configuration.
     *
     * @throws ContractViolationException if the class cannot be loaded or does not satisfy the contract
     */
    public void register(String key, String className) {
        Class<?> clazz;
        try {
            clazz = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new ContractViolationException(
                String.format("Cannot register %s '%s': class %s not found", name, key, className), e);
        }
        register(key, clazz);
    }

    /**
     * Creates a new instance of the implementation registered under the key.
     *
     * @throws UnknownKeyException if nothing is registered under the key
     */
    public T get(String key) {
        Class<? extends T> implementation;
        synchronized (this) {
            implementation = entries.get(key);
        }
        if (implementation == null) {
            throw new UnknownKeyException(name, key, keys());
        }
        try {
            return implementation.getDeclaredConstructor().newInstance();
        } catch (InvocationTargetException e) {
            throw new ContractViolationException(
                String.format("Constructor of %s '%s' (%s) failed", name, key, implementation.getName()), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ContractViolationException(
                String.format("Cannot instantiate %s '%s' (%s)", name, key, implementation.getName()), e);
        }
    }

    public synchronized boolean contains(String key) {
        return entries.containsKey(key);
    }

    /**
     * Returns the registered keys in registration order.
     */
    public synchronized List<String> keys() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    public String getName() {
        return name;
    }

    public Class<T> getContract() {
        return contract;
    }

    private Class<? extends T> checkContract(String key, Class<?> implementation) {
        if (implementation == null) {
            throw new ContractViolationException(String.format("Cannot register null class as %s '%s'", name, key));
        }
        if (!contract.isAssignableFrom(implementation)) {
            throw new ContractViolationException(String.format(
                "Class %s registered as %s '%s' does not implement %s",
                implementation.getName(), name, key, contract.getSimpleName()));
        }
        if (implementation.isInterface() || Modifier.isAbstract(implementation.getModifiers())) {
            throw new ContractViolationException(String.format(
                "Class %s registered as %s '%s' is not concrete", implementation.getName(), name, key));
        }
        try {
            Constructor<?> constructor = implementation.getDeclaredConstructor();
            if (!Modifier.isPublic(constructor.getModifiers()) || !Modifier.isPublic(implementation.getModifiers())) {
                throw new ContractViolationException(String.format(
                    "Class %s registered as %s '%s' must be public with a public no-argument constructor",
                    implementation.getName(), name, key));
            }
        } catch (NoSuchMethodException e) {
            throw new ContractViolationException(String.format(
                "Class %s registered as %s '%s' has no no-argument constructor",
                implementation.getName(), name, key), e);
        }
        return implementation.asSubclass(contract);
    }
}
