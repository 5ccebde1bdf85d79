package com.augment.core;

import com.augment.core.ops.BuiltinOperations;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Case-insensitive map from operation name to a validating constructor.
 *
 * <p>{@link #build(String, List)} checks the argument count against the registered {@link Arity}
 * before handing the list to the factory, which checks values. {@link #buildRandom(String)} draws the
 * arguments from the registered {@link ParameterSampler} using {@link ThreadLocalRandom}; operations
 * built that way are not reproducible across runs and are meant for exploratory configs only.
 */
public final class OperationRegistry {
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    /** A registry holding every built-in operation. */
    public static OperationRegistry defaults() {
        OperationRegistry registry = new OperationRegistry();
        BuiltinOperations.registerAll(registry);
        return registry;
    }

    public OperationRegistry register(String name, Arity arity, OperationFactory factory) {
        return register(name, arity, factory, null);
    }

    /**
     * @param sampler draws default arguments for {@link #buildRandom}; {@code null} means the
     *     operation is built with no arguments
     */
    public OperationRegistry register(String name, Arity arity, OperationFactory factory, ParameterSampler sampler) {
        String key = key(Objects.requireNonNull(name, "name"));
        registrations.put(key, new Registration(key,
            Objects.requireNonNull(arity, "arity"),
            Objects.requireNonNull(factory, "factory"),
            sampler));
        return this;
    }

    public boolean has(String name) {
        return name != null && registrations.containsKey(key(name));
    }

    public Set<String> names() {
        return new TreeSet<>(registrations.keySet());
    }

    public Arity arity(String name) {
        return lookup(name).arity();
    }

    public Operation build(String name, List<Double> params) {
        Registration reg = lookup(name);
        List<Double> args = params == null ? List.of() : params;
        for (Double arg : args) {
            if (arg == null || !Double.isFinite(arg)) {
                throw OperationBuildException.invalidValue(reg.name(), "arguments must be finite numbers, got " + args);
            }
        }
        if (!reg.arity().accepts(args.size())) {
            throw OperationBuildException.invalidCount(reg.name(), reg.arity(), args.size());
        }
        Operation op = reg.factory().create(List.copyOf(args));
        if (op == null) throw new IllegalStateException("factory for '" + reg.name() + "' returned null");
        return op;
    }

    public Operation buildRandom(String name) {
        Registration reg = lookup(name);
        List<Double> params = reg.sampler() == null ? List.of() : reg.sampler().sample(ThreadLocalRandom.current());
        return build(reg.name(), params);
    }

    public PipelineEntry build(String name, List<Double> params, double probability) {
        return new PipelineEntry(build(name, params), probability);
    }

    public PipelineEntry build(String name, double probability) {
        return new PipelineEntry(buildRandom(name), probability);
    }

    /** An {@link OperationSpec} without parameters goes through {@link #buildRandom}. */
    public PipelineEntry build(OperationSpec spec) {
        Objects.requireNonNull(spec, "spec");
        return spec.params().isEmpty()
            ? build(spec.name(), spec.probability())
            : build(spec.name(), spec.params(), spec.probability());
    }

    private Registration lookup(String name) {
        if (name == null) throw OperationBuildException.unrecognized("null");
        Registration reg = registrations.get(key(name));
        if (reg == null) throw OperationBuildException.unrecognized(name);
        return reg;
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private record Registration(String name, Arity arity, OperationFactory factory, ParameterSampler sampler) {}
}
