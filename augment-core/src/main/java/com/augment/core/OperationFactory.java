package com.augment.core;

import java.util.List;

/**
 * Builds an operation from an argument list whose size the registry has already checked against
 * the registered {@link Arity}. Implementations validate values and report problems with
 * {@link OperationBuildException#invalidValue}.
 */
@FunctionalInterface
public interface OperationFactory {
    Operation create(List<Double> params);
}
