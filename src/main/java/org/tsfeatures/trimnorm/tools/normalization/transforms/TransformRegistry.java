package org.tsfeatures.trimnorm.tools.normalization.transforms;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps normalization function names onto {@link NormalizationTransform}s.
 *
 * <p>
 *     New transforms are added with {@link #register}; the filtering code never needs to know about them.
 * </p>
 */
public final class TransformRegistry {

    private static final Logger logger = LogManager.getLogger(TransformRegistry.class);

    private final Map<String, NormalizationTransform> transformsByName = new LinkedHashMap<>();

    /**
     * Creates an empty registry.
     */
    public TransformRegistry() {}

    /**
     * Creates a registry that knows every {@link StandardTransform} under its function name.
     */
    public static TransformRegistry createDefault() {
        final TransformRegistry registry = new TransformRegistry();
        for (final StandardTransform transform : StandardTransform.values()) {
            registry.register(transform.getFunctionName(), transform);
        }
        return registry;
    }

    /**
     * Registers a transform.
     *
     * @param name      case-sensitive function name; not {@code null} or empty, not already registered.
     * @param transform not {@code null}.
     * @return this registry.
     */
    public TransformRegistry register(final String name, final NormalizationTransform transform) {
        Utils.nonEmpty(name, "the function name cannot be null or empty");
        Utils.nonNull(transform, "the transform cannot be null");
        Utils.validateArg(!transformsByName.containsKey(name), () -> String.format("a transform named '%s' is already registered", name));
        transformsByName.put(name, transform);
        return this;
    }

    public boolean contains(final String name) {
        return transformsByName.containsKey(Utils.nonNull(name, "the function name cannot be null"));
    }

    /**
     * @return the registered names, in registration order.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(transformsByName.keySet());
    }

    /**
     * Applies the named transform.
     *
     * @throws UserException.UnknownNormalizationFunction if no transform is registered under {@code name}.
     */
    public RealMatrix apply(final RealMatrix data, final String name) {
        Utils.nonNull(data, "the data cannot be null");
        final NormalizationTransform transform = get(name);
        logger.debug(String.format("Applying normalization function %s to a %d x %d matrix.",
                name, data.getRowDimension(), data.getColumnDimension()));
        return transform.apply(data);
    }

    /**
     * Returns the named transform.
     *
     * @throws UserException.UnknownNormalizationFunction if no transform is registered under {@code name}.
     */
    public NormalizationTransform get(final String name) {
        Utils.nonNull(name, "the function name cannot be null");
        final NormalizationTransform transform = transformsByName.get(name);
        if (transform == null) {
            throw new UserException.UnknownNormalizationFunction(name, transformsByName.keySet());
        }
        return transform;
    }
}
