package org.dxworks.docframe.transform;

import org.dxworks.docframe.DocframeConfig;
import org.dxworks.docframe.ast.NodeTransformer;
import org.dxworks.docframe.exception.DependencyResolutionException;
import org.dxworks.docframe.exception.ValidationException;
import org.dxworks.docframe.transform.builtin.BuiltinTransforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Holds the known transforms, orders requested transforms by their dependencies and creates
 * instances with validated parameters.
 * <p>
 * Like the converter registry, mutations are serialized and publish an immutable snapshot.
 * Every registration gets a sequence number; it breaks ties between transforms of equal priority.
 */
public class TransformRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(TransformRegistry.class);
    private static final int MAX_CONSECUTIVE_PLUGIN_FAILURES = 32;

    private static final class Registration {
        final TransformMetadata metadata;
        final long sequence;

        Registration(TransformMetadata metadata, long sequence) {
            this.metadata = metadata;
            this.sequence = sequence;
        }
    }

    private static final Comparator<Registration> EXECUTION_ORDER = Comparator
            .comparingInt((Registration r) -> r.metadata.getPriority())
            .thenComparingLong(r -> r.sequence);

    private final DocframeConfig config;
    private final Object lock = new Object();
    private volatile Map<String, Registration> transforms = Map.of();
    private long nextSequence;
    private volatile boolean initialized;

    public TransformRegistry() {
        this(DocframeConfig.defaults());
    }

    public TransformRegistry(DocframeConfig config) {
        this.config = config;
    }

    /**
     * Adds a transform. A transform of the same name is replaced with a warning and keeps its
     * registration sequence.
     */
    public void register(TransformMetadata metadata) {
        synchronized (lock) {
            Map<String, Registration> next = new LinkedHashMap<>(transforms);
            Registration existing = next.get(metadata.getName());
            if (existing != null) {
                LOG.warn("Transform '{}' is already registered, replacing it", metadata.getName());
                next.put(metadata.getName(), new Registration(metadata, existing.sequence));
            } else {
                next.put(metadata.getName(), new Registration(metadata, nextSequence++));
                LOG.debug("Registered transform '{}'", metadata.getName());
            }
            transforms = Collections.unmodifiableMap(next);
        }
    }

    public boolean unregister(String name) {
        synchronized (lock) {
            if (!transforms.containsKey(name)) {
                return false;
            }
            Map<String, Registration> next = new LinkedHashMap<>(transforms);
            next.remove(name);
            transforms = Collections.unmodifiableMap(next);
            LOG.debug("Unregistered transform '{}'", name);
            return true;
        }
    }

    public boolean hasTransform(String name) {
        return transforms.containsKey(name);
    }

    public Optional<TransformMetadata> getMetadata(String name) {
        Registration registration = transforms.get(name);
        return registration == null ? Optional.empty() : Optional.of(registration.metadata);
    }

    /** Registered transform names, sorted. */
    public List<String> listTransforms() {
        List<String> names = new ArrayList<>(transforms.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Sorted names of the transforms carrying at least one of {@code tags}.
     */
    public List<String> listTransforms(Collection<String> tags) {
        List<String> names = new ArrayList<>();
        for (Registration registration : transforms.values()) {
            if (registration.metadata.getTags().stream().anyMatch(tags::contains)) {
                names.add(registration.metadata.getName());
            }
        }
        Collections.sort(names);
        return names;
    }

    /**
     * Creates a transform instance.
     *
     * @throws ValidationException when the transform is unknown or the parameters are invalid
     */
    public NodeTransformer getTransform(String name, Map<String, ?> parameters) {
        Registration registration = transforms.get(name);
        if (registration == null) {
            throw new ValidationException(name, null, "Unknown transform '" + name + "'. Registered transforms: " + listTransforms());
        }
        return registration.metadata.createInstance(parameters);
    }

    public NodeTransformer getTransform(String name) {
        return getTransform(name, Map.of());
    }

    /**
     * Orders {@code names} together with everything they depend on, transitively. Dependencies
     * come before their dependents; otherwise lower priority runs first, then earlier registration.
     *
     * @throws DependencyResolutionException for an unknown name or dependency, or a dependency cycle
     */
    public List<String> resolveDependencies(Collection<String> names) {
        Map<String, Registration> snapshot = transforms;

        Set<String> closure = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        for (String name : names) {
            if (!snapshot.containsKey(name)) {
                throw new DependencyResolutionException("Unknown transform '" + name + "'", List.of(name));
            }
            pending.add(name);
        }
        while (!pending.isEmpty()) {
            String name = pending.poll();
            if (!closure.add(name)) {
                continue;
            }
            for (String dependency : snapshot.get(name).metadata.getDependencies()) {
                if (!snapshot.containsKey(dependency)) {
                    throw new DependencyResolutionException("Transform '" + name + "' depends on unknown transform '"
                            + dependency + "'", List.of(name, dependency));
                }
                pending.add(dependency);
            }
        }

        Map<String, Integer> unresolved = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        PriorityQueue<Registration> ready = new PriorityQueue<>(EXECUTION_ORDER);
        for (String name : closure) {
            Set<String> dependencies = snapshot.get(name).metadata.getDependencies();
            unresolved.put(name, dependencies.size());
            for (String dependency : dependencies) {
                dependents.computeIfAbsent(dependency, key -> new ArrayList<>()).add(name);
            }
            if (dependencies.isEmpty()) {
                ready.add(snapshot.get(name));
            }
        }

        List<String> order = new ArrayList<>(closure.size());
        while (!ready.isEmpty()) {
            String name = ready.poll().metadata.getName();
            order.add(name);
            for (String dependent : dependents.getOrDefault(name, List.of())) {
                if (unresolved.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(snapshot.get(dependent));
                }
            }
        }

        if (order.size() < closure.size()) {
            List<String> cycle = findCycle(snapshot, closure, new LinkedHashSet<>(order));
            throw new DependencyResolutionException("Transform dependency cycle: " + String.join(" -> ", cycle), cycle);
        }
        LOG.debug("Resolved transforms {} to {}", names, order);
        return order;
    }

    /**
     * Every transform left after ordering waits on another leftover, so following dependencies
     * from any of them must revisit a name.
     */
    private static List<String> findCycle(Map<String, Registration> snapshot, Set<String> closure, Set<String> ordered) {
        String current = closure.stream().filter(name -> !ordered.contains(name)).findFirst().orElseThrow();
        List<String> path = new ArrayList<>();
        while (!path.contains(current)) {
            path.add(current);
            current = snapshot.get(current).metadata.getDependencies().stream()
                    .filter(dependency -> !ordered.contains(dependency))
                    .findFirst()
                    .orElseThrow();
        }
        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(current), path.size()));
        cycle.add(current);
        return cycle;
    }

    /**
     * Registers the built-in transforms and then discovers plugins. Later calls do nothing.
     */
    public void initialize() {
        synchronized (lock) {
            if (initialized) {
                return;
            }
            for (TransformMetadata metadata : BuiltinTransforms.all()) {
                if (config.isTransformEnabled(metadata.getName())) {
                    register(metadata);
                } else {
                    LOG.debug("Built-in transform '{}' is disabled by configuration", metadata.getName());
                }
            }
            discoverPlugins();
            initialized = true;
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void clear() {
        synchronized (lock) {
            transforms = Map.of();
            initialized = false;
        }
    }

    public int discoverPlugins() {
        ClassLoader contextLoader = Thread.currentThread().getContextClassLoader();
        return discoverPlugins(contextLoader != null ? contextLoader : TransformRegistry.class.getClassLoader());
    }

    /**
     * Registers the transforms of every {@link TransformProvider} visible to {@code classLoader}.
     * Failing plugins are logged and skipped; plugin transforms never replace registered ones.
     *
     * @return number of transforms registered
     */
    public int discoverPlugins(ClassLoader classLoader) {
        Iterator<TransformProvider> providers = ServiceLoader.load(TransformProvider.class, classLoader).iterator();
        int registered = 0;
        int failures = 0;
        int consecutiveFailures = 0;
        while (consecutiveFailures < MAX_CONSECUTIVE_PLUGIN_FAILURES) {
            TransformProvider provider;
            try {
                if (!providers.hasNext()) {
                    break;
                }
                provider = providers.next();
            } catch (ServiceConfigurationError e) {
                LOG.warn("Skipping transform plugin that failed to load: {}", e.getMessage());
                failures++;
                consecutiveFailures++;
                continue;
            }
            consecutiveFailures = 0;

            List<TransformMetadata> provided;
            try {
                provided = List.copyOf(provider.transforms());
            } catch (RuntimeException e) {
                LOG.warn("Skipping transform plugin {}: {}", provider.getClass().getName(), e.toString());
                failures++;
                continue;
            }
            for (TransformMetadata metadata : provided) {
                if (!config.isTransformEnabled(metadata.getName())) {
                    LOG.debug("Transform '{}' is disabled by configuration", metadata.getName());
                } else if (hasTransform(metadata.getName())) {
                    LOG.warn("Plugin {} declares transform '{}' which is already registered, skipping it",
                            provider.getClass().getName(), metadata.getName());
                } else {
                    register(metadata);
                    registered++;
                }
            }
        }
        LOG.info("Transform plugin discovery registered {} transform(s), {} plugin(s) failed", registered, failures);
        return registered;
    }
}
