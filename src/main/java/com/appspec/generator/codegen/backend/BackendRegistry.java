package com.appspec.generator.codegen.backend;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.codegen.exception.ConfigurationException;
import com.appspec.generator.codegen.generator.Generator;
import com.appspec.generator.codegen.hook.Hook;
import com.appspec.generator.codegen.hook.HookPhase;

/**
 * Typed registry of the available stacks.
 *
 * Backends are registered explicitly and validated on registration, so a cyclic or
 * conflicting backend never becomes runnable. Once {@linkplain #freeze() frozen} the registry
 * is read-only and may be shared between threads; tests create their own instances.
 */
public class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<String, Registration> backends = new LinkedHashMap<>();
    private final DependencyResolver resolver;
    private volatile boolean frozen;

    public BackendRegistry() {
        this(new DependencyResolver());
    }

    public BackendRegistry(DependencyResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @throws ConfigurationException if the id is taken or the backend does not resolve
     */
    public synchronized BackendRegistry register(Backend backend) {
        if (frozen) {
            throw new IllegalStateException("Backend registry is frozen; cannot register '" + backend.getId() + "'");
        }
        if (backends.containsKey(backend.getId())) {
            throw new ConfigurationException(backend.getId(), "Stack '" + backend.getId() + "' is already registered");
        }
        ExecutionPlan plan = resolver.resolve(backend);
        backends.put(backend.getId(), new Registration(backend, plan));
        log.debug("Registered stack '{}' with {} generator(s) and {} hook(s)", backend.getId(),
                backend.getGenerators().size(), backend.getHooks().size());
        return this;
    }

    public BackendRegistry freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public synchronized Optional<Backend> find(String stackId) {
        return Optional.ofNullable(backends.get(stackId)).map(Registration::backend);
    }

    /**
     * @throws ConfigurationException if no backend is registered under {@code stackId}
     */
    public synchronized Backend require(String stackId) {
        Registration registration = backends.get(stackId);
        if (registration == null) {
            throw new ConfigurationException(String.valueOf(stackId),
                    "Unknown stack '" + stackId + "'. Registered stacks: " + String.join(", ", backends.keySet()));
        }
        return registration.backend();
    }

    /**
     * Execution plan of the backend as registered, i.e. with no generator excluded.
     */
    public synchronized ExecutionPlan planFor(String stackId) {
        require(stackId);
        return backends.get(stackId).plan();
    }

    public DependencyResolver resolver() {
        return resolver;
    }

    public synchronized List<BackendSummary> list() {
        return backends.values().stream().map(BackendRegistry::summarize).toList();
    }

    private static BackendSummary summarize(Registration registration) {
        Backend backend = registration.backend();
        BackendSummary.BackendSummaryBuilder summary = BackendSummary.builder()
                .id(backend.getId())
                .description(backend.getDescription())
                .deprecated(backend.isDeprecated())
                .outputFormats(backend.getOutputFormats())
                .incremental(backend.isIncremental());
        registration.plan().getGenerators().stream().map(Generator::id).forEach(summary::generator);
        backend.hooksFor(HookPhase.PRE_BUILD).stream().map(Hook::id).forEach(summary::hook);
        backend.hooksFor(HookPhase.POST_BUILD).stream().map(Hook::id).forEach(summary::hook);
        return summary.build();
    }

    private record Registration(Backend backend, ExecutionPlan plan) {
    }
}
