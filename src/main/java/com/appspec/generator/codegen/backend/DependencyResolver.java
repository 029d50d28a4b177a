package com.appspec.generator.codegen.backend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.appspec.generator.codegen.artifact.ArtifactKey;
import com.appspec.generator.codegen.exception.ConfigurationException;
import com.appspec.generator.codegen.generator.Generator;
import com.appspec.generator.codegen.hook.Hook;
import com.appspec.generator.codegen.hook.HookPhase;
import com.appspec.generator.codegen.util.OutputPatterns;

/**
 * Computes the execution order of a backend from the requires/produces edges of its units.
 *
 * Rejects, with a {@link ConfigurationException}: duplicate unit ids, two writers of one
 * artifact key unless the later one declares an override (of a generator's or a pre-build
 * hook's key), overlapping output patterns,
 * requirements no earlier unit produces, and dependency cycles (naming every member).
 * Independent generators keep their declaration order, so the result is identical for
 * identical input.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    public ExecutionPlan resolve(Backend backend) {
        return resolve(backend, Set.of());
    }

    public ExecutionPlan resolve(Backend backend, Set<String> excludedGenerators) {
        checkUniqueIds(backend);

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < backend.getGenerators().size(); i++) {
            index.put(backend.getGenerators().get(i).id(), i);
        }
        for (String excluded : excludedGenerators) {
            if (!index.containsKey(excluded)) {
                throw new ConfigurationException(backend.getId(),
                        "Cannot exclude unknown generator '" + excluded + "' from stack '" + backend.getId() + "'");
            }
        }

        List<Generator> generators = backend.getGenerators().stream()
                .filter(g -> !excludedGenerators.contains(g.id()))
                .toList();
        List<Hook> preHooks = backend.hooksFor(HookPhase.PRE_BUILD);
        List<Hook> postHooks = backend.hooksFor(HookPhase.POST_BUILD);

        checkOutputOverlap(generators);
        Map<String, List<Generator>> writers = collectWriters(generators);
        Set<String> preBuildKeys = checkPreBuildHooks(preHooks, writers);

        Map<String, Set<String>> dependencies = buildEdges(generators, writers, preBuildKeys);
        List<Generator> ordered = topologicalOrder(generators, dependencies, index);

        checkPostBuildHooks(postHooks, preBuildKeys, writers);

        log.debug("Resolved order for '{}': {}", backend.getId(), ordered.stream().map(Generator::id).toList());
        return new ExecutionPlan(backend.getId(), preHooks, ordered, postHooks,
                Collections.unmodifiableMap(dependencies));
    }

    private void checkUniqueIds(Backend backend) {
        Set<String> seen = new HashSet<>();
        for (Generator generator : backend.getGenerators()) {
            if (!seen.add(generator.id())) {
                throw new ConfigurationException(generator.id(),
                        "Duplicate unit id '" + generator.id() + "' in stack '" + backend.getId() + "'");
            }
        }
        for (Hook hook : backend.getHooks()) {
            if (!seen.add(hook.id())) {
                throw new ConfigurationException(hook.id(),
                        "Duplicate unit id '" + hook.id() + "' in stack '" + backend.getId() + "'");
            }
        }
    }

    private void checkOutputOverlap(List<Generator> generators) {
        for (int i = 0; i < generators.size(); i++) {
            for (int j = i + 1; j < generators.size(); j++) {
                Generator a = generators.get(i);
                Generator b = generators.get(j);
                for (String pa : a.descriptor().getOutputs()) {
                    for (String pb : b.descriptor().getOutputs()) {
                        if (OutputPatterns.mayOverlap(pa, pb)) {
                            throw new ConfigurationException(b.id(), "Output paths of '" + a.id() + "' (" + pa
                                    + ") and '" + b.id() + "' (" + pb + ") overlap", List.of(a.id(), b.id()));
                        }
                    }
                }
            }
        }
    }

    /**
     * Writers of each artifact key: the original writer first, then overriding writers in
     * declaration order.
     */
    private Map<String, List<Generator>> collectWriters(List<Generator> generators) {
        Map<String, Generator> original = new HashMap<>();
        Map<String, List<Generator>> overriding = new HashMap<>();
        for (Generator generator : generators) {
            for (ArtifactKey<?> key : generator.descriptor().getProduces()) {
                if (generator.descriptor().getOverrides().contains(key)) {
                    continue;
                }
                Generator previous = original.putIfAbsent(key.getName(), generator);
                if (previous != null) {
                    throw new ConfigurationException(generator.id(), "Artifact '" + key + "' is produced by both '"
                            + previous.id() + "' and '" + generator.id() + "' without an override declaration",
                            List.of(previous.id(), generator.id()));
                }
            }
            for (ArtifactKey<?> key : generator.descriptor().getOverrides()) {
                overriding.computeIfAbsent(key.getName(), k -> new ArrayList<>()).add(generator);
            }
        }
        Map<String, List<Generator>> writers = new HashMap<>();
        original.forEach((key, generator) -> writers.computeIfAbsent(key, k -> new ArrayList<>()).add(generator));
        overriding.forEach((key, list) -> writers.computeIfAbsent(key, k -> new ArrayList<>()).addAll(list));
        return writers;
    }

    private Set<String> checkPreBuildHooks(List<Hook> preHooks, Map<String, List<Generator>> writers) {
        Set<String> available = new LinkedHashSet<>();
        for (Hook hook : preHooks) {
            for (ArtifactKey<?> key : hook.descriptor().getRequires()) {
                if (!available.contains(key.getName())) {
                    throw unresolved(hook.id(), key);
                }
            }
            for (ArtifactKey<?> key : hook.descriptor().getProduces()) {
                if (!available.add(key.getName()) || hasOriginalWriter(writers.get(key.getName()), key)) {
                    throw new ConfigurationException(hook.id(),
                            "Artifact '" + key + "' produced by hook '" + hook.id() + "' has another writer");
                }
            }
        }
        return available;
    }

    /**
     * Generators may override a key a pre-build hook produced; only a plain producer clashes.
     */
    private static boolean hasOriginalWriter(List<Generator> keyWriters, ArtifactKey<?> key) {
        return keyWriters != null && !keyWriters.get(0).descriptor().getOverrides().contains(key);
    }

    private void checkPostBuildHooks(List<Hook> postHooks, Set<String> preBuildKeys,
            Map<String, List<Generator>> writers) {
        Set<String> available = new HashSet<>(preBuildKeys);
        available.addAll(writers.keySet());
        for (Hook hook : postHooks) {
            for (ArtifactKey<?> key : hook.descriptor().getRequires()) {
                if (!available.contains(key.getName())) {
                    throw unresolved(hook.id(), key);
                }
            }
            for (ArtifactKey<?> key : hook.descriptor().getProduces()) {
                if (!available.add(key.getName())) {
                    throw new ConfigurationException(hook.id(),
                            "Artifact '" + key + "' produced by hook '" + hook.id() + "' has another writer");
                }
            }
        }
    }

    private Map<String, Set<String>> buildEdges(List<Generator> generators, Map<String, List<Generator>> writers,
            Set<String> preBuildKeys) {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (Generator generator : generators) {
            Set<String> deps = new LinkedHashSet<>();
            for (ArtifactKey<?> key : generator.descriptor().getRequires()) {
                List<Generator> keyWriters = writers.get(key.getName());
                if (keyWriters == null) {
                    if (preBuildKeys.contains(key.getName())) {
                        continue;
                    }
                    throw unresolved(generator.id(), key);
                }
                if (generator.descriptor().getOverrides().contains(key)) {
                    // reads the value it is about to replace
                    deps.addAll(earlierWriters(generator, keyWriters));
                } else {
                    keyWriters.forEach(w -> deps.add(w.id()));
                }
            }
            // an override writer runs after every earlier writer of the key
            for (ArtifactKey<?> key : generator.descriptor().getOverrides()) {
                deps.addAll(earlierWriters(generator, writers.get(key.getName())));
            }
            dependencies.put(generator.id(), Collections.unmodifiableSet(deps));
        }
        return dependencies;
    }

    private static List<String> earlierWriters(Generator generator, List<Generator> keyWriters) {
        List<String> earlier = new ArrayList<>();
        for (Generator writer : keyWriters) {
            if (writer == generator) {
                break;
            }
            earlier.add(writer.id());
        }
        return earlier;
    }

    private List<Generator> topologicalOrder(List<Generator> generators, Map<String, Set<String>> dependencies,
            Map<String, Integer> index) {
        Map<String, Generator> byId = new LinkedHashMap<>();
        generators.forEach(g -> byId.put(g.id(), g));

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependants = new HashMap<>();
        for (Generator generator : generators) {
            Set<String> deps = dependencies.get(generator.id());
            inDegree.put(generator.id(), deps.size());
            for (String dep : deps) {
                dependants.computeIfAbsent(dep, k -> new ArrayList<>()).add(generator.id());
            }
        }

        PriorityQueue<Generator> ready = new PriorityQueue<>(Comparator.comparingInt(g -> index.get(g.id())));
        generators.stream().filter(g -> inDegree.get(g.id()) == 0).forEach(ready::add);

        List<Generator> ordered = new ArrayList<>(generators.size());
        while (!ready.isEmpty()) {
            Generator next = ready.poll();
            ordered.add(next);
            for (String dependant : dependants.getOrDefault(next.id(), List.of())) {
                if (inDegree.merge(dependant, -1, Integer::sum) == 0) {
                    ready.add(byId.get(dependant));
                }
            }
        }

        if (ordered.size() < generators.size()) {
            Set<String> remaining = new LinkedHashSet<>(byId.keySet());
            ordered.forEach(g -> remaining.remove(g.id()));
            List<String> cycle = findCycle(remaining, dependencies);
            throw new ConfigurationException(cycle.get(0),
                    "Generator dependency cycle: " + String.join(" -> ", cycle), cycle.subList(0, cycle.size() - 1));
        }
        return ordered;
    }

    /**
     * Extracts one cycle among the unresolved generators, closed by repeating its first member.
     */
    private List<String> findCycle(Set<String> remaining, Map<String, Set<String>> dependencies) {
        Set<String> visited = new HashSet<>();
        for (String start : remaining) {
            Deque<String> path = new ArrayDeque<>();
            List<String> cycle = walk(start, remaining, dependencies, visited, path, new HashSet<>());
            if (cycle != null) {
                return cycle;
            }
        }
        // every leftover node sits on or behind a cycle, so walk() always finds one
        List<String> all = new ArrayList<>(remaining);
        all.add(all.get(0));
        return all;
    }

    private List<String> walk(String node, Set<String> remaining, Map<String, Set<String>> dependencies,
            Set<String> visited, Deque<String> path, Set<String> onPath) {
        if (onPath.contains(node)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String member : path) {
                inCycle = inCycle || member.equals(node);
                if (inCycle) {
                    cycle.add(member);
                }
            }
            cycle.add(node);
            return cycle;
        }
        if (!visited.add(node)) {
            return null;
        }
        path.addLast(node);
        onPath.add(node);
        for (String dep : dependencies.get(node)) {
            if (remaining.contains(dep)) {
                List<String> cycle = walk(dep, remaining, dependencies, visited, path, onPath);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.removeLast();
        onPath.remove(node);
        return null;
    }

    private static ConfigurationException unresolved(String unitId, ArtifactKey<?> key) {
        return new ConfigurationException(unitId, unitId + " requires " + key + ", unresolved.");
    }
}
