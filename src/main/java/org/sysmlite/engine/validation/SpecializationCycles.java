package org.sysmlite.engine.validation;

import org.sysmlite.kerml.m3.Specialization;
import org.sysmlite.kerml.m3.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds specialization cycles through a type.
 */
public final class SpecializationCycles {

    private SpecializationCycles() {
        // Static utility class
    }

    /**
     * Depth-first search over direct supertypes for a path leading back to
     * {@code type}.
     *
     * @return the cycle starting and ending with {@code type}, e.g.
     *         {@code [A, B, A]}, or an empty list if {@code type} is not on a cycle
     */
    public static List<Type> find(Type type) {
        for (Specialization specialization : type.specializations()) {
            if (specialization.resolveTarget() == type) {
                return List.of(type, type);
            }
        }
        List<Type> path = new ArrayList<>();
        path.add(type);
        if (search(type, type, path, new HashSet<>())) {
            return Collections.unmodifiableList(path);
        }
        return List.of();
    }

    private static boolean search(Type start, Type current, List<Type> path, Set<Type> visited) {
        for (Type general : current.directSupertypes()) {
            if (general == start) {
                path.add(general);
                return true;
            }
            if (!visited.add(general)) {
                continue;
            }
            path.add(general);
            if (search(start, general, path, visited)) {
                return true;
            }
            path.remove(path.size() - 1);
        }
        return false;
    }

    /**
     * @return names along the cycle joined with {@code " -> "}
     */
    public static String describe(List<Type> cycle) {
        List<String> names = new ArrayList<>(cycle.size());
        for (Type type : cycle) {
            String name = type.qualifiedName();
            names.add(name != null ? name : type.toString());
        }
        return String.join(" -> ", names);
    }
}
