package com.metamodel.generator.codegen.order;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.metamodel.generator.codegen.classify.ElementClassifier;
import com.metamodel.generator.codegen.exception.ModelStructureException;
import com.metamodel.generator.model.ClassNode;

/**
 * Orders classes so that every base precedes the classes derived from it.
 *
 * Depth-first postorder over the input order; independent subtrees keep their input order.
 */
public class DependencyOrderer {

    private final ElementClassifier classifier;

    public DependencyOrderer(ElementClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @throws ModelStructureException on a cycle among bases
     */
    public List<ClassNode> order(List<ClassNode> classes) {
        List<ClassNode> ordered = new ArrayList<>();
        Set<ClassNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<ClassNode> path = new ArrayDeque<>();

        for (ClassNode cls : classes) {
            visit(cls, visited, path, ordered);
        }
        return ordered;
    }

    private void visit(ClassNode cls, Set<ClassNode> visited, Deque<ClassNode> path, List<ClassNode> ordered) {
        if (visited.contains(cls)) {
            return;
        }
        if (path.contains(cls)) {
            throw new ModelStructureException(cls.getName(), "Generalization cycle: " + describeCycle(path, cls));
        }

        path.push(cls);
        for (ClassNode base : classifier.bases(cls)) {
            visit(base, visited, path, ordered);
        }
        path.pop();

        ordered.add(cls);
        visited.add(cls);
    }

    private static String describeCycle(Deque<ClassNode> path, ClassNode repeated) {
        // path is a stack: iterate from the bottom to print in traversal order
        StringBuilder sb = new StringBuilder();
        boolean inCycle = false;
        for (Iterator<ClassNode> it = path.descendingIterator(); it.hasNext(); ) {
            ClassNode c = it.next();
            if (c == repeated) {
                inCycle = true;
            }
            if (inCycle) {
                sb.append(c.getName()).append(" -> ");
            }
        }
        return sb.append(repeated.getName()).toString();
    }
}
