package com.vtb.attacktree.models;

import com.vtb.attacktree.exceptions.DanglingReferenceException;
import com.vtb.attacktree.exceptions.RangeException;
import com.vtb.attacktree.exceptions.StructuralException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Структурные проверки дерева атак.
 *
 * Работает на "сырых" картах (id -> потомки, id -> вид), поэтому одни и те же
 * проверки выполняет и нормализатор до построения узлов, и конструктор AttackTree.
 */
public final class TreeValidator {

    private static final int ON_PATH = 1;
    private static final int DONE = 2;

    private TreeValidator() {}

    /**
     * Все ссылки на потомков должны разрешаться в объявленные узлы
     */
    public static void checkReferences(String rootId, Map<String, List<String>> childrenById) {
        if (!childrenById.containsKey(rootId)) {
            throw new DanglingReferenceException("<spec>", rootId);
        }
        for (Map.Entry<String, List<String>> entry : childrenById.entrySet()) {
            for (String childId : entry.getValue()) {
                if (!childrenById.containsKey(childId)) {
                    throw new DanglingReferenceException(entry.getKey(), childId);
                }
            }
        }
    }

    /**
     * Лист без потомков, вентиль AND/OR хотя бы с одним потомком
     */
    public static void checkShape(Map<String, NodeType> typeById, Map<String, List<String>> childrenById) {
        for (Map.Entry<String, NodeType> entry : typeById.entrySet()) {
            String id = entry.getKey();
            List<String> children = childrenById.getOrDefault(id, List.of());
            if (entry.getValue() == NodeType.LEAF && !children.isEmpty()) {
                throw new StructuralException("Лист '" + id + "' не может иметь потомков", List.of(id));
            }
            if (entry.getValue().isGate() && children.isEmpty()) {
                throw new StructuralException(
                    "Узел " + entry.getValue() + " '" + id + "' должен иметь хотя бы одного потомка", List.of(id));
            }
        }
    }

    /**
     * Граф потомков от корня должен быть деревом: без циклов, без общих потомков
     * и без узлов, недостижимых из корня.
     */
    public static void checkTree(String rootId, Map<String, List<String>> childrenById) {
        Map<String, Integer> state = new HashMap<>();
        Map<String, String> parentOf = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();

        state.put(rootId, ON_PATH);
        stack.push(new Frame(rootId, childrenById.getOrDefault(rootId, List.of())));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next >= frame.children.size()) {
                state.put(frame.nodeId, DONE);
                stack.pop();
                continue;
            }
            String childId = frame.children.get(frame.next++);
            Integer childState = state.get(childId);
            if (childState == null) {
                state.put(childId, ON_PATH);
                parentOf.put(childId, frame.nodeId);
                stack.push(new Frame(childId, childrenById.getOrDefault(childId, List.of())));
            } else if (childState == ON_PATH) {
                List<String> cycle = cyclePath(childId, frame.nodeId, parentOf);
                throw new StructuralException("Обнаружен цикл: " + String.join(" -> ", cycle), cycle);
            } else {
                // уже обойдённый узел: второй родитель или повтор в списке того же родителя
                String firstParent = parentOf.get(childId);
                List<String> ids = new ArrayList<>();
                ids.add(childId);
                ids.add(firstParent);
                if (!frame.nodeId.equals(firstParent)) {
                    ids.add(frame.nodeId);
                }
                throw new StructuralException(
                    "Узел '" + childId + "' используется как потомок более одного раза (родители: "
                        + String.join(", ", ids.subList(1, ids.size())) + ")", ids);
            }
        }

        Set<String> unreachable = new LinkedHashSet<>(childrenById.keySet());
        unreachable.removeAll(state.keySet());
        if (!unreachable.isEmpty()) {
            throw new StructuralException(
                "Узлы недостижимы из корня '" + rootId + "': " + String.join(", ", unreachable), unreachable);
        }
    }

    /**
     * Диапазоны числовых полей листа; null означает "не задано" и допустим
     */
    public static void checkValues(String nodeId, Double probability, Double impact) {
        if (probability != null && (probability.isNaN() || probability < 0.0 || probability > 1.0)) {
            throw new RangeException(
                "Вероятность узла '" + nodeId + "' должна быть в диапазоне [0, 1], получено " + probability,
                List.of(nodeId));
        }
        if (impact != null && (impact.isNaN() || impact.isInfinite() || impact < 0.0)) {
            throw new RangeException(
                "Ущерб узла '" + nodeId + "' должен быть неотрицательным числом, получено " + impact,
                List.of(nodeId));
        }
    }

    private static List<String> cyclePath(String start, String end, Map<String, String> parentOf) {
        List<String> path = new ArrayList<>();
        String current = end;
        path.add(current);
        while (!current.equals(start)) {
            current = parentOf.get(current);
            path.add(current);
        }
        Collections.reverse(path);
        path.add(start);
        return path;
    }

    private static final class Frame {
        private final String nodeId;
        private final List<String> children;
        private int next;

        private Frame(String nodeId, List<String> children) {
            this.nodeId = nodeId;
            this.children = children;
        }
    }
}
