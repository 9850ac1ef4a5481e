package com.vtb.attacktree.models;

import com.vtb.attacktree.exceptions.DuplicateIdException;
import com.vtb.attacktree.exceptions.NodeReferenceException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Дерево атак: карта id -> узел и идентификатор корня.
 *
 * Инварианты проверяются при создании и дальше не нарушаются: корень существует,
 * все ссылки на потомков разрешаются, граф от корня является деревом,
 * значения листьев в допустимых диапазонах.
 * Изменять можно только значения листьев (updateLeaf, setLeafProbability).
 */
public final class AttackTree {

    private final String rootId;
    private final Map<String, AttackNode> nodes;

    public AttackTree(String rootId, Collection<AttackNode> nodes) {
        this.rootId = Objects.requireNonNull(rootId, "rootId");
        Map<String, AttackNode> byId = new LinkedHashMap<>();
        for (AttackNode node : nodes) {
            if (byId.putIfAbsent(node.getId(), node) != null) {
                throw new DuplicateIdException(node.getId());
            }
        }
        Map<String, List<String>> childrenById = new LinkedHashMap<>();
        Map<String, NodeType> typeById = new LinkedHashMap<>();
        byId.forEach((id, node) -> {
            childrenById.put(id, node.getChildren());
            typeById.put(id, node.getType());
        });
        TreeValidator.checkReferences(rootId, childrenById);
        TreeValidator.checkShape(typeById, childrenById);
        TreeValidator.checkTree(rootId, childrenById);
        this.nodes = byId;
    }

    public String getRootId() {
        return rootId;
    }

    public AttackNode getRoot() {
        return nodes.get(rootId);
    }

    public Optional<AttackNode> findNode(String nodeId) {
        return Optional.ofNullable(nodeId != null ? nodes.get(nodeId) : null);
    }

    /**
     * Узел по id; NodeReferenceException, если такого нет
     */
    public AttackNode getNode(String nodeId) {
        return findNode(nodeId)
            .orElseThrow(() -> new NodeReferenceException("Узел '" + nodeId + "' не найден", nodeId));
    }

    /**
     * Лист по id; NodeReferenceException, если узла нет или это не лист
     */
    public AttackNode getLeaf(String leafId) {
        AttackNode node = getNode(leafId);
        if (!node.isLeaf()) {
            throw new NodeReferenceException(
                "Узел '" + leafId + "' имеет вид " + node.getType() + ", ожидался LEAF", leafId);
        }
        return node;
    }

    /**
     * Узлы в порядке объявления, корень первым
     */
    public Collection<AttackNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<AttackNode> getLeaves() {
        List<AttackNode> leaves = new ArrayList<>();
        for (AttackNode node : nodes.values()) {
            if (node.isLeaf()) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Задать вероятность и ущерб листа. null означает "не задано".
     * Оба значения проверяются до изменения, при ошибке лист не меняется.
     */
    public void updateLeaf(String leafId, Double probability, Double impact) {
        getLeaf(leafId).assignValues(probability, impact);
    }

    /**
     * Заменить только вероятность листа, ущерб остаётся прежним
     */
    public void setLeafProbability(String leafId, double probability) {
        AttackNode leaf = getLeaf(leafId);
        Double impact = leaf.getImpact().isPresent() ? leaf.getImpact().getAsDouble() : null;
        leaf.assignValues(probability, impact);
    }

    /**
     * Глубокая копия: изменения копии не затрагивают исходное дерево
     */
    public AttackTree copy() {
        List<AttackNode> copies = new ArrayList<>(nodes.size());
        for (AttackNode node : nodes.values()) {
            copies.add(node.copy());
        }
        return new AttackTree(rootId, copies);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttackTree)) {
            return false;
        }
        AttackTree other = (AttackTree) o;
        return rootId.equals(other.rootId) && nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootId, nodes);
    }

    @Override
    public String toString() {
        return "AttackTree(root=" + rootId + ", nodes=" + nodes.values() + ")";
    }
}
