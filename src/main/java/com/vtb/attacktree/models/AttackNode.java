package com.vtb.attacktree.models;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Узел дерева атак: вентиль AND/OR со списком потомков или лист
 * с необязательными вероятностью и ущербом.
 * Незаданное значение хранится как null и наружу отдаётся пустым OptionalDouble,
 * чтобы "ещё не оценено" не путалось с оценкой 0.
 */
public final class AttackNode {

    private final String id;
    private final String label;
    private final NodeType type;
    private final List<String> children;
    private Double probability;
    private Double impact;

    private AttackNode(String id, String label, NodeType type, List<String> children,
                       Double probability, Double impact) {
        this.id = Objects.requireNonNull(id, "id");
        this.label = label != null ? label : id;
        this.type = Objects.requireNonNull(type, "type");
        this.children = List.copyOf(children);
        TreeValidator.checkValues(id, probability, impact);
        this.probability = unsignedZero(probability);
        this.impact = unsignedZero(impact);
    }

    public static AttackNode leaf(String id, String label, Double probability, Double impact) {
        return new AttackNode(id, label, NodeType.LEAF, List.of(), probability, impact);
    }

    public static AttackNode gate(String id, String label, NodeType type, List<String> children) {
        if (type == NodeType.LEAF) {
            throw new IllegalArgumentException("Для листа используйте AttackNode.leaf: " + id);
        }
        return new AttackNode(id, label, type, children, null, null);
    }

    public static AttackNode and(String id, String label, String... children) {
        return gate(id, label, NodeType.AND, List.of(children));
    }

    public static AttackNode or(String id, String label, String... children) {
        return gate(id, label, NodeType.OR, List.of(children));
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public NodeType getType() {
        return type;
    }

    public List<String> getChildren() {
        return children;
    }

    public boolean isLeaf() {
        return type == NodeType.LEAF;
    }

    public OptionalDouble getProbability() {
        return probability != null ? OptionalDouble.of(probability) : OptionalDouble.empty();
    }

    public OptionalDouble getImpact() {
        return impact != null ? OptionalDouble.of(impact) : OptionalDouble.empty();
    }

    void assignValues(Double probability, Double impact) {
        TreeValidator.checkValues(id, probability, impact);
        this.probability = unsignedZero(probability);
        this.impact = unsignedZero(impact);
    }

    /**
     * -0.0 хранится как 0.0, иначе Double.compare ставит его ниже нуля
     */
    private static Double unsignedZero(Double value) {
        return value != null ? value + 0.0 : null;
    }

    AttackNode copy() {
        return new AttackNode(id, label, type, children, probability, impact);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttackNode)) {
            return false;
        }
        AttackNode other = (AttackNode) o;
        return id.equals(other.id)
            && label.equals(other.label)
            && type == other.type
            && children.equals(other.children)
            && Objects.equals(probability, other.probability)
            && Objects.equals(impact, other.impact);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, type, children, probability, impact);
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return "LEAF(" + id + ", prob=" + probability + ", impact=" + impact + ")";
        }
        return type + "(" + id + " -> " + children + ")";
    }
}
