package com.vtb.attacktree.analysis;

import com.vtb.attacktree.config.AnalyzerConfig;
import com.vtb.attacktree.exceptions.IncompleteDataException;
import com.vtb.attacktree.models.AnalysisMetrics;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.Contributor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Агрегация дерева атак: вероятность головного события, ожидаемый ущерб
 * и листья с наибольшим вкладом.
 *
 * Обход снизу вверх (post-order) без рекурсии, вероятность каждого узла
 * считается ровно один раз и запоминается.
 * AND: произведение вероятностей потомков.
 * OR: 1 - произведение (1 - p) по потомкам.
 * Результат узла после вычисления приводится в [0, 1] (погрешность плавающей точки).
 */
@Slf4j
public class AggregationEngine {

    private static final Comparator<Contributor> BY_CONTRIBUTION =
        Comparator.comparingDouble(Contributor::getContribution).reversed()
            .thenComparing(Contributor::getLeafId);

    private final int topContributorLimit;

    public AggregationEngine() {
        this(AnalyzerConfig.load().getAnalysis().getTopContributors());
    }

    public AggregationEngine(int topContributorLimit) {
        if (topContributorLimit < 1) {
            throw new IllegalArgumentException("Размер рейтинга должен быть положительным: " + topContributorLimit);
        }
        this.topContributorLimit = topContributorLimit;
    }

    /**
     * Посчитать метрики дерева. Если у листьев не хватает вероятности или ущерба,
     * бросается одно IncompleteDataException со всеми такими листьями.
     */
    public AnalysisMetrics aggregate(AttackTree tree) {
        requireTree(tree);
        Traversal traversal = traverse(tree, tree.getRootId());

        List<String> missingImpact = new ArrayList<>();
        for (AttackNode leaf : traversal.leaves) {
            if (leaf.getImpact().isEmpty()) {
                missingImpact.add(leaf.getId());
            }
        }
        if (!traversal.missingProbability.isEmpty() || !missingImpact.isEmpty()) {
            throw new IncompleteDataException(traversal.missingProbability, missingImpact);
        }

        double expectedLoss = 0.0;
        List<Contributor> contributions = new ArrayList<>(traversal.leaves.size());
        for (AttackNode leaf : traversal.leaves) {
            double contribution = leaf.getProbability().getAsDouble() * leaf.getImpact().getAsDouble();
            expectedLoss += contribution;
            contributions.add(Contributor.builder()
                .leafId(leaf.getId())
                .label(leaf.getLabel())
                .contribution(contribution)
                .build());
        }
        contributions.sort(BY_CONTRIBUTION);
        List<Contributor> top = new ArrayList<>(
            contributions.subList(0, Math.min(topContributorLimit, contributions.size())));

        double topProbability = traversal.probabilities.get(tree.getRootId());
        log.debug("Дерево '{}': P(top)={}, ожидаемый ущерб={}", tree.getRootId(), topProbability, expectedLoss);
        return AnalysisMetrics.builder()
            .topProbability(topProbability)
            .expectedLoss(expectedLoss)
            .topContributors(top)
            .build();
    }

    /**
     * Вероятность произвольного узла (поддерева). Ущерб не требуется.
     */
    public double probabilityOf(AttackTree tree, String nodeId) {
        requireTree(tree);
        tree.getNode(nodeId);
        Traversal traversal = traverse(tree, nodeId);
        if (!traversal.missingProbability.isEmpty()) {
            throw new IncompleteDataException(traversal.missingProbability, List.of());
        }
        return traversal.probabilities.get(nodeId);
    }

    /**
     * Производная вероятность каждого узла дерева, в порядке обхода
     */
    public Map<String, Double> nodeProbabilities(AttackTree tree) {
        requireTree(tree);
        Traversal traversal = traverse(tree, tree.getRootId());
        if (!traversal.missingProbability.isEmpty()) {
            throw new IncompleteDataException(traversal.missingProbability, List.of());
        }
        return traversal.probabilities;
    }

    static double combineAnd(List<Double> childProbabilities) {
        double product = 1.0;
        for (double p : childProbabilities) {
            product *= p;
        }
        return clamp(product);
    }

    static double combineOr(List<Double> childProbabilities) {
        double none = 1.0;
        for (double p : childProbabilities) {
            none *= 1.0 - p;
        }
        return clamp(1.0 - none);
    }

    static double clamp(double value) {
        if (value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }

    private Traversal traverse(AttackTree tree, String startId) {
        Traversal traversal = new Traversal();
        Map<String, Double> memo = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(startId);

        while (!stack.isEmpty()) {
            String id = stack.peek();
            if (memo.containsKey(id)) {
                stack.pop();
                continue;
            }
            AttackNode node = tree.getNode(id);
            if (node.isLeaf()) {
                if (node.getProbability().isPresent()) {
                    memo.put(id, node.getProbability().getAsDouble());
                } else {
                    memo.put(id, Double.NaN);
                    traversal.missingProbability.add(id);
                }
                traversal.leaves.add(node);
                traversal.probabilities.put(id, memo.get(id));
                stack.pop();
                continue;
            }

            boolean ready = true;
            List<String> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                if (!memo.containsKey(children.get(i))) {
                    stack.push(children.get(i));
                    ready = false;
                }
            }
            if (!ready) {
                continue;
            }

            List<Double> childProbabilities = new ArrayList<>(children.size());
            for (String childId : children) {
                childProbabilities.add(memo.get(childId));
            }
            double probability = switch (node.getType()) {
                case AND -> combineAnd(childProbabilities);
                case OR -> combineOr(childProbabilities);
                case LEAF -> throw new IllegalStateException("Лист обработан выше: " + id);
            };
            memo.put(id, probability);
            traversal.probabilities.put(id, probability);
            stack.pop();
        }
        return traversal;
    }

    private static void requireTree(AttackTree tree) {
        if (tree == null) {
            throw new IllegalArgumentException("Дерево не может быть null");
        }
    }

    private static final class Traversal {
        private final Map<String, Double> probabilities = new LinkedHashMap<>();
        private final List<AttackNode> leaves = new ArrayList<>();
        private final List<String> missingProbability = new ArrayList<>();
    }
}
