package com.vtb.attacktree.exceptions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * У листьев не заданы значения, без которых расчёт невозможен.
 * Перечисляет сразу все такие листья, чтобы их можно было заполнить за один раз.
 */
public class IncompleteDataException extends AttackTreeException {

    private final List<String> missingProbability;
    private final List<String> missingImpact;

    public IncompleteDataException(List<String> missingProbability, List<String> missingImpact) {
        super(buildMessage(missingProbability, missingImpact), union(missingProbability, missingImpact));
        this.missingProbability = List.copyOf(missingProbability);
        this.missingImpact = List.copyOf(missingImpact);
    }

    public static IncompleteDataException missingProbability(String leafId) {
        return new IncompleteDataException(List.of(leafId), List.of());
    }

    public List<String> getMissingProbability() {
        return missingProbability;
    }

    public List<String> getMissingImpact() {
        return missingImpact;
    }

    private static String buildMessage(List<String> missingProbability, List<String> missingImpact) {
        List<String> parts = new ArrayList<>();
        if (!missingProbability.isEmpty()) {
            parts.add("не задана вероятность: " + String.join(", ", missingProbability));
        }
        if (!missingImpact.isEmpty()) {
            parts.add("не задан ущерб: " + String.join(", ", missingImpact));
        }
        return "Недостаточно данных для расчёта (" + String.join("; ", parts) + ")";
    }

    private static List<String> union(List<String> first, List<String> second) {
        Set<String> ids = new LinkedHashSet<>(first);
        ids.addAll(second);
        return new ArrayList<>(ids);
    }
}
