package com.vtb.attacktree.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.attacktree.exceptions.DuplicateIdException;
import com.vtb.attacktree.exceptions.MalformedSpecException;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.NodeType;
import com.vtb.attacktree.models.TreeValidator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Нормализатор спецификаций дерева атак (YAML / JSON / XML).
 *
 * Разбирает байты по правилам заявленного формата в JsonNode и приводит их
 * к каноническому AttackTree. Проверки идут строго по порядку, первая ошибка
 * прерывает разбор:
 * <ol>
 *   <li>обязательные поля корня и узлов, секция nodes - {@link MalformedSpecException}</li>
 *   <li>уникальность идентификаторов - {@link DuplicateIdException}</li>
 *   <li>разрешимость ссылок на потомков - DanglingReferenceException</li>
 *   <li>граф является деревом - StructuralException</li>
 *   <li>диапазоны prob / impact - RangeException</li>
 * </ol>
 * Частично построенное дерево при ошибке не возвращается.
 */
@Slf4j
public class SpecNormalizer {

    private static final String FIELD_ID = "id";
    private static final String FIELD_LABEL = "label";
    private static final String FIELD_TYPE = "type";
    private static final String FIELD_CHILDREN = "children";
    private static final String FIELD_NODES = "nodes";
    private static final String FIELD_PROB = "prob";
    private static final String FIELD_IMPACT = "impact";

    /**
     * Нормализовать спецификацию из байтов заявленного формата
     */
    public AttackTree normalize(byte[] raw, SpecFormat format) {
        if (format == null) {
            throw new IllegalArgumentException("Формат спецификации не может быть null");
        }
        if (raw == null || raw.length == 0) {
            throw new MalformedSpecException("Спецификация пуста");
        }

        JsonNode document;
        try {
            document = format.createMapper().readTree(raw);
        } catch (IOException e) {
            throw new MalformedSpecException("Не удалось разобрать " + format + ": " + e.getMessage(), e);
        }
        if (document == null || !document.isObject()) {
            throw new MalformedSpecException("Верхний уровень спецификации должен быть отображением (mapping)");
        }

        // 1. обязательные поля
        RawNode root = readRoot(document);
        List<RawNode> declared = new ArrayList<>();
        declared.add(root);
        int index = 0;
        for (JsonNode entry : sequence(document.get(FIELD_NODES))) {
            declared.add(readNode(entry, index++));
        }

        // 2. уникальность
        Map<String, RawNode> byId = new LinkedHashMap<>();
        for (RawNode node : declared) {
            if (byId.putIfAbsent(node.id, node) != null) {
                throw new DuplicateIdException(node.id);
            }
        }

        Map<String, List<String>> childrenById = new LinkedHashMap<>();
        Map<String, NodeType> typeById = new LinkedHashMap<>();
        byId.forEach((id, node) -> {
            childrenById.put(id, node.children);
            typeById.put(id, node.type);
        });

        // 3. ссылки
        TreeValidator.checkReferences(root.id, childrenById);

        // 4. структура
        TreeValidator.checkShape(typeById, childrenById);
        TreeValidator.checkTree(root.id, childrenById);

        // 5. диапазоны
        for (RawNode node : byId.values()) {
            TreeValidator.checkValues(node.id, node.probability, node.impact);
        }

        List<AttackNode> nodes = new ArrayList<>(byId.size());
        for (RawNode node : byId.values()) {
            nodes.add(node.type == NodeType.LEAF
                ? AttackNode.leaf(node.id, node.label, node.probability, node.impact)
                : AttackNode.gate(node.id, node.label, node.type, node.children));
        }
        AttackTree tree = new AttackTree(root.id, nodes);
        log.info("Спецификация {} нормализована: корень '{}', узлов {}, листьев {}",
            format, tree.getRootId(), tree.size(), tree.getLeaves().size());
        return tree;
    }

    public AttackTree normalize(String text, SpecFormat format) {
        return normalize(text != null ? text.getBytes(StandardCharsets.UTF_8) : null, format);
    }

    /**
     * Загрузить спецификацию из файла, формат определяется по расширению
     */
    public AttackTree normalizeFile(Path path) throws IOException {
        log.info("Загрузка спецификации из файла: {}", path);
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Файл не найден: " + path);
        }
        return normalize(Files.readAllBytes(path), SpecFormat.fromFileName(path.getFileName().toString()));
    }

    private RawNode readRoot(JsonNode document) {
        String id = requireText(document, FIELD_ID, "корня");
        String label = requireText(document, FIELD_LABEL, "корня '" + id + "'");
        NodeType type = requireType(document, id);
        if (!document.has(FIELD_CHILDREN)) {
            throw new MalformedSpecException("У корня '" + id + "' отсутствует поле 'children'", List.of(id));
        }
        if (!document.has(FIELD_NODES)) {
            throw new MalformedSpecException("В спецификации отсутствует секция 'nodes'");
        }
        boolean leaf = type == NodeType.LEAF;
        return new RawNode(id, label, type, childIds(document.get(FIELD_CHILDREN), id),
            leaf ? number(document, FIELD_PROB, id) : null,
            leaf ? number(document, FIELD_IMPACT, id) : null);
    }

    private RawNode readNode(JsonNode entry, int index) {
        if (entry == null || !entry.isObject()) {
            throw new MalformedSpecException("Элемент nodes[" + index + "] должен быть отображением");
        }
        String id = requireText(entry, FIELD_ID, "узла nodes[" + index + "]");
        String label = requireText(entry, FIELD_LABEL, "узла '" + id + "'");
        NodeType type = requireType(entry, id);
        List<String> children = childIds(entry.get(FIELD_CHILDREN), id);
        if (type.isGate() && (entry.hasNonNull(FIELD_PROB) || entry.hasNonNull(FIELD_IMPACT))) {
            log.warn("Узел {} '{}': поля prob/impact допустимы только для листьев и будут проигнорированы", type, id);
        }
        Double probability = type == NodeType.LEAF ? number(entry, FIELD_PROB, id) : null;
        Double impact = type == NodeType.LEAF ? number(entry, FIELD_IMPACT, id) : null;
        return new RawNode(id, label, type, children, probability, impact);
    }

    private String requireText(JsonNode object, String field, String owner) {
        JsonNode value = object.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            throw new MalformedSpecException("Отсутствует поле '" + field + "' у " + owner);
        }
        return value.asText().trim();
    }

    private NodeType requireType(JsonNode object, String id) {
        String label = requireText(object, FIELD_TYPE, "узла '" + id + "'");
        NodeType type = NodeType.fromLabel(label);
        if (type == null) {
            throw new MalformedSpecException(
                "Неизвестный вид узла '" + label + "' у '" + id + "' (допустимы AND, OR, LEAF)", List.of(id));
        }
        return type;
    }

    private List<String> childIds(JsonNode value, String ownerId) {
        List<String> ids = new ArrayList<>();
        for (JsonNode child : sequence(value)) {
            JsonNode idNode = child.isObject() ? child.get(FIELD_ID) : child;
            if (idNode == null || !idNode.isValueNode() || idNode.asText().isBlank()) {
                throw new MalformedSpecException(
                    "Некорректная ссылка на потомка у узла '" + ownerId + "'", List.of(ownerId));
            }
            ids.add(idNode.asText().trim());
        }
        return ids;
    }

    /**
     * Необязательное число. Отсутствие, null и пустая строка означают "не задано".
     * В XML числа приходят строками, поэтому текст тоже разбирается.
     */
    private Double number(JsonNode object, String field, String id) {
        JsonNode value = object.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new MalformedSpecException(
                    "Поле '" + field + "' узла '" + id + "' не является числом: " + text, List.of(id));
            }
        }
        throw new MalformedSpecException(
            "Поле '" + field + "' узла '" + id + "' не является числом", List.of(id));
    }

    /**
     * Последовательность элементов. XML отдаёт списки как обёртку с одним полем
     * ({"child": [...]}) или как одиночное значение, если элемент один.
     */
    private static List<JsonNode> sequence(JsonNode value) {
        List<JsonNode> items = new ArrayList<>();
        if (value == null || value.isNull() || value.isMissingNode()) {
            return items;
        }
        if (value.isArray()) {
            value.forEach(items::add);
            return items;
        }
        if (value.isTextual() && value.asText().isBlank()) {
            return items;
        }
        if (value.isObject() && !value.has(FIELD_ID) && value.size() == 1) {
            Iterator<JsonNode> wrapped = value.elements();
            return sequence(wrapped.next());
        }
        items.add(value);
        return items;
    }

    private static final class RawNode {
        private final String id;
        private final String label;
        private final NodeType type;
        private final List<String> children;
        private final Double probability;
        private final Double impact;

        private RawNode(String id, String label, NodeType type, List<String> children,
                        Double probability, Double impact) {
            this.id = id;
            this.label = label;
            this.type = type;
            this.children = children;
            this.probability = probability;
            this.impact = impact;
        }
    }
}
