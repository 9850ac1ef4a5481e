package com.vtb.attacktree.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Выгрузка живого дерева обратно в каноническую форму спецификации.
 * Незаданные prob/impact не выводятся, поэтому повторная нормализация
 * выгрузки даёт равное дерево.
 */
@Slf4j
public class SpecExporter {

    public String export(AttackTree tree, SpecFormat format) {
        if (tree == null) {
            throw new IllegalArgumentException("Дерево не может быть null");
        }
        try {
            if (format == SpecFormat.XML) {
                ObjectMapper mapper = format.createMapper().enable(SerializationFeature.INDENT_OUTPUT);
                return mapper.writeValueAsString(toXmlDocument(tree));
            }
            ObjectMapper mapper = format.createMapper();
            if (format == SpecFormat.JSON) {
                mapper.enable(SerializationFeature.INDENT_OUTPUT);
            }
            return mapper.writeValueAsString(toCanonicalMap(tree));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Ошибка выгрузки спецификации в " + format, e);
        }
    }

    public byte[] exportBytes(AttackTree tree, SpecFormat format) {
        return export(tree, format).getBytes(StandardCharsets.UTF_8);
    }

    public void exportToFile(AttackTree tree, SpecFormat format, Path outputPath) throws IOException {
        Files.write(outputPath, exportBytes(tree, format));
        log.info("Спецификация выгружена: {} ({})", outputPath, format);
    }

    /**
     * Каноническая форма: поля корня на верхнем уровне, остальные узлы в списке nodes
     */
    public Map<String, Object> toCanonicalMap(AttackTree tree) {
        AttackNode root = tree.getRoot();
        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("id", root.getId());
        spec.put("label", root.getLabel());
        spec.put("type", root.getType().name());
        spec.put("children", new ArrayList<>(root.getChildren()));
        if (root.isLeaf()) {
            putValues(spec, root);
        }

        List<Map<String, Object>> nodes = new ArrayList<>();
        for (AttackNode node : tree.getNodes()) {
            if (node.getId().equals(tree.getRootId())) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", node.getId());
            entry.put("label", node.getLabel());
            entry.put("type", node.getType().name());
            if (node.isLeaf()) {
                putValues(entry, node);
            } else {
                entry.put("children", new ArrayList<>(node.getChildren()));
            }
            nodes.add(entry);
        }
        spec.put("nodes", nodes);
        return spec;
    }

    private void putValues(Map<String, Object> entry, AttackNode leaf) {
        leaf.getProbability().ifPresent(value -> entry.put("prob", value));
        leaf.getImpact().ifPresent(value -> entry.put("impact", value));
    }

    private XmlSpecDocument toXmlDocument(AttackTree tree) {
        AttackNode root = tree.getRoot();
        XmlSpecDocument document = new XmlSpecDocument();
        document.setId(root.getId());
        document.setLabel(root.getLabel());
        document.setType(root.getType().name());
        document.setChildren(new ArrayList<>(root.getChildren()));
        if (root.isLeaf()) {
            document.setProb(root.getProbability().isPresent() ? root.getProbability().getAsDouble() : null);
            document.setImpact(root.getImpact().isPresent() ? root.getImpact().getAsDouble() : null);
        }
        for (AttackNode node : tree.getNodes()) {
            if (node.getId().equals(tree.getRootId())) {
                continue;
            }
            XmlSpecDocument.Node entry = new XmlSpecDocument.Node();
            entry.setId(node.getId());
            entry.setLabel(node.getLabel());
            entry.setType(node.getType().name());
            if (node.isLeaf()) {
                entry.setProb(node.getProbability().isPresent() ? node.getProbability().getAsDouble() : null);
                entry.setImpact(node.getImpact().isPresent() ? node.getImpact().getAsDouble() : null);
            } else {
                entry.setChildren(new ArrayList<>(node.getChildren()));
            }
            document.getNodes().add(entry);
        }
        return document;
    }
}
