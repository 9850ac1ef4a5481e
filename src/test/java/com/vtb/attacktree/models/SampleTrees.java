package com.vtb.attacktree.models;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Деревья для тестов
 */
public final class SampleTrees {

    private SampleTrees() {}

    /**
     * Пример: OR(op_risk = AND(power_out, hdd_fail), cyber = OR(fd_ransom, weak_cfg))
     */
    public static AttackTree workedExample() {
        return new AttackTree("loss_event", List.of(
            AttackNode.or("loss_event", "Business disruption or data loss", "op_risk", "cyber"),
            AttackNode.and("op_risk", "Operational outage", "power_out", "hdd_fail"),
            AttackNode.leaf("power_out", "Power outage", 0.30, 8000.0),
            AttackNode.leaf("hdd_fail", "Disk failure", 0.01, 12000.0),
            AttackNode.or("cyber", "Cyber incident", "fd_ransom", "weak_cfg"),
            AttackNode.leaf("fd_ransom", "Front desk ransomware", 0.50, 180000.0),
            AttackNode.leaf("weak_cfg", "Weak router configuration", 0.60, 60000.0)
        ));
    }

    public static byte[] resource(String name) {
        try (InputStream is = SampleTrees.class.getClassLoader().getResourceAsStream("specs/" + name)) {
            if (is == null) {
                throw new IllegalStateException("Нет тестового ресурса specs/" + name);
            }
            return is.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
