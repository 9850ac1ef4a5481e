package com.vtb.attacktree.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Веб-интерфейс анализатора
 *
 * Запуск:
 * java -jar attack-tree-analyzer.jar --web
 *
 * Доступ:
 * http://localhost:8080/api/v1
 */
@SpringBootApplication
public class AttackTreeWebApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttackTreeWebApplication.class, args);
    }
}
