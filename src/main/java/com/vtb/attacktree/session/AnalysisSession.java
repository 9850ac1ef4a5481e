package com.vtb.attacktree.session;

import com.vtb.attacktree.analysis.AggregationEngine;
import com.vtb.attacktree.analysis.SensitivityAnalyzer;
import com.vtb.attacktree.config.AnalyzerConfig;
import com.vtb.attacktree.core.SpecExporter;
import com.vtb.attacktree.core.SpecFormat;
import com.vtb.attacktree.core.SpecNormalizer;
import com.vtb.attacktree.models.AnalysisMetrics;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.SensitivityPreview;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Сессия анализа: одно живое дерево и последний пробный пересчёт.
 *
 * Экземпляр не потокобезопасен: на каждого пользователя (HTTP-сессию, запуск CLI)
 * заводится своя сессия.
 */
@Slf4j
public class AnalysisSession {

    private final AnalyzerConfig config;
    private final SpecNormalizer normalizer;
    private final SpecExporter exporter;
    private final AggregationEngine engine;
    private final SensitivityAnalyzer sensitivityAnalyzer;

    private AttackTree tree;
    private SensitivityPreview lastPreview;

    public AnalysisSession() {
        this(AnalyzerConfig.load());
    }

    public AnalysisSession(AnalyzerConfig config) {
        this.config = config;
        this.normalizer = new SpecNormalizer();
        this.exporter = new SpecExporter();
        this.engine = new AggregationEngine(config.getAnalysis().getTopContributors());
        this.sensitivityAnalyzer = new SensitivityAnalyzer(engine);
    }

    /**
     * Загрузить новую спецификацию. Прежнее дерево и пробный пересчёт отбрасываются;
     * при ошибке нормализации сессия остаётся как была.
     */
    public AttackTree load(byte[] raw, SpecFormat format) {
        AttackTree loaded = normalizer.normalize(raw, format);
        this.tree = loaded;
        this.lastPreview = null;
        return loaded;
    }

    /**
     * Загрузить демо-сценарий из classpath ("pre" или "post")
     */
    public AttackTree loadDemo(String scenario) {
        String resource = config.demoResource(scenario);
        if (resource == null) {
            throw new IllegalArgumentException("Неизвестный демо-сценарий: " + scenario);
        }
        log.info("Загрузка демо-сценария '{}' из {}", scenario, resource);
        try (InputStream is = AnalysisSession.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Ресурс демо-сценария не найден: " + resource);
            }
            return load(is.readAllBytes(), SpecFormat.fromFileName(resource));
        } catch (IOException e) {
            throw new IllegalStateException("Не удалось прочитать демо-сценарий " + resource, e);
        }
    }

    public boolean isLoaded() {
        return tree != null;
    }

    public AttackTree getTree() {
        return requireTree();
    }

    public Optional<SensitivityPreview> getLastPreview() {
        return Optional.ofNullable(lastPreview);
    }

    public AnalysisMetrics analyze() {
        return engine.aggregate(requireTree());
    }

    public AggregationEngine getEngine() {
        return engine;
    }

    /**
     * Изменить значения листа; пробный пересчёт после этого устаревает и сбрасывается
     */
    public void updateLeaf(String leafId, Double probability, Double impact) {
        requireTree().updateLeaf(leafId, probability, impact);
        lastPreview = null;
        log.info("Лист '{}' обновлён: prob={}, impact={}", leafId, probability, impact);
    }

    public SensitivityPreview preview(String leafId, double multiplier) {
        SensitivityPreview preview = sensitivityAnalyzer.previewSensitivity(requireTree(), leafId, multiplier);
        this.lastPreview = preview;
        return preview;
    }

    /**
     * Применить последний пробный пересчёт к живому дереву
     */
    public AttackTree applyPreview() {
        if (lastPreview == null) {
            throw new IllegalStateException("Нет пробного пересчёта для применения");
        }
        SensitivityPreview preview = lastPreview;
        AttackTree updated = sensitivityAnalyzer.applySensitivity(
            requireTree(), preview.getLeafId(), preview.getMultiplier());
        lastPreview = null;
        return updated;
    }

    public String export(SpecFormat format) {
        return exporter.export(requireTree(), format);
    }

    private AttackTree requireTree() {
        if (tree == null) {
            throw new IllegalStateException("Спецификация не загружена");
        }
        return tree;
    }
}
