package com.vtb.attacktree.cli;

import com.vtb.attacktree.core.SpecFormat;
import com.vtb.attacktree.exceptions.AttackTreeException;
import com.vtb.attacktree.exceptions.IncompleteDataException;
import com.vtb.attacktree.models.AnalysisMetrics;
import com.vtb.attacktree.models.AnalysisReport;
import com.vtb.attacktree.models.Contributor;
import com.vtb.attacktree.models.SensitivityPreview;
import com.vtb.attacktree.reports.JsonReportGenerator;
import com.vtb.attacktree.reports.ReportBuilder;
import com.vtb.attacktree.session.AnalysisSession;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда анализатора деревьев атак
 */
@Slf4j
@Command(
    name = "attack-tree",
    mixinStandardHelpOptions = true,
    version = "VTB Attack Tree Risk Analyzer 1.0.0",
    description = """

        VTB Attack Tree Risk Analyzer

        Оценка риска по дереву атак (AND/OR)

        Возможности:
          • Загрузка спецификаций YAML, JSON, XML
          • Вероятность головного события и ожидаемый ущерб
          • Рейтинг листьев по вкладу в ущерб
          • Анализ чувствительности (пробный пересчёт и применение)
          • Выгрузка обновлённой спецификации и JSON отчёта

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_SPEC_ERROR = 2;
    static final int EXIT_INCOMPLETE = 3;

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Путь к файлу спецификации дерева атак (YAML/JSON/XML)"
    )
    private String specificationPath;

    @Option(
        names = {"-f", "--format"},
        description = "Формат спецификации (yaml, json, xml); по умолчанию по расширению файла"
    )
    private String format;

    @Option(
        names = {"--demo"},
        description = "Загрузить демо-сценарий (pre, post) вместо файла"
    )
    private String demoScenario;

    @Option(
        names = {"--prob"},
        description = "Задать вероятность листа: --prob leaf=0.25 (пустое значение сбрасывает)"
    )
    private Map<String, String> probabilityOverrides = new LinkedHashMap<>();

    @Option(
        names = {"--impact"},
        description = "Задать ущерб листа: --impact leaf=12000 (пустое значение сбрасывает)"
    )
    private Map<String, String> impactOverrides = new LinkedHashMap<>();

    @Option(
        names = {"-s", "--sensitivity"},
        description = "Лист для анализа чувствительности"
    )
    private String sensitivityLeaf;

    @Option(
        names = {"-m", "--multiplier"},
        description = "Множитель вероятности листа (по умолчанию: 1.0)"
    )
    private double multiplier = 1.0;

    @Option(
        names = {"--apply"},
        description = "Применить результат анализа чувствительности к дереву"
    )
    private boolean applySensitivity = false;

    @Option(
        names = {"-e", "--export"},
        description = "Сохранить обновлённую спецификацию в файл (формат по расширению)"
    )
    private String exportPath;

    @Option(
        names = {"-o", "--output"},
        description = "Директория для JSON отчета"
    )
    private String outputDir;

    @Option(
        names = {"--web"},
        description = "Запустить веб-интерфейс (http://localhost:8080)"
    )
    private boolean webMode = false;

    @Option(
        names = {"--port"},
        description = "Порт для веб-интерфейса (по умолчанию: 8080)"
    )
    private int webPort = 8080;

    private final AnalysisSession session;
    private final PrintStream out;

    public MainCommand() {
        this(new AnalysisSession(), System.out);
    }

    MainCommand(AnalysisSession session, PrintStream out) {
        this.session = session;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (webMode) {
            log.info("Запуск веб-интерфейса на порту {}...", webPort);
            String[] webArgs = {"--server.port=" + webPort};
            com.vtb.attacktree.web.AttackTreeWebApplication.main(webArgs);
            return EXIT_OK;
        }

        try {
            loadSpecification();
            applyLeafOverrides();

            SensitivityPreview preview = null;
            if (sensitivityLeaf != null && !sensitivityLeaf.isBlank()) {
                preview = session.preview(sensitivityLeaf, multiplier);
                printPreview(preview);
                if (applySensitivity) {
                    session.applyPreview();
                    out.println("Множитель применён к листу '" + sensitivityLeaf + "'");
                    preview = null;
                }
            }

            AnalysisMetrics metrics = null;
            try {
                metrics = session.analyze();
                printMetrics(metrics);
            } catch (IncompleteDataException e) {
                log.warn("Расчёт невозможен: {}", e.getMessage());
                out.println(e.getMessage());
            }

            if (outputDir != null) {
                writeReport(preview);
            }
            if (exportPath != null) {
                Path target = Paths.get(exportPath);
                SpecFormat exportFormat = SpecFormat.fromFileName(target.getFileName().toString());
                Files.writeString(target, session.export(exportFormat));
                log.info("Обновлённая спецификация сохранена: {}", target);
            }
            return metrics != null ? EXIT_OK : EXIT_INCOMPLETE;

        } catch (IncompleteDataException e) {
            log.error("Недостаточно данных: {}", e.getMessage());
            return EXIT_INCOMPLETE;
        } catch (AttackTreeException e) {
            log.error("Ошибка спецификации: {} (узлы: {})", e.getMessage(), e.getNodeIds());
            return EXIT_SPEC_ERROR;
        } catch (IllegalArgumentException e) {
            log.error("Некорректные параметры: {}", e.getMessage());
            return EXIT_SPEC_ERROR;
        } catch (Exception e) {
            log.error("Ошибка анализа: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    private void loadSpecification() throws Exception {
        if (demoScenario != null) {
            session.loadDemo(demoScenario);
            return;
        }
        if (specificationPath == null) {
            throw new IllegalArgumentException("Укажите файл спецификации или --demo");
        }
        Path path = Paths.get(specificationPath);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Файл не найден: " + specificationPath);
        }
        SpecFormat specFormat = format != null
            ? SpecFormat.fromName(format)
            : SpecFormat.fromFileName(path.getFileName().toString());
        log.info("Загрузка спецификации: {} ({})", path, specFormat);
        session.load(Files.readAllBytes(path), specFormat);
    }

    private void applyLeafOverrides() {
        Map<String, Double[]> updates = new LinkedHashMap<>();
        probabilityOverrides.forEach((leafId, value) ->
            updates.computeIfAbsent(leafId, this::currentValues)[0] = parseValue(value, "вероятность", leafId));
        impactOverrides.forEach((leafId, value) ->
            updates.computeIfAbsent(leafId, this::currentValues)[1] = parseValue(value, "ущерб", leafId));
        updates.forEach((leafId, values) -> session.updateLeaf(leafId, values[0], values[1]));
    }

    private Double[] currentValues(String leafId) {
        var leaf = session.getTree().getLeaf(leafId);
        return new Double[] {
            leaf.getProbability().isPresent() ? leaf.getProbability().getAsDouble() : null,
            leaf.getImpact().isPresent() ? leaf.getImpact().getAsDouble() : null
        };
    }

    private static Double parseValue(String value, String what, String leafId) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Некорректное значение (" + what + ") для листа '" + leafId + "': " + value);
        }
    }

    private void writeReport(SensitivityPreview preview) throws Exception {
        Path dir = Paths.get(outputDir);
        Files.createDirectories(dir);
        JsonReportGenerator generator = new JsonReportGenerator();
        AnalysisReport report = ReportBuilder.build(session.getTree(), session.getEngine(), preview);
        generator.generate(report, dir.resolve("attack-tree-report." + generator.getFileExtension()));
    }

    private void printMetrics(AnalysisMetrics metrics) {
        out.println();
        out.println("═══════════════════════════════════════════════");
        out.println("  Дерево: " + session.getTree().getRoot().getLabel());
        out.println("═══════════════════════════════════════════════");
        out.printf(Locale.ROOT, "  P(головное событие): %.4f%n", metrics.getTopProbability());
        out.printf(Locale.ROOT, "  Ожидаемый ущерб:     %.2f%n", metrics.getExpectedLoss());
        out.println("  Наибольший вклад:");
        int rank = 1;
        for (Contributor contributor : metrics.getTopContributors()) {
            out.printf(Locale.ROOT, "    %d. %s (%s): %.2f%n",
                rank++, contributor.getLeafId(), contributor.getLabel(), contributor.getContribution());
        }
        out.println();
    }

    private void printPreview(SensitivityPreview preview) {
        out.printf(Locale.ROOT, "Чувствительность: лист '%s' x%.3f (%.4f -> %.4f)%n",
            preview.getLeafId(), preview.getMultiplier(),
            preview.getOriginalProbability(), preview.getNewProbability());
        out.printf(Locale.ROOT, "  P(головное событие): %.4f, ожидаемый ущерб: %.2f%n",
            preview.getTopProbability(), preview.getExpectedLoss());
    }
}
