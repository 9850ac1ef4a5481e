package com.vtb.attacktree.web;

import com.vtb.attacktree.config.AnalyzerConfig;
import com.vtb.attacktree.core.SpecFormat;
import com.vtb.attacktree.models.AnalysisReport;
import com.vtb.attacktree.models.SensitivityPreview;
import com.vtb.attacktree.reports.ReportBuilder;
import com.vtb.attacktree.session.AnalysisSession;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.util.WebUtils;

import java.io.IOException;
import java.util.Locale;
import java.util.function.Function;

/**
 * REST API анализатора.
 *
 * Живое дерево хранится в HTTP-сессии пользователя: у каждой сессии
 * свой AnalysisSession, общего дерева на процесс нет.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
public class AttackTreeController {

    static final String SESSION_ATTRIBUTE = "attackTree.analysisSession";

    private final AnalyzerConfig config;

    public AttackTreeController() {
        this(AnalyzerConfig.load());
    }

    AttackTreeController(AnalyzerConfig config) {
        this.config = config;
    }

    /**
     * Загрузить спецификацию
     *
     * POST /api/v1/spec
     * Content-Type: multipart/form-data
     * file: tree.yaml
     */
    @PostMapping(value = "/spec", produces = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisReport uploadSpec(@RequestParam("file") MultipartFile file,
                                     @RequestParam(value = "format", required = false) String format,
                                     HttpSession httpSession) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Файл не загружен или пуст");
        }
        String filename = file.getOriginalFilename();
        SpecFormat specFormat = format != null && !format.isBlank()
            ? SpecFormat.fromName(format)
            : SpecFormat.fromFileName(filename);
        String extension = filename != null && filename.contains(".")
            ? filename.substring(filename.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT)
            : specFormat.getDefaultExtension();
        if (!config.getUpload().getAllowedExtensions().contains(extension)) {
            throw new IllegalArgumentException("Неподдерживаемый формат файла: " + filename);
        }
        if (file.getSize() > config.getUpload().maxSizeBytes()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                "Файл слишком большой: %.1f KB (максимум: %d KB)",
                file.getSize() / 1024.0, config.getUpload().getMaxSizeKb()));
        }

        log.info("Получена спецификация: {} ({})", filename, specFormat);
        byte[] content = file.getBytes();
        return withSession(httpSession, session -> {
            session.load(content, specFormat);
            return report(session);
        });
    }

    @PostMapping(value = "/demo/{scenario}", produces = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisReport loadDemo(@PathVariable("scenario") String scenario, HttpSession httpSession) {
        return withSession(httpSession, session -> {
            session.loadDemo(scenario);
            return report(session);
        });
    }

    @GetMapping(value = "/analysis", produces = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisReport analysis(HttpSession httpSession) {
        return withSession(httpSession, this::report);
    }

    /**
     * Изменить вероятность/ущерб листа
     */
    @PutMapping(value = "/leaves/{leafId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisReport updateLeaf(@PathVariable("leafId") String leafId,
                                     @RequestBody LeafUpdateRequest request,
                                     HttpSession httpSession) {
        return withSession(httpSession, session -> {
            session.updateLeaf(leafId, request.getProb(), request.getImpact());
            return report(session);
        });
    }

    @PostMapping(value = "/sensitivity/preview", produces = MediaType.APPLICATION_JSON_VALUE)
    public SensitivityPreview previewSensitivity(@RequestBody SensitivityRequest request, HttpSession httpSession) {
        if (request.getLeafId() == null || request.getLeafId().isBlank()) {
            throw new IllegalArgumentException("Выберите лист для анализа чувствительности");
        }
        if (request.getMultiplier() == null) {
            throw new IllegalArgumentException("Не задан множитель вероятности для листа '" + request.getLeafId() + "'");
        }
        double multiplier = request.getMultiplier();
        return withSession(httpSession, session -> session.preview(request.getLeafId(), multiplier));
    }

    @PostMapping(value = "/sensitivity/apply", produces = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisReport applySensitivity(HttpSession httpSession) {
        return withSession(httpSession, session -> {
            session.applyPreview();
            return report(session);
        });
    }

    /**
     * Скачать текущую спецификацию
     *
     * GET /api/v1/spec/export?format=yaml
     */
    @GetMapping("/spec/export")
    public ResponseEntity<String> exportSpec(@RequestParam(value = "format", defaultValue = "yaml") String format,
                                             HttpSession httpSession) {
        SpecFormat specFormat = SpecFormat.fromName(format);
        String body = withSession(httpSession, session -> session.export(specFormat));
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION,
                "attachment; filename=\"updated_spec." + specFormat.getDefaultExtension() + "\"")
            .contentType(MediaType.parseMediaType(specFormat.getMediaType() + ";charset=UTF-8"))
            .body(body);
    }

    private AnalysisReport report(AnalysisSession session) {
        return ReportBuilder.build(session.getTree(), session.getEngine(), session.getLastPreview().orElse(null));
    }

    /**
     * Запросы одной HTTP-сессии к её AnalysisSession выполняются по очереди
     * под мьютексом сессии; сессия анализа создаётся под тем же мьютексом.
     */
    private <T> T withSession(HttpSession httpSession, Function<AnalysisSession, T> action) {
        synchronized (WebUtils.getSessionMutex(httpSession)) {
            Object existing = httpSession.getAttribute(SESSION_ATTRIBUTE);
            AnalysisSession session;
            if (existing instanceof AnalysisSession) {
                session = (AnalysisSession) existing;
            } else {
                session = new AnalysisSession(config);
                httpSession.setAttribute(SESSION_ATTRIBUTE, session);
            }
            return action.apply(session);
        }
    }
}
