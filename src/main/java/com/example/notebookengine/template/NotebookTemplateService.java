package com.example.notebookengine.template;

import com.example.notebookengine.config.EngineProperties;
import com.example.notebookengine.dto.CellDraft;
import com.example.notebookengine.dto.CreateNotebookRequest;
import com.example.notebookengine.dto.NotebookDetails;
import com.example.notebookengine.exception.NotFoundException;
import com.example.notebookengine.service.NotebookService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Loads YAML notebook templates from the classpath and from the configured
 * directory, and creates notebooks from them. Directory templates override
 * bundled ones with the same id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotebookTemplateService {

    private static final String CLASSPATH_PATTERN = "classpath*:notebook-templates/*.y*ml";

    private final EngineProperties properties;
    private final NotebookService notebookService;

    private final Map<String, NotebookTemplate> templates = new ConcurrentHashMap<>();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    @PostConstruct
    public void init() {
        loadTemplates();
    }

    public synchronized int loadTemplates() {
        templates.clear();
        loadBundled();
        loadDirectory(properties.getTemplates().getDirectory());
        log.info("Loaded {} notebook templates", templates.size());
        return templates.size();
    }

    public List<NotebookTemplate> listTemplates(String category) {
        return templates.values().stream()
                .filter(t -> category == null || category.equalsIgnoreCase(t.getCategory()))
                .sorted(Comparator.comparing(NotebookTemplate::getName, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    public NotebookTemplate getTemplate(String templateId) {
        NotebookTemplate template = templates.get(templateId);
        if (template == null) {
            throw new NotFoundException("Template not found: " + templateId);
        }
        return template;
    }

    /**
     * Create a notebook owned by {@code ownerId} with the template's cells, in order.
     */
    public NotebookDetails instantiate(String templateId, String ownerId, String title) {
        NotebookTemplate template = getTemplate(templateId);
        CreateNotebookRequest request = CreateNotebookRequest.builder()
                .title(title != null && !title.isBlank() ? title : template.getName())
                .description(template.getDescription())
                .cells(template.getCells().stream()
                        .map(c -> CellDraft.builder()
                                .cellType(c.getType())
                                .title(c.getTitle())
                                .content(c.getContent())
                                .build())
                        .collect(Collectors.toList()))
                .build();
        log.info("Instantiating template {} for {}", templateId, ownerId);
        return notebookService.createNotebook(ownerId, request);
    }

    private void loadBundled() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(CLASSPATH_PATTERN);
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    register(yamlMapper.readValue(in, NotebookTemplate.class), resource.getFilename());
                } catch (IOException e) {
                    log.error("Failed to load template {}: {}", resource.getFilename(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to scan bundled templates: {}", e.getMessage());
        }
    }

    private void loadDirectory(String directory) {
        File dir = new File(directory);
        if (!dir.isDirectory()) {
            log.debug("Template directory {} not present, using bundled templates only", directory);
            return;
        }
        File[] files = dir.listFiles((d, name) -> name.endsWith(".yml") || name.endsWith(".yaml"));
        if (files == null) {
            return;
        }
        for (File file : files) {
            try {
                register(yamlMapper.readValue(file, NotebookTemplate.class), file.getName());
            } catch (IOException e) {
                log.error("Failed to load template {}: {}", file.getName(), e.getMessage());
            }
        }
    }

    private void register(NotebookTemplate template, String filename) {
        if (template.getId() == null && filename != null) {
            template.setId(filename.replace(".yml", "").replace(".yaml", ""));
        }
        if (template.getId() == null) {
            log.warn("Skipping template without id");
            return;
        }
        templates.put(template.getId(), template);
        log.info("Loaded template: {} ({} cells)", template.getName(), template.getCells().size());
    }
}
