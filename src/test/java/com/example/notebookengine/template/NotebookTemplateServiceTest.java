package com.example.notebookengine.template;

import com.example.notebookengine.domain.NotebookCell;
import com.example.notebookengine.dto.NotebookDetails;
import com.example.notebookengine.exception.NotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class NotebookTemplateServiceTest {

    @Autowired
    private NotebookTemplateService templateService;

    @Test
    void bundledTemplatesAreLoaded() {
        List<String> ids = templateService.listTemplates(null).stream()
                .map(NotebookTemplate::getId)
                .collect(Collectors.toList());

        assertTrue(ids.containsAll(List.of("weekly-sales-report", "incident-postmortem")));
        assertEquals(2, templateService.loadTemplates());
    }

    @Test
    void filtersByCategoryIgnoringCase() {
        List<NotebookTemplate> sales = templateService.listTemplates("SALES");

        assertEquals(1, sales.size());
        assertEquals("weekly-sales-report", sales.get(0).getId());
        assertTrue(templateService.listTemplates("finance").isEmpty());
    }

    @Test
    void variablesAreDeclared() {
        NotebookTemplate template = templateService.getTemplate("weekly-sales-report");

        assertEquals("region", template.getVariables().get(0).getName());
        assertTrue(template.getVariables().get(0).isRequired());
        assertEquals(List.of("EMEA", "AMER", "APAC"), template.getVariables().get(0).getOptions());
    }

    @Test
    void instantiateCopiesCellsInOrder() {
        NotebookDetails details = templateService.instantiate("incident-postmortem", "user-t", null);

        assertEquals("Incident Postmortem", details.getNotebook().getTitle());
        assertEquals("user-t", details.getNotebook().getOwnerId());
        assertEquals(List.of("command", "condition", "command", "approve"), details.getCells().stream()
                .map(NotebookCell::getCellType)
                .collect(Collectors.toList()));
        details.getCells().forEach(c -> assertEquals(NotebookCell.CellStatus.IDLE, c.getStatus()));
    }

    @Test
    void instantiateWithCustomTitle() {
        NotebookDetails details = templateService.instantiate("weekly-sales-report", "user-t", "Week 42");

        assertEquals("Week 42", details.getNotebook().getTitle());
        assertEquals(6, details.getCells().size());
    }

    @Test
    void unknownTemplateIsNotFound() {
        assertThrows(NotFoundException.class, () -> templateService.getTemplate("nope"));
    }
}
