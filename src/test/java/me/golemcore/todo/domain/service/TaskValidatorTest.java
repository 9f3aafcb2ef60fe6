package me.golemcore.todo.domain.service;

import me.golemcore.todo.domain.model.TaskCategory;
import me.golemcore.todo.domain.model.TaskDraft;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskValidatorTest {

    private final TaskValidator validator = new TaskValidator();

    @Test
    void validate_trimsFields() {
        TaskDraft draft = validator.validate(TaskDraft.of("  Read book ", " chapter 3 ", " 21-10-2026 "));

        assertEquals("Read book", draft.title());
        assertEquals("chapter 3", draft.description());
        assertEquals("21-10-2026", draft.deadline());
        assertNull(draft.category());
    }

    @Test
    void validate_nullDescriptionBecomesEmpty() {
        assertEquals("", validator.validate(TaskDraft.of("Read", null, "21-10-2026")).description());
    }

    @Test
    void validate_rejectsBlankTitle() {
        TaskValidationException e = assertThrows(TaskValidationException.class,
                () -> validator.validate(TaskDraft.of("   ", "", "21-10-2026")));
        assertTrue(e.getMessage().contains("Title"));
    }

    @Test
    void validate_rejectsMissingDeadline() {
        TaskValidationException e = assertThrows(TaskValidationException.class,
                () -> validator.validate(TaskDraft.of("Read", "", null)));
        assertTrue(e.getMessage().contains("Deadline"));
    }

    @Test
    void validate_rejectsUnparseableDeadline() {
        TaskValidationException e = assertThrows(TaskValidationException.class,
                () -> validator.validate(TaskDraft.of("Read", "", "2026-10-21")));
        assertTrue(e.getMessage().contains("DD-MM-YYYY"));

        assertThrows(TaskValidationException.class,
                () -> validator.validate(TaskDraft.of("Read", "", "30-02-2026")));
    }

    @Test
    void validate_rejectsNullDraft() {
        assertThrows(TaskValidationException.class, () -> validator.validate(null));
    }

    @Test
    void validate_resolvesCategoryByName() {
        TaskDraft draft = validator.validate("Essay", "", "21-10-2026", "school");

        assertEquals(TaskCategory.SCHOOL, draft.category());
    }

    @Test
    void validate_blankCategoryMeansNone() {
        assertNull(validator.validate("Essay", "", "21-10-2026", " ").category());
    }

    @Test
    void validate_rejectsUnknownCategory() {
        TaskValidationException e = assertThrows(TaskValidationException.class,
                () -> validator.validate("Essay", "", "21-10-2026", "Hobby"));
        assertTrue(e.getMessage().contains("General, School, Work, Personal"));
    }
}
