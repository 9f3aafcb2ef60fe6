package me.golemcore.todo.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskCategoryTest {

    @Test
    void fromLabel_matchesLabelOrNameIgnoringCase() {
        assertEquals(TaskCategory.WORK, TaskCategory.fromLabel("Work").orElseThrow());
        assertEquals(TaskCategory.SCHOOL, TaskCategory.fromLabel("  school ").orElseThrow());
        assertEquals(TaskCategory.PERSONAL, TaskCategory.fromLabel("PERSONAL").orElseThrow());
    }

    @Test
    void fromLabel_emptyForUnknownOrBlank() {
        assertTrue(TaskCategory.fromLabel("Hobby").isEmpty());
        assertTrue(TaskCategory.fromLabel(" ").isEmpty());
        assertTrue(TaskCategory.fromLabel(null).isEmpty());
    }

    @Test
    void defaultCategory_isFirstConstant() {
        assertEquals(TaskCategory.values()[0], TaskCategory.defaultCategory());
        assertEquals(List.of("General", "School", "Work", "Personal"), TaskCategory.labels());
    }
}
