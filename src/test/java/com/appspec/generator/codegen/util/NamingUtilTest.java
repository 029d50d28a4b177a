package com.appspec.generator.codegen.util;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NamingUtilTest {

    @ParameterizedTest
    @CsvSource({
            "task_list, TaskList",
            "task-list, TaskList",
            "taskList, TaskList",
            "TASK, Task"
    })
    void testToPascalCase(String input, String expected) {
        assertThat(NamingUtil.toPascalCase(input)).isEqualTo(expected);
    }

    @Test
    void testOtherCases() {
        assertThat(NamingUtil.toCamelCase("task_list")).isEqualTo("taskList");
        assertThat(NamingUtil.toKebabCase("TaskList")).isEqualTo("task-list");
        assertThat(NamingUtil.toKebabCase("task_board")).isEqualTo("task-board");
        assertThat(NamingUtil.toScreamingSnakeCase("taskList")).isEqualTo("TASK_LIST");
    }

    @ParameterizedTest
    @CsvSource({
            "Task, Tasks",
            "Category, Categories",
            "Day, Days",
            "Address, Addresses",
            "Box, Boxes",
            "Batch, Batches"
    })
    void testPluralize(String word, String plural) {
        assertThat(NamingUtil.pluralize(word)).isEqualTo(plural);
    }

    @Test
    void testNullAndEmptyPassThrough() {
        assertThat(NamingUtil.toPascalCase(null)).isNull();
        assertThat(NamingUtil.toKebabCase("")).isEmpty();
        assertThat(NamingUtil.pluralize(null)).isNull();
    }
}
