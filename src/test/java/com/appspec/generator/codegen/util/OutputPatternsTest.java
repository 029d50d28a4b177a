package com.appspec.generator.codegen.util;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class OutputPatternsTest {

    @ParameterizedTest
    @CsvSource({
            "docs/*.md, docs/index.md, true",
            "docs/*.md, docs/entities/task.md, false",
            "docs/**, docs/entities/task.md, true",
            "docs/**/*.md, docs/index.md, true",
            "src/**/model/*.java, src/main/java/app/model/Task.java, true",
            "openapi/schemas/*.yaml, openapi/openapi.yaml, false",
            "file?.txt, file1.txt, true",
            "file?.txt, file10.txt, false",
            "a.b/*.txt, aXb/x.txt, false"
    })
    void testMatches(String pattern, String path, boolean expected) {
        assertThat(OutputPatterns.matches(pattern, path)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "docs/index.md, docs/index.md, true",
            "docs/**, docs/index.md, true",
            "docs/*.md, docs/entities/*.md, false",
            "docs/entities/*.md, docs/surfaces/*.md, false",
            "openapi/schemas/*.yaml, openapi/openapi.yaml, false",
            "src/*.java, src/*.kt, false",
            "src/Task*.java, src/*Dto.java, true",
            "src/**, src/main/*.java, true",
            "web/**, api/**, false"
    })
    void testMayOverlap(String a, String b, boolean expected) {
        assertThat(OutputPatterns.mayOverlap(a, b)).isEqualTo(expected);
        assertThat(OutputPatterns.mayOverlap(b, a)).isEqualTo(expected);
    }
}
