package com.tencent.hpcflow.infrastructure.resource;

import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.exception.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HostfileParserTest {

    @TempDir
    Path dir;

    @Test
    void testIgnoresBlankLinesAndComments() {
        String content = "# compute nodes\nnode01\n\n  node02  # rack b\nnode03:4\n";

        assertEquals(List.of("node01", "node02", "node03:4"), HostfileParser.parse(content));
        assertEquals("node03", HostfileParser.hostName("node03:4"));
    }

    @Test
    void testRejectsMultiColumnLines() {
        assertThrows(ParseException.class, () -> HostfileParser.parse("node01 slots=4\n"));
    }

    @Test
    void testMissingHostfile() {
        assertThrows(NotFoundException.class, () -> HostfileParser.read(dir.resolve("absent")));
    }
}
