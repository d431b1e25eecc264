package org.pragmatica.purify.docker;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BaseImageTest {

    @Test
    void parse_fullReference_splitsParts() {
        var image = BaseImage.parse("--platform=linux/amd64 registry.example.com:5000/team/app:1.2@sha256:abc AS base")
                             .orElseThrow();

        assertEquals(List.of("--platform=linux/amd64"), image.flags());
        assertEquals(Optional.of("registry.example.com:5000"), image.registry());
        assertEquals("team/app", image.name());
        assertEquals(Optional.of("1.2"), image.tag());
        assertEquals(Optional.of("sha256:abc"), image.digest());
        assertEquals(Optional.of("base"), image.alias());
    }

    @Test
    void parse_dockerHubPath_hasNoRegistry() {
        var image = BaseImage.parse("library/ubuntu:22.04").orElseThrow();

        assertTrue(image.registry().isEmpty());
        assertEquals("library/ubuntu", image.name());
    }

    @Test
    void parse_flagsOnly_isEmpty() {
        assertTrue(BaseImage.parse("--platform=linux/arm64").isEmpty());
    }

    @Test
    void isUnpinned_missingOrLatestTag_true() {
        assertTrue(BaseImage.parse("ubuntu").orElseThrow().isUnpinned());
        assertTrue(BaseImage.parse("ubuntu:latest").orElseThrow().isUnpinned());
        assertFalse(BaseImage.parse("ubuntu:22.04").orElseThrow().isUnpinned());
        assertFalse(BaseImage.parse("ubuntu@sha256:abc").orElseThrow().isUnpinned());
    }

    @Test
    void isScratch_onlyForBareScratch() {
        assertTrue(BaseImage.parse("scratch").orElseThrow().isScratch());
        assertFalse(BaseImage.parse("localhost/scratch").orElseThrow().isScratch());
    }

    @Test
    void withTag_keepsFlagsAndAlias() {
        var image = BaseImage.parse("--platform=linux/amd64 node AS deps").orElseThrow();

        assertEquals("--platform=linux/amd64 node:20-alpine AS deps", image.withTag("20-alpine").toArguments());
    }

    @Test
    void of_nonFromInstruction_isEmpty() {
        var run = DockerfileParser.parse("RUN true\n").unwrap().instructions().findFirst().orElseThrow();

        assertTrue(BaseImage.of(run).isEmpty());
    }
}
