/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.extract.core.treesitter;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LanguageDetectorTest {

    @Test
    void detectsByExtension() {
        assertEquals(Optional.of("javascript"), LanguageDetector.detect(Path.of("a.js")));
        assertEquals(Optional.of("javascript"), LanguageDetector.detect(Path.of("a.MJS")));
        assertEquals(Optional.of("typescript"), LanguageDetector.detect(Path.of("dir/a.ts")));
        assertEquals(Optional.of("tsx"), LanguageDetector.detect(Path.of("a.tsx")));
        assertEquals(Optional.empty(), LanguageDetector.detect(Path.of("a.java")));
        assertEquals(Optional.empty(), LanguageDetector.detect(Path.of("Makefile")));
    }

    @Test
    void detectsByShebang() {
        assertEquals(Optional.of("typescript"),
                LanguageDetector.detect(Path.of("tool"), "#!/usr/bin/env ts-node\nlet a = 1;"));
        assertEquals(Optional.of("javascript"),
                LanguageDetector.detect(Path.of("tool"), "#!/usr/bin/env node\nlet a = 1;"));
        assertEquals(Optional.empty(), LanguageDetector.detect(Path.of("tool"), "#!/bin/sh\n"));
    }

    @Test
    void accessModifiersOnlyForTypescript() {
        assertTrue(LanguageDetector.supportsAccessModifiers("typescript"));
        assertTrue(LanguageDetector.supportsAccessModifiers("tsx"));
        assertFalse(LanguageDetector.supportsAccessModifiers("javascript"));
        assertEquals(List.of("javascript", "typescript", "tsx"), LanguageDetector.getSupportedLanguages());
    }
}
