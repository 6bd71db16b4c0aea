package me.christianrobert.retarget.translator.service;

import me.christianrobert.retarget.translator.ast.AugAssign;
import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.Program;
import me.christianrobert.retarget.translator.builder.program.ProgramEmitter;
import me.christianrobert.retarget.translator.context.EmissionResult;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.LanguageProfiles;
import me.christianrobert.retarget.translator.profile.RuntimeFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static me.christianrobert.retarget.translator.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

class ImportSynthesizerTest {

    private ImportSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        synthesizer = new ImportSynthesizer();
    }

    @Test
    void sharedLinesAppearOnce() {
        List<String> imports = synthesizer.requiredImports(LanguageProfiles.resolve("go"),
                EnumSet.of(RuntimeFeature.PRINT, RuntimeFeature.STR));

        assertEquals(List.of("import \"fmt\""), imports);
    }

    @Test
    void linesFollowFeatureOrder() {
        List<String> imports = synthesizer.requiredImports(LanguageProfiles.resolve("java"),
                EnumSet.of(RuntimeFeature.TUPLE, RuntimeFeature.LIST, RuntimeFeature.RANGE));

        assertEquals(List.of("import java.util.stream.IntStream;", "import java.util.List;"), imports);
    }

    @Test
    void featuresWithoutImportLinesAreSkipped() {
        assertTrue(synthesizer.requiredImports(LanguageProfiles.resolve("python"),
                EnumSet.allOf(RuntimeFeature.class)).isEmpty());
    }

    @Test
    void powerOperatorPullsInMathImport() {
        // Given
        Program program = program(print(binOp(name("x"), BinaryOperator.POW, num(2))));

        // When
        EmissionResult emission = ProgramEmitter.emit(program, "go");
        List<String> imports = synthesizer.requiredImports(LanguageProfiles.resolve("go"), emission.getUsedFeatures());

        // Then
        assertEquals(List.of("import \"fmt\"", "import \"math\""), imports);
    }

    @Test
    void augmentedPowerRecordsFeature() {
        Program program = program(assign("x", num(2)), new AugAssign(name("x"), BinaryOperator.POW, num(3)));

        EmissionResult emission = ProgramEmitter.emit(program, "cpp");

        assertTrue(emission.getCode().contains("x = std::pow(x, 3);"), emission.getCode());
        assertTrue(emission.getUsedFeatures().contains(RuntimeFeature.POW));
    }

    @Test
    void powerImportLinesPerTarget() {
        EnumSet<RuntimeFeature> pow = EnumSet.of(RuntimeFeature.POW);

        assertEquals(List.of("#include <math.h>"), synthesizer.requiredImports(LanguageProfiles.resolve("c"), pow));
        assertEquals(List.of("#include <cmath>"), synthesizer.requiredImports(LanguageProfiles.resolve("cpp"), pow));
        assertEquals(List.of("import Foundation"), synthesizer.requiredImports(LanguageProfiles.resolve("swift"), pow));
        assertEquals(List.of("import 'dart:math';"), synthesizer.requiredImports(LanguageProfiles.resolve("dart"), pow));
        assertTrue(synthesizer.requiredImports(LanguageProfiles.resolve("java"), pow).isEmpty());
    }

    @Test
    void insertsAfterAnchor() {
        // Given
        LanguageProfile go = LanguageProfiles.resolve("go");
        String code = "package main\n\nfunc main() {\n\tfmt.Println(1)\n}";

        // When
        String result = synthesizer.insertImports(code, go, List.of("import \"fmt\""));

        // Then
        assertEquals("package main\n\nimport \"fmt\"\n\nfunc main() {\n\tfmt.Println(1)\n}", result);
    }

    @Test
    void insertsAfterAnchorAtEndOfCode() {
        String result = synthesizer.insertImports("package main", LanguageProfiles.resolve("go"),
                List.of("import \"fmt\""));

        assertEquals("package main\n\nimport \"fmt\"", result);
    }

    @Test
    void prependsWithoutAnchor() {
        String code = "int main() {\n    std::cout << 1 << std::endl;\n}";

        String result = synthesizer.insertImports(code, LanguageProfiles.resolve("cpp"),
                List.of("#include <iostream>"));

        assertEquals("#include <iostream>\n\n" + code, result);
    }

    @Test
    void existingLinesAreNotRepeated() {
        String code = "using System;\n\npublic class Main {\n}";

        String result = synthesizer.insertImports(code, LanguageProfiles.resolve("csharp"),
                List.of("using System;", "using System.Linq;"));

        assertEquals("using System.Linq;\n\n" + code, result);
        assertEquals(code, synthesizer.insertImports(code, LanguageProfiles.resolve("csharp"), List.of("using System;")));
    }
}
