package me.christianrobert.retarget.translator.profile.catalog;

import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.CompareOperator;
import me.christianrobert.retarget.translator.profile.Builtin;
import me.christianrobert.retarget.translator.profile.BuiltinRule;
import me.christianrobert.retarget.translator.profile.ContainerSyntax;
import me.christianrobert.retarget.translator.profile.DictSyntax;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.RuntimeFeature;
import me.christianrobert.retarget.translator.profile.TargetLanguage;
import me.christianrobert.retarget.translator.profile.WrapperStrategy;

import java.util.List;

/**
 * JavaScript, TypeScript, PHP and Dart.
 */
public final class WebLanguageProfiles {

    private WebLanguageProfiles() {
    }

    public static List<LanguageProfile> profiles() {
        return List.of(javascript(), typescript(), php(), dart());
    }

    static LanguageProfile javascript() {
        return ecmaScript(TargetLanguage.JAVASCRIPT).build();
    }

    static LanguageProfile typescript() {
        return ecmaScript(TargetLanguage.TYPESCRIPT)
                .paramTemplate("{param}: any")
                .functionTemplate("function {name}({params}): any")
                .classFieldTemplate("{target}: any = {value};")
                .build();
    }

    private static LanguageProfile.Builder ecmaScript(TargetLanguage language) {
        return ProfilePresets.cStyle(language)
                .binaryOperator(BinaryOperator.POW, "**")
                .binaryOperator(BinaryOperator.FLOOR_DIV, "Math.floor({left} / {right})")
                .compareOperator(CompareOperator.EQ, "===")
                .compareOperator(CompareOperator.NOT_EQ, "!==")
                .compareOperator(CompareOperator.IS, "===")
                .compareOperator(CompareOperator.IS_NOT, "!==")
                .compareOperator(CompareOperator.IN, "{right}.includes({left})")
                .compareOperator(CompareOperator.NOT_IN, "!{right}.includes({left})")
                .builtin(Builtin.PRINT, BuiltinRule.call("console.log"))
                .builtin(Builtin.LEN, BuiltinRule.unary("{0}.length"))
                .builtin(Builtin.STR, BuiltinRule.call("String"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "Array.from({length: {stop}}, (_, i) => i)",
                        "Array.from({length: {stop} - {start}}, (_, i) => {start} + i)",
                        "Array.from({length: Math.ceil(({stop} - {start}) / {step})}, (_, i) => {start} + i * {step})"))
                .declarationTemplate("let {target} = {value}")
                .destructuringDeclarationTemplate("let [{names}] = {value}")
                .destructuringAssignmentTemplate("[{names}] = {value}")
                .forTemplate("for (let {var} of {iter})")
                .destructuringForTemplate("for (let [{names}] of {iter})");
    }

    static LanguageProfile php() {
        return ProfilePresets.cStyle(TargetLanguage.PHP)
                .wrapperStrategy(WrapperStrategy.SCRIPT_TAG)
                .prologue("<?php")
                .epilogue("?>")
                .importAnchor("<?php")
                .interpolationEscapes("$")
                .variableSigil("$")
                .selfReference("$this")
                .selfFieldPrefix("$this->")
                .selfMethodPrefix("$this->")
                .memberAccess("->")
                .binaryOperator(BinaryOperator.POW, "**")
                .binaryOperator(BinaryOperator.FLOOR_DIV, "intdiv({left}, {right})")
                .concatOperator(".")
                .compareOperator(CompareOperator.EQ, "===")
                .compareOperator(CompareOperator.NOT_EQ, "!==")
                .compareOperator(CompareOperator.IS, "===")
                .compareOperator(CompareOperator.IS_NOT, "!==")
                .compareOperator(CompareOperator.IN, "in_array({left}, {right})")
                .compareOperator(CompareOperator.NOT_IN, "!in_array({left}, {right})")
                .listSyntax(new ContainerSyntax("array(", ")"))
                .tupleSyntax(new ContainerSyntax("array(", ")"))
                .dictSyntax(new DictSyntax("array(", "{key} => {value}", ", ", ")"))
                .builtin(Builtin.PRINT, BuiltinRule.joined("echo ", " . \" \" . ", " . PHP_EOL"))
                .builtin(Builtin.LEN, BuiltinRule.call("count"))
                .builtin(Builtin.STR, BuiltinRule.call("strval"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "range(0, {stop} - 1)",
                        "range({start}, {stop} - 1)",
                        "range({start}, {stop} - 1, {step})",
                        "range({start}, {stop} + 1, {magnitude})"))
                .destructuringDeclarationTemplate("[{names}] = {value}")
                .destructuringAssignmentTemplate("[{names}] = {value}")
                .elseIfTemplate("elseif ({test})")
                .forTemplate("foreach ({iter} as {var})")
                .destructuringForTemplate("foreach ({iter} as [{names}])")
                .countedForTemplate(ProfilePresets.cStyleCountedFor(""))
                .countedForDownTemplate(ProfilePresets.cStyleCountedForDown(""))
                .classFieldTemplate("public {target} = {value};")
                .methodTemplate("public function {name}({params})")
                .constructorTemplate("public function __construct({params})")
                .build();
    }

    static LanguageProfile dart() {
        return ProfilePresets.cStyle(TargetLanguage.DART)
                .wrapperStrategy(WrapperStrategy.PACKAGE_MAIN_FUNC)
                .entryPointHeader("void main()")
                .interpolationEscapes("$")
                .binaryOperator(BinaryOperator.POW, "pow({left}, {right})")
                .binaryOperator(BinaryOperator.FLOOR_DIV, "~/")
                .compareOperator(CompareOperator.IS, "identical({left}, {right})")
                .compareOperator(CompareOperator.IS_NOT, "!identical({left}, {right})")
                .compareOperator(CompareOperator.IN, "{right}.contains({left})")
                .compareOperator(CompareOperator.NOT_IN, "!{right}.contains({left})")
                .builtin(Builtin.PRINT, BuiltinRule.call("print"))
                .builtin(Builtin.LEN, BuiltinRule.unary("{0}.length"))
                .builtin(Builtin.STR, BuiltinRule.unary("{0}.toString()"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "List.generate({stop}, (i) => i)",
                        "List.generate({stop} - {start}, (i) => {start} + i)",
                        "List.generate((({stop} - {start}) / {step}).ceil(), (i) => {start} + i * {step})"))
                .importLine(RuntimeFeature.POW, "import 'dart:math';")
                .declarationTemplate("var {target} = {value}")
                .destructuringDeclarationTemplate("var [{names}] = {value}")
                .destructuringAssignmentTemplate("[{names}] = {value}")
                .forTemplate("for (var {var} in {iter})")
                .destructuringForTemplate("for (var [{names}] in {iter})")
                .countedForTemplate(ProfilePresets.cStyleCountedFor("var "))
                .countedForDownTemplate(ProfilePresets.cStyleCountedForDown("var "))
                .functionTemplate("dynamic {name}({params})")
                .paramTemplate("dynamic {param}")
                .classFieldTemplate("var {target} = {value};")
                .methodTemplate("dynamic {name}({params})")
                .constructorTemplate("{class}({params})")
                .build();
    }
}
