package me.christianrobert.retarget.translator.profile.catalog;

import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.CompareOperator;
import me.christianrobert.retarget.translator.ast.UnaryOperator;
import me.christianrobert.retarget.translator.profile.Builtin;
import me.christianrobert.retarget.translator.profile.BuiltinRule;
import me.christianrobert.retarget.translator.profile.ClassLayout;
import me.christianrobert.retarget.translator.profile.ContainerSyntax;
import me.christianrobert.retarget.translator.profile.DictSyntax;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.RuntimeFeature;
import me.christianrobert.retarget.translator.profile.TargetLanguage;
import me.christianrobert.retarget.translator.profile.WrapperStrategy;

import java.util.List;

/**
 * Natively compiled targets: C, C++, Go, Rust and Swift.
 *
 * <p>C, Go and Rust have no classes; they use {@link ClassLayout#DETACHED} with a struct
 * for the fields and functions bound to it. All but Swift need a synthesized entry point.</p>
 */
public final class NativeLanguageProfiles {

    private NativeLanguageProfiles() {
    }

    public static List<LanguageProfile> profiles() {
        return List.of(c(), cpp(), go(), rust(), swift());
    }

    static LanguageProfile c() {
        return ProfilePresets.cStyle(TargetLanguage.C)
                .wrapperStrategy(WrapperStrategy.PACKAGE_MAIN_FUNC)
                .entryPointHeader("int main(void)")
                .trueLiteral("1")
                .falseLiteral("0")
                .nullLiteral("NULL")
                .selfReference("self")
                .selfFieldPrefix("self->")
                .selfMethodPrefix("self->")
                .memberAccess(".")
                .binaryOperator(BinaryOperator.POW, "pow({left}, {right})")
                .listSyntax(new ContainerSyntax("{", "}"))
                .tupleSyntax(new ContainerSyntax("{", "}"))
                .dictSyntax(DictSyntax.UNSUPPORTED)
                .builtin(Builtin.PRINT, BuiltinRule.formatMacro("printf", "%s", "\\n"))
                .builtin(Builtin.LEN, BuiltinRule.unary("sizeof({0}) / sizeof({0}[0])"))
                .builtin(Builtin.STR, BuiltinRule.call("str"))
                .builtin(Builtin.RANGE, BuiltinRule.call("range"))
                .importLine(RuntimeFeature.PRINT, "#include <stdio.h>")
                .importLine(RuntimeFeature.POW, "#include <math.h>")
                .declarationTemplate("auto {target} = {value}")
                .countedForTemplate(ProfilePresets.cStyleCountedFor("int "))
                .countedForDownTemplate(ProfilePresets.cStyleCountedForDown("int "))
                .functionTemplate("int {name}({params})")
                .paramTemplate("int {param}")
                .classLayout(ClassLayout.DETACHED)
                .classTemplate("struct {name}")
                .classTerminator(";")
                .classFieldTemplate("int {target};")
                .methodTemplate("int {class}_{name}({params})")
                .constructorTemplate("struct {class} *{class}_new({params})")
                .constructorTakesSelf(false)
                .selfParameter("struct {class} *self")
                .build();
    }

    static LanguageProfile cpp() {
        return ProfilePresets.cStyle(TargetLanguage.CPP)
                .wrapperStrategy(WrapperStrategy.PACKAGE_MAIN_FUNC)
                .entryPointHeader("int main()")
                .nullLiteral("nullptr")
                .selfFieldPrefix("this->")
                .selfMethodPrefix("this->")
                .binaryOperator(BinaryOperator.POW, "std::pow({left}, {right})")
                .listSyntax(new ContainerSyntax("std::vector<int>{", "}"))
                .tupleSyntax(new ContainerSyntax("std::make_tuple(", ")"))
                .dictSyntax(new DictSyntax("std::map<std::string, int>{", "{{key}, {value}}", ", ", "}"))
                .builtin(Builtin.PRINT, BuiltinRule.joined("std::cout << ", " << \" \" << ", " << std::endl"))
                .builtin(Builtin.LEN, BuiltinRule.unary("{0}.size()"))
                .builtin(Builtin.STR, BuiltinRule.call("std::to_string"))
                .builtin(Builtin.RANGE, BuiltinRule.call("range"))
                .importLine(RuntimeFeature.PRINT, "#include <iostream>")
                .importLine(RuntimeFeature.STR, "#include <string>")
                .importLine(RuntimeFeature.LIST, "#include <vector>")
                .importLine(RuntimeFeature.TUPLE, "#include <tuple>")
                .importLine(RuntimeFeature.DICT, "#include <map>")
                .importLine(RuntimeFeature.POW, "#include <cmath>")
                .declarationTemplate("auto {target} = {value}")
                .destructuringDeclarationTemplate("auto [{names}] = {value}")
                .destructuringAssignmentTemplate("std::tie({names}) = {value}")
                .forTemplate("for (auto {var} : {iter})")
                .destructuringForTemplate("for (auto [{names}] : {iter})")
                .countedForTemplate(ProfilePresets.cStyleCountedFor("int "))
                .countedForDownTemplate(ProfilePresets.cStyleCountedForDown("int "))
                .functionTemplate("auto {name}({params})")
                .paramTemplate("auto {param}")
                .baseClauseTemplate(" : {bases}")
                .baseItemTemplate("public {base}")
                .singleInheritance(false)
                .classBodyPreamble("public:")
                .classTerminator(";")
                .classFieldTemplate("int {target} = {value};")
                .methodTemplate("auto {name}({params})")
                .constructorTemplate("{class}({params})")
                .build();
    }

    static LanguageProfile go() {
        return ProfilePresets.cStyle(TargetLanguage.GO)
                .terminator("")
                .indentUnit("\t")
                .wrapperStrategy(WrapperStrategy.PACKAGE_MAIN_FUNC)
                .prologue("package main")
                .entryPointHeader("func main()")
                .importAnchor("package main")
                .nullLiteral("nil")
                .selfReference("self")
                .selfFieldPrefix("self.")
                .selfMethodPrefix("self.")
                .binaryOperator(BinaryOperator.POW, "math.Pow({left}, {right})")
                .unaryOperator(UnaryOperator.INVERT, "^")
                .conditionalTemplate("")
                .listSyntax(new ContainerSyntax("[]interface{}{", "}"))
                .tupleSyntax(new ContainerSyntax("[]interface{}{", "}"))
                .dictSyntax(new DictSyntax("map[interface{}]interface{}{", "{key}: {value}", ", ", "}"))
                .builtin(Builtin.PRINT, BuiltinRule.call("fmt.Println"))
                .builtin(Builtin.LEN, BuiltinRule.call("len"))
                .builtin(Builtin.STR, BuiltinRule.call("fmt.Sprint"))
                .builtin(Builtin.RANGE, BuiltinRule.call("range"))
                .importLine(RuntimeFeature.PRINT, "import \"fmt\"")
                .importLine(RuntimeFeature.STR, "import \"fmt\"")
                .importLine(RuntimeFeature.POW, "import \"math\"")
                .declarationTemplate("{target} := {value}")
                .destructuringDeclarationTemplate("{names} := {values}")
                .destructuringAssignmentTemplate("{names} = {values}")
                .ifTemplate("if {test}")
                .elseIfTemplate("else if {test}")
                .whileTemplate("for {test}")
                .forTemplate("for _, {var} := range {iter}")
                .destructuringForTemplate("for {names} := range {iter}")
                .countedForTemplate("for {var} := {start}; {var} < {stop}; {var} += {step}")
                .countedForDownTemplate("for {var} := {start}; {var} > {stop}; {var} += {step}")
                .functionTemplate("func {name}({params})")
                .paramTemplate("{param} interface{}")
                .classLayout(ClassLayout.DETACHED)
                .classTemplate("type {name} struct")
                .classFieldTemplate("{target} interface{}")
                .methodTemplate("func (self *{class}) {name}({params})")
                .constructorTemplate("func New{class}({params}) *{class}")
                .constructorTakesSelf(false)
                .build();
    }

    static LanguageProfile rust() {
        return ProfilePresets.cStyle(TargetLanguage.RUST)
                .wrapperStrategy(WrapperStrategy.PACKAGE_MAIN_FUNC)
                .entryPointHeader("fn main()")
                .nullLiteral("None")
                .selfReference("self")
                .selfFieldPrefix("self.")
                .selfMethodPrefix("self.")
                .binaryOperator(BinaryOperator.POW, "{left}.pow({right})")
                .concatOperator("format!(\"{}{}\", {left}, {right})")
                .compareOperator(CompareOperator.IN, "{right}.contains(&{left})")
                .compareOperator(CompareOperator.NOT_IN, "!{right}.contains(&{left})")
                .unaryOperator(UnaryOperator.INVERT, "!")
                .conditionalTemplate("if {test} { {body} } else { {orelse} }")
                .listSyntax(new ContainerSyntax("vec![", "]"))
                .tupleSyntax(new ContainerSyntax("(", ")", true))
                .dictSyntax(new DictSyntax("HashMap::from([", "({key}, {value})", ", ", "])"))
                .builtin(Builtin.PRINT, BuiltinRule.formatMacro("println!", "{}", ""))
                .builtin(Builtin.LEN, BuiltinRule.unary("{0}.len()"))
                .builtin(Builtin.STR, BuiltinRule.unary("{0}.to_string()"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "0..{stop}",
                        "{start}..{stop}",
                        "({start}..{stop}).step_by({step})",
                        "(({stop} + 1)..={start}).rev().step_by({magnitude})"))
                .importLine(RuntimeFeature.DICT, "use std::collections::HashMap;")
                .declarationTemplate("let mut {target} = {value}")
                .destructuringDeclarationTemplate("let mut ({names}) = {value}")
                .destructuringAssignmentTemplate("({names}) = {value}")
                .ifTemplate("if {test}")
                .elseIfTemplate("else if {test}")
                .whileTemplate("while {test}")
                .forTemplate("for {var} in {iter}")
                .destructuringForTemplate("for ({names}) in {iter}")
                .functionTemplate("fn {name}({params})")
                .paramTemplate("{param}: i64")
                .classLayout(ClassLayout.DETACHED)
                .classTemplate("struct {name}")
                .classFieldTemplate("{target}: i64,")
                .implTemplate("impl {class}")
                .methodTemplate("fn {name}({params})")
                .constructorTemplate("fn new({params}) -> Self")
                .constructorTakesSelf(false)
                .selfParameter("&mut self")
                .build();
    }

    static LanguageProfile swift() {
        return ProfilePresets.cStyle(TargetLanguage.SWIFT)
                .terminator("")
                .nullLiteral("nil")
                .selfReference("self")
                .selfFieldPrefix("self.")
                .selfMethodPrefix("self.")
                .binaryOperator(BinaryOperator.POW, "pow({left}, {right})")
                .compareOperator(CompareOperator.IS, "===")
                .compareOperator(CompareOperator.IS_NOT, "!==")
                .compareOperator(CompareOperator.IN, "{right}.contains({left})")
                .compareOperator(CompareOperator.NOT_IN, "!{right}.contains({left})")
                .tupleSyntax(new ContainerSyntax("(", ")"))
                .dictSyntax(new DictSyntax("[", "{key}: {value}", ", ", "]"))
                .builtin(Builtin.PRINT, BuiltinRule.call("print"))
                .builtin(Builtin.LEN, BuiltinRule.unary("{0}.count"))
                .builtin(Builtin.STR, BuiltinRule.call("String"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "0..<{stop}",
                        "{start}..<{stop}",
                        "stride(from: {start}, to: {stop}, by: {step})"))
                .importLine(RuntimeFeature.POW, "import Foundation")
                .declarationTemplate("var {target} = {value}")
                .destructuringDeclarationTemplate("var ({names}) = {value}")
                .destructuringAssignmentTemplate("({names}) = {value}")
                .ifTemplate("if {test}")
                .elseIfTemplate("else if {test}")
                .whileTemplate("while {test}")
                .forTemplate("for {var} in {iter}")
                .destructuringForTemplate("for ({names}) in {iter}")
                .functionTemplate("func {name}({params}) -> Any?")
                .paramTemplate("_ {param}: Any")
                .baseClauseTemplate(" : {bases}")
                .singleInheritance(false)
                .classFieldTemplate("var {target}: Any = {value}")
                .methodTemplate("func {name}({params}) -> Any?")
                .constructorTemplate("init({params})")
                .build();
    }
}
