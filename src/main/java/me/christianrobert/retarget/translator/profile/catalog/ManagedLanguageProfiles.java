package me.christianrobert.retarget.translator.profile.catalog;

import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.CompareOperator;
import me.christianrobert.retarget.translator.ast.UnaryOperator;
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
 * Targets running on a managed runtime: Java, Kotlin, Scala and C#.
 *
 * <p>Java, Scala and C# cannot hold statements outside a type, so they use
 * {@link WrapperStrategy#SINGLE_CLASS_WITH_MAIN}; the wrapper name comes from the
 * {@code {program}} placeholder. Kotlin allows top-level functions and uses a
 * synthesized {@code main} instead.</p>
 */
public final class ManagedLanguageProfiles {

    private ManagedLanguageProfiles() {
    }

    public static List<LanguageProfile> profiles() {
        return List.of(java(), kotlin(), scala(), csharp());
    }

    static LanguageProfile java() {
        return ProfilePresets.cStyle(TargetLanguage.JAVA)
                .wrapperStrategy(WrapperStrategy.SINGLE_CLASS_WITH_MAIN)
                .wrapperTemplate("public class {program}")
                .entryPointHeader("public static void main(String[] args)")
                .binaryOperator(BinaryOperator.POW, "Math.pow({left}, {right})")
                .binaryOperator(BinaryOperator.FLOOR_DIV, "Math.floorDiv({left}, {right})")
                .compareOperator(CompareOperator.IN, "{right}.contains({left})")
                .compareOperator(CompareOperator.NOT_IN, "!{right}.contains({left})")
                .listSyntax(new ContainerSyntax("List.of(", ")"))
                .tupleSyntax(new ContainerSyntax("List.of(", ")"))
                .dictSyntax(new DictSyntax("new java.util.HashMap<>() {{ ", "put({key}, {value});", " ", " }}"))
                .builtin(Builtin.PRINT, BuiltinRule.joined("System.out.println(", " + \" \" + ", ")"))
                .builtin(Builtin.LEN, BuiltinRule.unary("{0}.size()"))
                .builtin(Builtin.STR, BuiltinRule.call("String.valueOf"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "IntStream.range(0, {stop}).toArray()",
                        "IntStream.range({start}, {stop}).toArray()",
                        "IntStream.iterate({start}, i -> i < {stop}, i -> i + {step}).toArray()",
                        "IntStream.iterate({start}, i -> i > {stop}, i -> i + {step}).toArray()"))
                .importLine(RuntimeFeature.RANGE, "import java.util.stream.IntStream;")
                .importLine(RuntimeFeature.LIST, "import java.util.List;")
                .importLine(RuntimeFeature.TUPLE, "import java.util.List;")
                .declarationTemplate("var {target} = {value}")
                .forTemplate("for (var {var} : {iter})")
                .countedForTemplate(ProfilePresets.cStyleCountedFor("int "))
                .countedForDownTemplate(ProfilePresets.cStyleCountedForDown("int "))
                .functionTemplate("public static Object {name}({params})")
                .paramTemplate("Object {param}")
                .classTemplate("static class {name}")
                .classFieldTemplate("public Object {target} = {value};")
                .methodTemplate("public Object {name}({params})")
                .constructorTemplate("public {class}({params})")
                .build();
    }

    static LanguageProfile kotlin() {
        return ProfilePresets.cStyle(TargetLanguage.KOTLIN)
                .terminator("")
                .wrapperStrategy(WrapperStrategy.PACKAGE_MAIN_FUNC)
                .entryPointHeader("fun main()")
                .interpolationEscapes("$")
                .binaryOperator(BinaryOperator.POW, "Math.pow({left}, {right})")
                .binaryOperator(BinaryOperator.LSHIFT, "shl")
                .binaryOperator(BinaryOperator.RSHIFT, "shr")
                .binaryOperator(BinaryOperator.BIT_OR, "or")
                .binaryOperator(BinaryOperator.BIT_XOR, "xor")
                .binaryOperator(BinaryOperator.BIT_AND, "and")
                .compareOperator(CompareOperator.IS, "===")
                .compareOperator(CompareOperator.IS_NOT, "!==")
                .compareOperator(CompareOperator.IN, "in")
                .compareOperator(CompareOperator.NOT_IN, "!in")
                .unaryOperator(UnaryOperator.INVERT, "{operand}.inv()")
                .conditionalTemplate("if ({test}) {body} else {orelse}")
                .listSyntax(new ContainerSyntax("listOf(", ")"))
                .tupleSyntax(new ContainerSyntax("listOf(", ")"))
                .dictSyntax(new DictSyntax("mutableMapOf(", "{key} to {value}", ", ", ")"))
                .builtin(Builtin.PRINT, BuiltinRule.call("println"))
                .builtin(Builtin.LEN, BuiltinRule.unary("{0}.size"))
                .builtin(Builtin.STR, BuiltinRule.unary("{0}.toString()"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "0 until {stop}",
                        "{start} until {stop}",
                        "{start} until {stop} step {step}",
                        "{start} downTo {stop} + 1 step {magnitude}"))
                .declarationTemplate("var {target} = {value}")
                .destructuringDeclarationTemplate("var ({names}) = {value}")
                .forTemplate("for ({var} in {iter})")
                .destructuringForTemplate("for (({names}) in {iter})")
                .functionTemplate("fun {name}({params}): Any?")
                .paramTemplate("{param}: Any?")
                .baseClauseTemplate(" : {bases}")
                .baseItemTemplate("{base}()")
                .classFieldTemplate("var {target}: Any? = {value}")
                .methodTemplate("fun {name}({params}): Any?")
                .constructorTemplate("constructor({params})")
                .build();
    }

    static LanguageProfile scala() {
        return ProfilePresets.cStyle(TargetLanguage.SCALA)
                .terminator("")
                .indentUnit("  ")
                .wrapperStrategy(WrapperStrategy.SINGLE_CLASS_WITH_MAIN)
                .wrapperTemplate("object {program}")
                .entryPointHeader("def main(args: Array[String]): Unit =")
                .binaryOperator(BinaryOperator.POW, "math.pow({left}, {right})")
                .compareOperator(CompareOperator.IS, "eq")
                .compareOperator(CompareOperator.IS_NOT, "ne")
                .compareOperator(CompareOperator.IN, "{right}.contains({left})")
                .compareOperator(CompareOperator.NOT_IN, "!{right}.contains({left})")
                .conditionalTemplate("if ({test}) {body} else {orelse}")
                .listSyntax(new ContainerSyntax("List(", ")"))
                .tupleSyntax(new ContainerSyntax("(", ")"))
                .dictSyntax(new DictSyntax("Map(", "{key} -> {value}", ", ", ")"))
                .builtin(Builtin.PRINT, BuiltinRule.call("println"))
                .builtin(Builtin.LEN, BuiltinRule.unary("{0}.length"))
                .builtin(Builtin.STR, BuiltinRule.unary("{0}.toString"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "0 until {stop}",
                        "{start} until {stop}",
                        "{start} until {stop} by {step}"))
                .declarationTemplate("var {target} = {value}")
                .destructuringDeclarationTemplate("var ({names}) = {value}")
                .forTemplate("for ({var} <- {iter})")
                .destructuringForTemplate("for (({names}) <- {iter})")
                .functionTemplate("def {name}({params}): Any =")
                .paramTemplate("{param}: Any")
                .classFieldTemplate("var {target}: Any = {value}")
                .methodTemplate("def {name}({params}): Any =")
                .constructorTemplate("def this({params})")
                .build();
    }

    static LanguageProfile csharp() {
        return ProfilePresets.cStyle(TargetLanguage.CSHARP)
                .wrapperStrategy(WrapperStrategy.SINGLE_CLASS_WITH_MAIN)
                .wrapperTemplate("public class {program}")
                .entryPointHeader("public static void Main(string[] args)")
                .binaryOperator(BinaryOperator.POW, "Math.Pow({left}, {right})")
                .compareOperator(CompareOperator.IN, "{right}.Contains({left})")
                .compareOperator(CompareOperator.NOT_IN, "!{right}.Contains({left})")
                .listSyntax(new ContainerSyntax("new List<object> { ", " }"))
                .tupleSyntax(new ContainerSyntax("(", ")"))
                .dictSyntax(new DictSyntax("new Dictionary<object, object> { ", "{ {key}, {value} }", ", ", " }"))
                .builtin(Builtin.PRINT, BuiltinRule.joined("Console.WriteLine(", " + \" \" + ", ")"))
                .builtin(Builtin.LEN, BuiltinRule.unary("{0}.Length"))
                .builtin(Builtin.STR, BuiltinRule.unary("{0}.ToString()"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "Enumerable.Range(0, {stop})",
                        "Enumerable.Range({start}, {stop} - {start})",
                        "Enumerable.Range(0, ({stop} - {start} + {step} - 1) / {step}).Select(i => {start} + i * {step})",
                        "Enumerable.Range(0, ({start} - {stop} + {magnitude} - 1) / {magnitude}).Select(i => {start} - i * {magnitude})"))
                .importLine(RuntimeFeature.PRINT, "using System;")
                .importLine(RuntimeFeature.RANGE, "using System.Linq;")
                .importLine(RuntimeFeature.POW, "using System;")
                .importLine(RuntimeFeature.LIST, "using System.Collections.Generic;")
                .importLine(RuntimeFeature.DICT, "using System.Collections.Generic;")
                .declarationTemplate("var {target} = {value}")
                .destructuringDeclarationTemplate("var ({names}) = {value}")
                .destructuringAssignmentTemplate("({names}) = {value}")
                .forTemplate("foreach (var {var} in {iter})")
                .destructuringForTemplate("foreach (var ({names}) in {iter})")
                .countedForTemplate(ProfilePresets.cStyleCountedFor("var "))
                .countedForDownTemplate(ProfilePresets.cStyleCountedForDown("var "))
                .functionTemplate("public static object {name}({params})")
                .paramTemplate("object {param}")
                .classTemplate("public class {name}")
                .baseClauseTemplate(" : {bases}")
                .classFieldTemplate("public object {target} = {value};")
                .methodTemplate("public object {name}({params})")
                .constructorTemplate("public {class}({params})")
                .build();
    }
}
