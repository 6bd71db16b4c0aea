package me.christianrobert.retarget.translator.profile.catalog;

import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.CompareOperator;
import me.christianrobert.retarget.translator.ast.UnaryOperator;
import me.christianrobert.retarget.translator.profile.BlockStyle;
import me.christianrobert.retarget.translator.profile.ClassLayout;
import me.christianrobert.retarget.translator.profile.ContainerSyntax;
import me.christianrobert.retarget.translator.profile.DictSyntax;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.StringLiteralStyle;
import me.christianrobert.retarget.translator.profile.TargetLanguage;
import me.christianrobert.retarget.translator.profile.WrapperStrategy;

/**
 * Shared starting point for catalog entries.
 *
 * <p>{@link #cStyle(TargetLanguage)} fills every field with the C-family spelling
 * (braces, semicolons, {@code this.}, {@code &&}), except the builtin table, which each
 * catalog entry must supply itself. Entries then override what differs.</p>
 */
final class ProfilePresets {

    private ProfilePresets() {
    }

    static LanguageProfile.Builder cStyle(TargetLanguage language) {
        return LanguageProfile.builder(language)
                // layout
                .blockStyle(BlockStyle.BRACE)
                .indentUnit("    ")
                .terminator(";")
                .wrapperStrategy(WrapperStrategy.NONE)
                .prologue("")
                .epilogue("")
                .wrapperTemplate("")
                .entryPointHeader("")
                .importAnchor("")
                // literals
                .trueLiteral("true")
                .falseLiteral("false")
                .nullLiteral("null")
                .stringStyle(StringLiteralStyle.DOUBLE_QUOTED)
                .interpolationEscapes("")
                .keepDocstrings(false)
                // names
                .variableSigil("")
                .selfReference("this")
                .selfFieldPrefix("this.")
                .selfFieldSuffix("")
                .selfMethodPrefix("this.")
                .memberAccess(".")
                .subscriptTemplate("{value}[{index}]")
                // operators
                .binaryOperator(BinaryOperator.ADD, "+")
                .binaryOperator(BinaryOperator.SUB, "-")
                .binaryOperator(BinaryOperator.MULT, "*")
                .binaryOperator(BinaryOperator.DIV, "/")
                .binaryOperator(BinaryOperator.MOD, "%")
                .binaryOperator(BinaryOperator.POW, "")
                .binaryOperator(BinaryOperator.FLOOR_DIV, "/")
                .binaryOperator(BinaryOperator.MAT_MULT, "")
                .binaryOperator(BinaryOperator.LSHIFT, "<<")
                .binaryOperator(BinaryOperator.RSHIFT, ">>")
                .binaryOperator(BinaryOperator.BIT_OR, "|")
                .binaryOperator(BinaryOperator.BIT_XOR, "^")
                .binaryOperator(BinaryOperator.BIT_AND, "&")
                .concatOperator("+")
                .compareOperator(CompareOperator.EQ, "==")
                .compareOperator(CompareOperator.NOT_EQ, "!=")
                .compareOperator(CompareOperator.LT, "<")
                .compareOperator(CompareOperator.LT_E, "<=")
                .compareOperator(CompareOperator.GT, ">")
                .compareOperator(CompareOperator.GT_E, ">=")
                .compareOperator(CompareOperator.IS, "==")
                .compareOperator(CompareOperator.IS_NOT, "!=")
                .compareOperator(CompareOperator.IN, "")
                .compareOperator(CompareOperator.NOT_IN, "")
                .unaryOperator(UnaryOperator.NOT, "!")
                .unaryOperator(UnaryOperator.USUB, "-")
                .unaryOperator(UnaryOperator.UADD, "+")
                .unaryOperator(UnaryOperator.INVERT, "~")
                .andOperator("&&")
                .orOperator("||")
                .conditionalTemplate("{test} ? {body} : {orelse}")
                .compoundAssignment(true)
                // containers
                .listSyntax(new ContainerSyntax("[", "]"))
                .tupleSyntax(new ContainerSyntax("[", "]"))
                .dictSyntax(new DictSyntax("{", "{key}: {value}", ", ", "}"))
                // assignment
                .declarationTemplate("{target} = {value}")
                .assignmentTemplate("{target} = {value}")
                .classFieldTemplate("{target} = {value};")
                // statements
                .ifTemplate("if ({test})")
                .elseIfTemplate("else if ({test})")
                .elseKeyword("else")
                .whileTemplate("while ({test})")
                .forTemplate("")
                .countedForTemplate("")
                .countedForDownTemplate("")
                .destructuringDeclarationTemplate("")
                .destructuringAssignmentTemplate("")
                .destructuringForTemplate("")
                .returnTemplate("return {value}")
                .bareReturn("return")
                .breakKeyword("break")
                .continueKeyword("continue")
                .continueLabel("")
                .noOpKeyword("")
                // functions
                .functionTemplate("function {name}({params})")
                .paramTemplate("{param}")
                .paramBindingTemplate("")
                .selfParameter("")
                // classes
                .classLayout(ClassLayout.NESTED)
                .classTemplate("class {name}")
                .baseItemTemplate("{base}")
                .baseClauseTemplate(" extends {bases}")
                .singleInheritance(true)
                .classBodyPreamble("")
                .classTerminator("")
                .methodTemplate("{name}({params})")
                .constructorTemplate("constructor({params})")
                .constructorTakesSelf(true)
                .structBlock(true)
                .implTemplate("");
    }

    static String cStyleCountedFor(String declaration) {
        return "for (" + declaration + "{var} = {start}; {var} < {stop}; {var} += {step})";
    }

    static String cStyleCountedForDown(String declaration) {
        return "for (" + declaration + "{var} = {start}; {var} > {stop}; {var} += {step})";
    }
}
