package me.christianrobert.retarget.translator.profile.catalog;

import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.CompareOperator;
import me.christianrobert.retarget.translator.ast.UnaryOperator;
import me.christianrobert.retarget.translator.profile.BlockStyle;
import me.christianrobert.retarget.translator.profile.Builtin;
import me.christianrobert.retarget.translator.profile.BuiltinRule;
import me.christianrobert.retarget.translator.profile.ClassLayout;
import me.christianrobert.retarget.translator.profile.ContainerSyntax;
import me.christianrobert.retarget.translator.profile.DictSyntax;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.StringLiteralStyle;
import me.christianrobert.retarget.translator.profile.TargetLanguage;

import java.util.List;

/**
 * Dynamically typed scripting targets: Python, Ruby, Perl, Lua, R, PowerShell and Julia.
 */
public final class ScriptingLanguageProfiles {

    private ScriptingLanguageProfiles() {
    }

    public static List<LanguageProfile> profiles() {
        return List.of(python(), ruby(), perl(), lua(), r(), powershell(), julia());
    }

    /**
     * Identity target, useful for normalizing a tree back to source.
     */
    static LanguageProfile python() {
        return ProfilePresets.cStyle(TargetLanguage.PYTHON)
                .blockStyle(BlockStyle.INDENT)
                .terminator("")
                .trueLiteral("True")
                .falseLiteral("False")
                .nullLiteral("None")
                .keepDocstrings(true)
                .selfReference("self")
                .selfFieldPrefix("self.")
                .selfMethodPrefix("self.")
                .binaryOperator(BinaryOperator.POW, "**")
                .binaryOperator(BinaryOperator.FLOOR_DIV, "//")
                .binaryOperator(BinaryOperator.MAT_MULT, "@")
                .compareOperator(CompareOperator.IS, "is")
                .compareOperator(CompareOperator.IS_NOT, "is not")
                .compareOperator(CompareOperator.IN, "in")
                .compareOperator(CompareOperator.NOT_IN, "not in")
                .unaryOperator(UnaryOperator.NOT, "not ")
                .andOperator("and")
                .orOperator("or")
                .conditionalTemplate("{body} if {test} else {orelse}")
                .tupleSyntax(new ContainerSyntax("(", ")", true))
                .builtin(Builtin.PRINT, BuiltinRule.call("print"))
                .builtin(Builtin.LEN, BuiltinRule.call("len"))
                .builtin(Builtin.STR, BuiltinRule.call("str"))
                .builtin(Builtin.RANGE, BuiltinRule.call("range"))
                .classFieldTemplate("{target} = {value}")
                .destructuringDeclarationTemplate("{names} = {values}")
                .destructuringAssignmentTemplate("{names} = {values}")
                .ifTemplate("if {test}")
                .elseIfTemplate("elif {test}")
                .whileTemplate("while {test}")
                .forTemplate("for {var} in {iter}")
                .destructuringForTemplate("for {names} in {iter}")
                .noOpKeyword("pass")
                .functionTemplate("def {name}({params})")
                .selfParameter("self")
                .baseClauseTemplate("({bases})")
                .singleInheritance(false)
                .methodTemplate("def {name}({params})")
                .constructorTemplate("def __init__({params})")
                .build();
    }

    static LanguageProfile ruby() {
        return ProfilePresets.cStyle(TargetLanguage.RUBY)
                .blockStyle(BlockStyle.END_KEYWORD)
                .indentUnit("  ")
                .terminator("")
                .nullLiteral("nil")
                .interpolationEscapes("#")
                .selfReference("self")
                .selfFieldPrefix("@")
                .selfMethodPrefix("self.")
                .binaryOperator(BinaryOperator.POW, "**")
                .compareOperator(CompareOperator.IS, "{left}.equal?({right})")
                .compareOperator(CompareOperator.IS_NOT, "!{left}.equal?({right})")
                .compareOperator(CompareOperator.IN, "{right}.include?({left})")
                .compareOperator(CompareOperator.NOT_IN, "!{right}.include?({left})")
                .dictSyntax(new DictSyntax("{", "{key} => {value}", ", ", "}"))
                .builtin(Builtin.PRINT, BuiltinRule.call("puts"))
                .builtin(Builtin.LEN, BuiltinRule.unary("{0}.length"))
                .builtin(Builtin.STR, BuiltinRule.unary("{0}.to_s"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "(0...{stop})",
                        "({start}...{stop})",
                        "({start}...{stop}).step({step})",
                        "{start}.step({stop} + 1, {step})"))
                .classFieldTemplate("@@{target} = {value}")
                .destructuringDeclarationTemplate("{names} = {values}")
                .destructuringAssignmentTemplate("{names} = {values}")
                .ifTemplate("if {test}")
                .elseIfTemplate("elsif {test}")
                .whileTemplate("while {test}")
                .forTemplate("{iter}.each do |{var}|")
                .destructuringForTemplate("{iter}.each do |{names}|")
                .continueKeyword("next")
                .noOpKeyword("nil")
                .functionTemplate("def {name}({params})")
                .baseClauseTemplate(" < {bases}")
                .methodTemplate("def {name}({params})")
                .constructorTemplate("def initialize({params})")
                .build();
    }

    static LanguageProfile perl() {
        return ProfilePresets.cStyle(TargetLanguage.PERL)
                .trueLiteral("1")
                .falseLiteral("0")
                .nullLiteral("undef")
                .interpolationEscapes("$@")
                .variableSigil("$")
                .selfReference("$self")
                .selfFieldPrefix("$self->{")
                .selfFieldSuffix("}")
                .selfMethodPrefix("$self->")
                .memberAccess("->")
                .subscriptTemplate("{value}->[{index}]")
                .binaryOperator(BinaryOperator.POW, "**")
                .binaryOperator(BinaryOperator.FLOOR_DIV, "int({left} / {right})")
                .concatOperator(".")
                .listSyntax(new ContainerSyntax("(", ")"))
                .tupleSyntax(new ContainerSyntax("(", ")"))
                .dictSyntax(new DictSyntax("(", "{key} => {value}", ", ", ")"))
                .builtin(Builtin.PRINT, BuiltinRule.joined("print ", ", \" \", ", ", \"\\n\""))
                .builtin(Builtin.LEN, BuiltinRule.unary("scalar(@{0})"))
                .builtin(Builtin.STR, BuiltinRule.unary("\"\" . {0}"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "(0 .. {stop} - 1)",
                        "({start} .. {stop} - 1)",
                        "grep { ($_ - {start}) % {step} == 0 } ({start} .. {stop} - 1)",
                        "grep { ({start} - $_) % {magnitude} == 0 } reverse({stop} + 1 .. {start})"))
                .declarationTemplate("my {target} = {value}")
                .destructuringDeclarationTemplate("my ({names}) = {value}")
                .destructuringAssignmentTemplate("({names}) = {value}")
                .classFieldTemplate("our {target} = {value};")
                .elseIfTemplate("elsif ({test})")
                .forTemplate("foreach my {var} ({iter})")
                .countedForTemplate(ProfilePresets.cStyleCountedFor("my "))
                .countedForDownTemplate(ProfilePresets.cStyleCountedForDown("my "))
                .breakKeyword("last")
                .continueKeyword("next")
                .functionTemplate("sub {name}")
                .paramBindingTemplate("my ({params}) = @_;")
                .selfParameter("$self")
                .classTemplate("package {name}")
                .baseClauseTemplate("")
                .methodTemplate("sub {name}")
                .constructorTemplate("sub new")
                .build();
    }

    static LanguageProfile lua() {
        return ProfilePresets.cStyle(TargetLanguage.LUA)
                .blockStyle(BlockStyle.END_KEYWORD)
                .indentUnit("  ")
                .terminator("")
                .nullLiteral("nil")
                .selfReference("self")
                .selfFieldPrefix("self.")
                .selfMethodPrefix("self:")
                .binaryOperator(BinaryOperator.POW, "^")
                .binaryOperator(BinaryOperator.FLOOR_DIV, "//")
                .binaryOperator(BinaryOperator.BIT_XOR, "~")
                .concatOperator("..")
                .compareOperator(CompareOperator.NOT_EQ, "~=")
                .compareOperator(CompareOperator.IS_NOT, "~=")
                .unaryOperator(UnaryOperator.NOT, "not ")
                .andOperator("and")
                .orOperator("or")
                .conditionalTemplate("({test}) and {body} or {orelse}")
                .compoundAssignment(false)
                .listSyntax(new ContainerSyntax("{", "}"))
                .tupleSyntax(new ContainerSyntax("{", "}"))
                .dictSyntax(new DictSyntax("{", "[{key}] = {value}", ", ", "}"))
                .builtin(Builtin.PRINT, BuiltinRule.call("print"))
                .builtin(Builtin.LEN, BuiltinRule.unary("#{0}"))
                .builtin(Builtin.STR, BuiltinRule.call("tostring"))
                .builtin(Builtin.RANGE, BuiltinRule.call("range"))
                .declarationTemplate("local {target} = {value}")
                .destructuringDeclarationTemplate("local {names} = {values}")
                .destructuringAssignmentTemplate("{names} = {values}")
                .ifTemplate("if {test} then")
                .elseIfTemplate("elseif {test} then")
                .whileTemplate("while {test} do")
                .forTemplate("for _, {var} in ipairs({iter}) do")
                .countedForTemplate("for {var} = {start}, {stop} - 1, {step} do")
                .countedForDownTemplate("for {var} = {start}, {stop} + 1, {step} do")
                .continueKeyword("goto continue")
                .continueLabel("::continue::")
                .functionTemplate("local function {name}({params})")
                .classLayout(ClassLayout.DETACHED)
                .classTemplate("{name} = {}")
                .structBlock(false)
                .classFieldTemplate("{class}.{target} = {value}")
                .methodTemplate("function {class}:{name}({params})")
                .constructorTemplate("function {class}.new({params})")
                .constructorTakesSelf(false)
                .build();
    }

    static LanguageProfile r() {
        return ProfilePresets.cStyle(TargetLanguage.R)
                .indentUnit("  ")
                .terminator("")
                .trueLiteral("TRUE")
                .falseLiteral("FALSE")
                .nullLiteral("NULL")
                .selfReference("self")
                .selfFieldPrefix("self$")
                .selfMethodPrefix("self$")
                .memberAccess("$")
                .subscriptTemplate("{value}[[{index}]]")
                .binaryOperator(BinaryOperator.POW, "^")
                .binaryOperator(BinaryOperator.MOD, "%%")
                .binaryOperator(BinaryOperator.FLOOR_DIV, "%/%")
                .binaryOperator(BinaryOperator.MAT_MULT, "%*%")
                .binaryOperator(BinaryOperator.LSHIFT, "bitwShiftL({left}, {right})")
                .binaryOperator(BinaryOperator.RSHIFT, "bitwShiftR({left}, {right})")
                .binaryOperator(BinaryOperator.BIT_OR, "bitwOr({left}, {right})")
                .binaryOperator(BinaryOperator.BIT_XOR, "bitwXor({left}, {right})")
                .binaryOperator(BinaryOperator.BIT_AND, "bitwAnd({left}, {right})")
                .concatOperator("paste0({left}, {right})")
                .compareOperator(CompareOperator.IS, "identical({left}, {right})")
                .compareOperator(CompareOperator.IS_NOT, "!identical({left}, {right})")
                .compareOperator(CompareOperator.IN, "%in%")
                .compareOperator(CompareOperator.NOT_IN, "!({left} %in% {right})")
                .unaryOperator(UnaryOperator.INVERT, "bitwNot({operand})")
                .conditionalTemplate("if ({test}) {body} else {orelse}")
                .compoundAssignment(false)
                .listSyntax(new ContainerSyntax("list(", ")"))
                .tupleSyntax(new ContainerSyntax("list(", ")"))
                .dictSyntax(new DictSyntax("list(", "{key} = {value}", ", ", ")"))
                .builtin(Builtin.PRINT, BuiltinRule.call("print"))
                .builtin(Builtin.LEN, BuiltinRule.call("length"))
                .builtin(Builtin.STR, BuiltinRule.call("as.character"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "seq(0, {stop} - 1)",
                        "seq({start}, {stop} - 1)",
                        "seq({start}, {stop} - 1, by = {step})",
                        "seq({start}, {stop} + 1, by = {step})"))
                .declarationTemplate("{target} <- {value}")
                .assignmentTemplate("{target} <- {value}")
                .forTemplate("for ({var} in {iter})")
                .returnTemplate("return({value})")
                .bareReturn("return()")
                .continueKeyword("next")
                .noOpKeyword("NULL")
                .functionTemplate("{name} <- function({params})")
                .classLayout(ClassLayout.DETACHED)
                .classTemplate("{name} <- function()")
                .classFieldTemplate("{target} <- {value}")
                .methodTemplate("{class}_{name} <- function({params})")
                .constructorTemplate("{class}_new <- function({params})")
                .constructorTakesSelf(false)
                .selfParameter("self")
                .build();
    }

    static LanguageProfile powershell() {
        return ProfilePresets.cStyle(TargetLanguage.POWERSHELL)
                .terminator("")
                .trueLiteral("$true")
                .falseLiteral("$false")
                .nullLiteral("$null")
                .stringStyle(StringLiteralStyle.SINGLE_QUOTED_DOUBLING)
                .variableSigil("$")
                .selfReference("$this")
                .selfFieldPrefix("$this.")
                .selfMethodPrefix("$this.")
                .binaryOperator(BinaryOperator.POW, "[math]::Pow({left}, {right})")
                .binaryOperator(BinaryOperator.FLOOR_DIV, "[math]::Floor({left} / {right})")
                .binaryOperator(BinaryOperator.LSHIFT, "-shl")
                .binaryOperator(BinaryOperator.RSHIFT, "-shr")
                .binaryOperator(BinaryOperator.BIT_OR, "-bor")
                .binaryOperator(BinaryOperator.BIT_XOR, "-bxor")
                .binaryOperator(BinaryOperator.BIT_AND, "-band")
                .compareOperator(CompareOperator.EQ, "-eq")
                .compareOperator(CompareOperator.NOT_EQ, "-ne")
                .compareOperator(CompareOperator.LT, "-lt")
                .compareOperator(CompareOperator.LT_E, "-le")
                .compareOperator(CompareOperator.GT, "-gt")
                .compareOperator(CompareOperator.GT_E, "-ge")
                .compareOperator(CompareOperator.IS, "-eq")
                .compareOperator(CompareOperator.IS_NOT, "-ne")
                .compareOperator(CompareOperator.IN, "-in")
                .compareOperator(CompareOperator.NOT_IN, "-notin")
                .unaryOperator(UnaryOperator.NOT, "-not ")
                .unaryOperator(UnaryOperator.INVERT, "-bnot ")
                .andOperator("-and")
                .orOperator("-or")
                .conditionalTemplate("$(if ({test}) { {body} } else { {orelse} })")
                .listSyntax(new ContainerSyntax("@(", ")"))
                .tupleSyntax(new ContainerSyntax("@(", ")"))
                .dictSyntax(new DictSyntax("@{", "{key} = {value}", "; ", "}"))
                .builtin(Builtin.PRINT, BuiltinRule.joined("Write-Output ", " ", ""))
                .builtin(Builtin.LEN, BuiltinRule.unary("{0}.Count"))
                .builtin(Builtin.STR, BuiltinRule.unary("[string]{0}"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "0..({stop} - 1)",
                        "{start}..({stop} - 1)",
                        "({start}..({stop} - 1) | Where-Object { ($_ - {start}) % {step} -eq 0 })",
                        "({start}..({stop} + 1) | Where-Object { ({start} - $_) % {magnitude} -eq 0 })"))
                .destructuringDeclarationTemplate("{names} = {values}")
                .destructuringAssignmentTemplate("{names} = {values}")
                .elseIfTemplate("elseif ({test})")
                .forTemplate("foreach ({var} in {iter})")
                .countedForTemplate("for ({var} = {start}; {var} -lt {stop}; {var} += {step})")
                .countedForDownTemplate("for ({var} = {start}; {var} -gt {stop}; {var} += {step})")
                .baseClauseTemplate(" : {bases}")
                .classFieldTemplate("[object]{target} = {value}")
                .methodTemplate("[object] {name}({params})")
                .constructorTemplate("{class}({params})")
                .build();
    }

    static LanguageProfile julia() {
        return ProfilePresets.cStyle(TargetLanguage.JULIA)
                .blockStyle(BlockStyle.END_KEYWORD)
                .terminator("")
                .nullLiteral("nothing")
                .interpolationEscapes("$")
                .selfReference("self")
                .selfFieldPrefix("self.")
                .selfMethodPrefix("self.")
                .binaryOperator(BinaryOperator.POW, "^")
                .binaryOperator(BinaryOperator.FLOOR_DIV, "div({left}, {right})")
                .binaryOperator(BinaryOperator.BIT_XOR, "xor({left}, {right})")
                .concatOperator("*")
                .compareOperator(CompareOperator.IS, "===")
                .compareOperator(CompareOperator.IS_NOT, "!==")
                .compareOperator(CompareOperator.IN, "in")
                .compareOperator(CompareOperator.NOT_IN, "!({left} in {right})")
                .tupleSyntax(new ContainerSyntax("(", ")", true))
                .dictSyntax(new DictSyntax("Dict(", "{key} => {value}", ", ", ")"))
                .builtin(Builtin.PRINT, BuiltinRule.call("println"))
                .builtin(Builtin.LEN, BuiltinRule.call("length"))
                .builtin(Builtin.STR, BuiltinRule.call("string"))
                .builtin(Builtin.RANGE, BuiltinRule.range(
                        "0:({stop} - 1)",
                        "{start}:({stop} - 1)",
                        "{start}:{step}:({stop} - 1)",
                        "{start}:{step}:({stop} + 1)"))
                .destructuringDeclarationTemplate("{names} = {values}")
                .destructuringAssignmentTemplate("{names} = {values}")
                .ifTemplate("if {test}")
                .elseIfTemplate("elseif {test}")
                .whileTemplate("while {test}")
                .forTemplate("for {var} in {iter}")
                .destructuringForTemplate("for ({names}) in {iter}")
                .noOpKeyword("nothing")
                .functionTemplate("function {name}({params})")
                .classLayout(ClassLayout.DETACHED)
                .classTemplate("mutable struct {name}")
                .classFieldTemplate("{target}")
                .methodTemplate("function {name}({params})")
                .constructorTemplate("function {class}({params})")
                .constructorTakesSelf(false)
                .selfParameter("self::{class}")
                .build();
    }
}
