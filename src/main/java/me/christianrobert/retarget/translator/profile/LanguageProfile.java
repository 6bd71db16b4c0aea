package me.christianrobert.retarget.translator.profile;

import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.CompareOperator;
import me.christianrobert.retarget.translator.ast.UnaryOperator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of one target language's syntax, consulted by every emitter.
 *
 * <p>A profile is pure data: keyword spellings, statement templates, operator tables,
 * builtin rewrite rules, literal spellings and the whole-program wrapper strategy.
 * Adding a target means adding a profile, not adding emitter branches.</p>
 *
 * <h3>Templates</h3>
 * <p>Templates use {@code {name}} placeholders filled by {@link Template}. The common
 * ones are {@code {target}}/{@code {value}} for assignments, {@code {test}} for
 * conditions, {@code {var}}/{@code {iter}} for value loops,
 * {@code {var}}/{@code {start}}/{@code {stop}}/{@code {step}} for counted loops,
 * {@code {name}}/{@code {params}} for functions and {@code {class}} for the enclosing
 * class. Operator entries are either an infix token or a template over
 * {@code {left}}/{@code {right}} (or {@code {operand}} for unary operators).</p>
 *
 * <h3>Conventions</h3>
 * <ul>
 *   <li>An empty template or operator means the target has no form for that construct;
 *       the emitters report it and substitute the placeholder token.</li>
 *   <li>An empty {@code noOpKeyword} means a lone terminator ({@code ;}) is the no-op.</li>
 *   <li>{@code classFieldTemplate} carries its own terminator.</li>
 * </ul>
 *
 * <p>Profiles are immutable and shared between concurrent emissions. {@link Builder#build()}
 * rejects a profile with any field left unset.</p>
 */
public final class LanguageProfile {

    // layout
    private final TargetLanguage language;
    private final BlockStyle blockStyle;
    private final String indentUnit;
    private final String terminator;
    private final WrapperStrategy wrapperStrategy;
    private final String prologue;
    private final String epilogue;
    private final String wrapperTemplate;
    private final String entryPointHeader;
    private final String importAnchor;

    // literals
    private final String trueLiteral;
    private final String falseLiteral;
    private final String nullLiteral;
    private final StringLiteralStyle stringStyle;
    private final String interpolationEscapes;
    private final boolean keepDocstrings;

    // names and member access
    private final String variableSigil;
    private final String selfReference;
    private final String selfFieldPrefix;
    private final String selfFieldSuffix;
    private final String selfMethodPrefix;
    private final String memberAccess;
    private final String subscriptTemplate;

    // operators
    private final Map<BinaryOperator, String> binaryOperators;
    private final String concatOperator;
    private final Map<CompareOperator, String> compareOperators;
    private final Map<UnaryOperator, String> unaryOperators;
    private final String andOperator;
    private final String orOperator;
    private final String conditionalTemplate;
    private final boolean compoundAssignment;

    // containers, builtins and imports
    private final ContainerSyntax listSyntax;
    private final ContainerSyntax tupleSyntax;
    private final DictSyntax dictSyntax;
    private final Map<Builtin, BuiltinRule> builtins;
    private final Map<RuntimeFeature, String> imports;

    // assignment
    private final String declarationTemplate;
    private final String assignmentTemplate;
    private final String classFieldTemplate;

    // statements
    private final String ifTemplate;
    private final String elseIfTemplate;
    private final String elseKeyword;
    private final String whileTemplate;
    private final String forTemplate;
    private final String countedForTemplate;
    private final String countedForDownTemplate;
    private final String destructuringDeclarationTemplate;
    private final String destructuringAssignmentTemplate;
    private final String destructuringForTemplate;
    private final String returnTemplate;
    private final String bareReturn;
    private final String breakKeyword;
    private final String continueKeyword;
    private final String continueLabel;
    private final String noOpKeyword;

    // functions
    private final String functionTemplate;
    private final String paramTemplate;
    private final String paramBindingTemplate;
    private final String selfParameter;

    // classes
    private final ClassLayout classLayout;
    private final String classTemplate;
    private final String baseItemTemplate;
    private final String baseClauseTemplate;
    private final boolean singleInheritance;
    private final String classBodyPreamble;
    private final String classTerminator;
    private final String methodTemplate;
    private final String constructorTemplate;
    private final boolean constructorTakesSelf;
    private final boolean structBlock;
    private final String implTemplate;

    private LanguageProfile(Builder b) {
        this.language = b.language;
        this.blockStyle = b.blockStyle;
        this.indentUnit = b.indentUnit;
        this.terminator = b.terminator;
        this.wrapperStrategy = b.wrapperStrategy;
        this.prologue = b.prologue;
        this.epilogue = b.epilogue;
        this.wrapperTemplate = b.wrapperTemplate;
        this.entryPointHeader = b.entryPointHeader;
        this.importAnchor = b.importAnchor;
        this.trueLiteral = b.trueLiteral;
        this.falseLiteral = b.falseLiteral;
        this.nullLiteral = b.nullLiteral;
        this.stringStyle = b.stringStyle;
        this.interpolationEscapes = b.interpolationEscapes;
        this.keepDocstrings = b.keepDocstrings;
        this.variableSigil = b.variableSigil;
        this.selfReference = b.selfReference;
        this.selfFieldPrefix = b.selfFieldPrefix;
        this.selfFieldSuffix = b.selfFieldSuffix;
        this.selfMethodPrefix = b.selfMethodPrefix;
        this.memberAccess = b.memberAccess;
        this.subscriptTemplate = b.subscriptTemplate;
        this.binaryOperators = Collections.unmodifiableMap(new EnumMap<>(b.binaryOperators));
        this.concatOperator = b.concatOperator;
        this.compareOperators = Collections.unmodifiableMap(new EnumMap<>(b.compareOperators));
        this.unaryOperators = Collections.unmodifiableMap(new EnumMap<>(b.unaryOperators));
        this.andOperator = b.andOperator;
        this.orOperator = b.orOperator;
        this.conditionalTemplate = b.conditionalTemplate;
        this.compoundAssignment = b.compoundAssignment;
        this.listSyntax = b.listSyntax;
        this.tupleSyntax = b.tupleSyntax;
        this.dictSyntax = b.dictSyntax;
        this.builtins = Collections.unmodifiableMap(new EnumMap<>(b.builtins));
        this.imports = Collections.unmodifiableMap(new EnumMap<>(b.imports));
        this.declarationTemplate = b.declarationTemplate;
        this.assignmentTemplate = b.assignmentTemplate;
        this.classFieldTemplate = b.classFieldTemplate;
        this.ifTemplate = b.ifTemplate;
        this.elseIfTemplate = b.elseIfTemplate;
        this.elseKeyword = b.elseKeyword;
        this.whileTemplate = b.whileTemplate;
        this.forTemplate = b.forTemplate;
        this.countedForTemplate = b.countedForTemplate;
        this.countedForDownTemplate = b.countedForDownTemplate;
        this.destructuringDeclarationTemplate = b.destructuringDeclarationTemplate;
        this.destructuringAssignmentTemplate = b.destructuringAssignmentTemplate;
        this.destructuringForTemplate = b.destructuringForTemplate;
        this.returnTemplate = b.returnTemplate;
        this.bareReturn = b.bareReturn;
        this.breakKeyword = b.breakKeyword;
        this.continueKeyword = b.continueKeyword;
        this.continueLabel = b.continueLabel;
        this.noOpKeyword = b.noOpKeyword;
        this.functionTemplate = b.functionTemplate;
        this.paramTemplate = b.paramTemplate;
        this.paramBindingTemplate = b.paramBindingTemplate;
        this.selfParameter = b.selfParameter;
        this.classLayout = b.classLayout;
        this.classTemplate = b.classTemplate;
        this.baseItemTemplate = b.baseItemTemplate;
        this.baseClauseTemplate = b.baseClauseTemplate;
        this.singleInheritance = b.singleInheritance;
        this.classBodyPreamble = b.classBodyPreamble;
        this.classTerminator = b.classTerminator;
        this.methodTemplate = b.methodTemplate;
        this.constructorTemplate = b.constructorTemplate;
        this.constructorTakesSelf = b.constructorTakesSelf;
        this.structBlock = b.structBlock;
        this.implTemplate = b.implTemplate;
    }

    public static Builder builder(TargetLanguage language) {
        return new Builder(language);
    }

    public String getId() {
        return language.getId();
    }

    /**
     * Indentation prefix for a nesting depth.
     */
    public String indent(int depth) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            sb.append(indentUnit);
        }
        return sb.toString();
    }

    /**
     * Statement used where a block would otherwise be empty.
     */
    public String noOpStatement() {
        return noOpKeyword.isEmpty() ? ";" : noOpKeyword + terminator;
    }

    public boolean hasNoOpKeyword() {
        return !noOpKeyword.isEmpty();
    }

    public String binaryOperator(BinaryOperator op) {
        return binaryOperators.get(op);
    }

    public String compareOperator(CompareOperator op) {
        return compareOperators.get(op);
    }

    public String unaryOperator(UnaryOperator op) {
        return unaryOperators.get(op);
    }

    public BuiltinRule builtin(Builtin builtin) {
        return builtins.get(builtin);
    }

    /**
     * @return the import line needed for a feature, or null when none is needed
     */
    public String importFor(RuntimeFeature feature) {
        String line = imports.get(feature);
        return line == null || line.isEmpty() ? null : line;
    }

    // ========== GETTERS ==========

    public TargetLanguage getLanguage() {
        return language;
    }

    public BlockStyle getBlockStyle() {
        return blockStyle;
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    public String getTerminator() {
        return terminator;
    }

    public WrapperStrategy getWrapperStrategy() {
        return wrapperStrategy;
    }

    public String getPrologue() {
        return prologue;
    }

    public String getEpilogue() {
        return epilogue;
    }

    public String getWrapperTemplate() {
        return wrapperTemplate;
    }

    public String getEntryPointHeader() {
        return entryPointHeader;
    }

    public String getImportAnchor() {
        return importAnchor;
    }

    public String getTrueLiteral() {
        return trueLiteral;
    }

    public String getFalseLiteral() {
        return falseLiteral;
    }

    public String getNullLiteral() {
        return nullLiteral;
    }

    public StringLiteralStyle getStringStyle() {
        return stringStyle;
    }

    public String getInterpolationEscapes() {
        return interpolationEscapes;
    }

    public boolean isKeepDocstrings() {
        return keepDocstrings;
    }

    public String getVariableSigil() {
        return variableSigil;
    }

    public String getSelfReference() {
        return selfReference;
    }

    public String getSelfFieldPrefix() {
        return selfFieldPrefix;
    }

    public String getSelfFieldSuffix() {
        return selfFieldSuffix;
    }

    public String getSelfMethodPrefix() {
        return selfMethodPrefix;
    }

    public String getMemberAccess() {
        return memberAccess;
    }

    public String getSubscriptTemplate() {
        return subscriptTemplate;
    }

    public Map<BinaryOperator, String> getBinaryOperators() {
        return binaryOperators;
    }

    public String getConcatOperator() {
        return concatOperator;
    }

    public Map<CompareOperator, String> getCompareOperators() {
        return compareOperators;
    }

    public Map<UnaryOperator, String> getUnaryOperators() {
        return unaryOperators;
    }

    public String getAndOperator() {
        return andOperator;
    }

    public String getOrOperator() {
        return orOperator;
    }

    public String getConditionalTemplate() {
        return conditionalTemplate;
    }

    public boolean isCompoundAssignment() {
        return compoundAssignment;
    }

    public ContainerSyntax getListSyntax() {
        return listSyntax;
    }

    public ContainerSyntax getTupleSyntax() {
        return tupleSyntax;
    }

    public DictSyntax getDictSyntax() {
        return dictSyntax;
    }

    public Map<Builtin, BuiltinRule> getBuiltins() {
        return builtins;
    }

    public Map<RuntimeFeature, String> getImports() {
        return imports;
    }

    public String getDeclarationTemplate() {
        return declarationTemplate;
    }

    public String getAssignmentTemplate() {
        return assignmentTemplate;
    }

    public String getClassFieldTemplate() {
        return classFieldTemplate;
    }

    public String getIfTemplate() {
        return ifTemplate;
    }

    public String getElseIfTemplate() {
        return elseIfTemplate;
    }

    public String getElseKeyword() {
        return elseKeyword;
    }

    public String getWhileTemplate() {
        return whileTemplate;
    }

    public String getForTemplate() {
        return forTemplate;
    }

    public String getCountedForTemplate() {
        return countedForTemplate;
    }

    /**
     * Counted loop for a negative literal step, e.g. {@code {var} > {stop}}.
     */
    public String getCountedForDownTemplate() {
        return countedForDownTemplate;
    }

    /**
     * Declaring assignment to several names at once; {@code {names}} is the comma-separated
     * name list, {@code {value}} the emitted value and {@code {values}} the items of a tuple
     * value (or the value itself).
     */
    public String getDestructuringDeclarationTemplate() {
        return destructuringDeclarationTemplate;
    }

    /**
     * Like {@link #getDestructuringDeclarationTemplate()}, for names that are all declared already.
     */
    public String getDestructuringAssignmentTemplate() {
        return destructuringAssignmentTemplate;
    }

    /**
     * Value loop binding several names per element, over {@code {names}} and {@code {iter}}.
     */
    public String getDestructuringForTemplate() {
        return destructuringForTemplate;
    }

    public String getReturnTemplate() {
        return returnTemplate;
    }

    public String getBareReturn() {
        return bareReturn;
    }

    public String getBreakKeyword() {
        return breakKeyword;
    }

    public String getContinueKeyword() {
        return continueKeyword;
    }

    /**
     * Label line closing a loop body whose continue keyword jumps to it ({@code ::continue::}),
     * empty when the keyword needs none.
     */
    public String getContinueLabel() {
        return continueLabel;
    }

    public String getNoOpKeyword() {
        return noOpKeyword;
    }

    public String getFunctionTemplate() {
        return functionTemplate;
    }

    public String getParamTemplate() {
        return paramTemplate;
    }

    public String getParamBindingTemplate() {
        return paramBindingTemplate;
    }

    public String getSelfParameter() {
        return selfParameter;
    }

    public ClassLayout getClassLayout() {
        return classLayout;
    }

    public String getClassTemplate() {
        return classTemplate;
    }

    public String getBaseItemTemplate() {
        return baseItemTemplate;
    }

    public String getBaseClauseTemplate() {
        return baseClauseTemplate;
    }

    public boolean isSingleInheritance() {
        return singleInheritance;
    }

    public String getClassBodyPreamble() {
        return classBodyPreamble;
    }

    public String getClassTerminator() {
        return classTerminator;
    }

    public String getMethodTemplate() {
        return methodTemplate;
    }

    public String getConstructorTemplate() {
        return constructorTemplate;
    }

    public boolean isConstructorTakesSelf() {
        return constructorTakesSelf;
    }

    public boolean isStructBlock() {
        return structBlock;
    }

    public String getImplTemplate() {
        return implTemplate;
    }

    @Override
    public String toString() {
        return "LanguageProfile{" + language.getId() + ", blockStyle=" + blockStyle
                + ", wrapper=" + wrapperStrategy + ", classLayout=" + classLayout + "}";
    }

    /**
     * Mutable assembly of a profile. Presets fill common defaults, catalog entries
     * override what differs for their target.
     */
    public static final class Builder {
        private final TargetLanguage language;
        private BlockStyle blockStyle;
        private String indentUnit;
        private String terminator;
        private WrapperStrategy wrapperStrategy;
        private String prologue;
        private String epilogue;
        private String wrapperTemplate;
        private String entryPointHeader;
        private String importAnchor;
        private String trueLiteral;
        private String falseLiteral;
        private String nullLiteral;
        private StringLiteralStyle stringStyle;
        private String interpolationEscapes;
        private Boolean keepDocstrings;
        private String variableSigil;
        private String selfReference;
        private String selfFieldPrefix;
        private String selfFieldSuffix;
        private String selfMethodPrefix;
        private String memberAccess;
        private String subscriptTemplate;
        private final Map<BinaryOperator, String> binaryOperators = new EnumMap<>(BinaryOperator.class);
        private String concatOperator;
        private final Map<CompareOperator, String> compareOperators = new EnumMap<>(CompareOperator.class);
        private final Map<UnaryOperator, String> unaryOperators = new EnumMap<>(UnaryOperator.class);
        private String andOperator;
        private String orOperator;
        private String conditionalTemplate;
        private Boolean compoundAssignment;
        private ContainerSyntax listSyntax;
        private ContainerSyntax tupleSyntax;
        private DictSyntax dictSyntax;
        private final Map<Builtin, BuiltinRule> builtins = new EnumMap<>(Builtin.class);
        private final Map<RuntimeFeature, String> imports = new EnumMap<>(RuntimeFeature.class);
        private String declarationTemplate;
        private String assignmentTemplate;
        private String classFieldTemplate;
        private String ifTemplate;
        private String elseIfTemplate;
        private String elseKeyword;
        private String whileTemplate;
        private String forTemplate;
        private String countedForTemplate;
        private String countedForDownTemplate;
        private String destructuringDeclarationTemplate;
        private String destructuringAssignmentTemplate;
        private String destructuringForTemplate;
        private String returnTemplate;
        private String bareReturn;
        private String breakKeyword;
        private String continueKeyword;
        private String continueLabel;
        private String noOpKeyword;
        private String functionTemplate;
        private String paramTemplate;
        private String paramBindingTemplate;
        private String selfParameter;
        private ClassLayout classLayout;
        private String classTemplate;
        private String baseItemTemplate;
        private String baseClauseTemplate;
        private Boolean singleInheritance;
        private String classBodyPreamble;
        private String classTerminator;
        private String methodTemplate;
        private String constructorTemplate;
        private Boolean constructorTakesSelf;
        private Boolean structBlock;
        private String implTemplate;

        private Builder(TargetLanguage language) {
            if (language == null) {
                throw new IllegalArgumentException("Target language cannot be null");
            }
            this.language = language;
        }

        public TargetLanguage getLanguage() {
            return language;
        }

        public Builder blockStyle(BlockStyle blockStyle) {
            this.blockStyle = blockStyle;
            return this;
        }

        public Builder indentUnit(String indentUnit) {
            this.indentUnit = indentUnit;
            return this;
        }

        public Builder terminator(String terminator) {
            this.terminator = terminator;
            return this;
        }

        public Builder wrapperStrategy(WrapperStrategy wrapperStrategy) {
            this.wrapperStrategy = wrapperStrategy;
            return this;
        }

        public Builder prologue(String prologue) {
            this.prologue = prologue;
            return this;
        }

        public Builder epilogue(String epilogue) {
            this.epilogue = epilogue;
            return this;
        }

        public Builder wrapperTemplate(String wrapperTemplate) {
            this.wrapperTemplate = wrapperTemplate;
            return this;
        }

        public Builder entryPointHeader(String entryPointHeader) {
            this.entryPointHeader = entryPointHeader;
            return this;
        }

        public Builder importAnchor(String importAnchor) {
            this.importAnchor = importAnchor;
            return this;
        }

        public Builder trueLiteral(String trueLiteral) {
            this.trueLiteral = trueLiteral;
            return this;
        }

        public Builder falseLiteral(String falseLiteral) {
            this.falseLiteral = falseLiteral;
            return this;
        }

        public Builder nullLiteral(String nullLiteral) {
            this.nullLiteral = nullLiteral;
            return this;
        }

        public Builder stringStyle(StringLiteralStyle stringStyle) {
            this.stringStyle = stringStyle;
            return this;
        }

        public Builder interpolationEscapes(String interpolationEscapes) {
            this.interpolationEscapes = interpolationEscapes;
            return this;
        }

        public Builder keepDocstrings(boolean keepDocstrings) {
            this.keepDocstrings = keepDocstrings;
            return this;
        }

        public Builder variableSigil(String variableSigil) {
            this.variableSigil = variableSigil;
            return this;
        }

        public Builder selfReference(String selfReference) {
            this.selfReference = selfReference;
            return this;
        }

        public Builder selfFieldPrefix(String selfFieldPrefix) {
            this.selfFieldPrefix = selfFieldPrefix;
            return this;
        }

        public Builder selfFieldSuffix(String selfFieldSuffix) {
            this.selfFieldSuffix = selfFieldSuffix;
            return this;
        }

        public Builder selfMethodPrefix(String selfMethodPrefix) {
            this.selfMethodPrefix = selfMethodPrefix;
            return this;
        }

        public Builder memberAccess(String memberAccess) {
            this.memberAccess = memberAccess;
            return this;
        }

        public Builder subscriptTemplate(String subscriptTemplate) {
            this.subscriptTemplate = subscriptTemplate;
            return this;
        }

        public Builder binaryOperator(BinaryOperator key, String value) {
            this.binaryOperators.put(key, value);
            return this;
        }

        public Builder concatOperator(String concatOperator) {
            this.concatOperator = concatOperator;
            return this;
        }

        public Builder compareOperator(CompareOperator key, String value) {
            this.compareOperators.put(key, value);
            return this;
        }

        public Builder unaryOperator(UnaryOperator key, String value) {
            this.unaryOperators.put(key, value);
            return this;
        }

        public Builder andOperator(String andOperator) {
            this.andOperator = andOperator;
            return this;
        }

        public Builder orOperator(String orOperator) {
            this.orOperator = orOperator;
            return this;
        }

        public Builder conditionalTemplate(String conditionalTemplate) {
            this.conditionalTemplate = conditionalTemplate;
            return this;
        }

        public Builder compoundAssignment(boolean compoundAssignment) {
            this.compoundAssignment = compoundAssignment;
            return this;
        }

        public Builder listSyntax(ContainerSyntax listSyntax) {
            this.listSyntax = listSyntax;
            return this;
        }

        public Builder tupleSyntax(ContainerSyntax tupleSyntax) {
            this.tupleSyntax = tupleSyntax;
            return this;
        }

        public Builder dictSyntax(DictSyntax dictSyntax) {
            this.dictSyntax = dictSyntax;
            return this;
        }

        public Builder builtin(Builtin key, BuiltinRule value) {
            this.builtins.put(key, value);
            return this;
        }

        public Builder importLine(RuntimeFeature key, String value) {
            this.imports.put(key, value);
            return this;
        }

        public Builder declarationTemplate(String declarationTemplate) {
            this.declarationTemplate = declarationTemplate;
            return this;
        }

        public Builder assignmentTemplate(String assignmentTemplate) {
            this.assignmentTemplate = assignmentTemplate;
            return this;
        }

        public Builder classFieldTemplate(String classFieldTemplate) {
            this.classFieldTemplate = classFieldTemplate;
            return this;
        }

        public Builder ifTemplate(String ifTemplate) {
            this.ifTemplate = ifTemplate;
            return this;
        }

        public Builder elseIfTemplate(String elseIfTemplate) {
            this.elseIfTemplate = elseIfTemplate;
            return this;
        }

        public Builder elseKeyword(String elseKeyword) {
            this.elseKeyword = elseKeyword;
            return this;
        }

        public Builder whileTemplate(String whileTemplate) {
            this.whileTemplate = whileTemplate;
            return this;
        }

        public Builder forTemplate(String forTemplate) {
            this.forTemplate = forTemplate;
            return this;
        }

        public Builder countedForTemplate(String countedForTemplate) {
            this.countedForTemplate = countedForTemplate;
            return this;
        }

        public Builder countedForDownTemplate(String countedForDownTemplate) {
            this.countedForDownTemplate = countedForDownTemplate;
            return this;
        }

        public Builder destructuringDeclarationTemplate(String destructuringDeclarationTemplate) {
            this.destructuringDeclarationTemplate = destructuringDeclarationTemplate;
            return this;
        }

        public Builder destructuringAssignmentTemplate(String destructuringAssignmentTemplate) {
            this.destructuringAssignmentTemplate = destructuringAssignmentTemplate;
            return this;
        }

        public Builder destructuringForTemplate(String destructuringForTemplate) {
            this.destructuringForTemplate = destructuringForTemplate;
            return this;
        }

        public Builder returnTemplate(String returnTemplate) {
            this.returnTemplate = returnTemplate;
            return this;
        }

        public Builder bareReturn(String bareReturn) {
            this.bareReturn = bareReturn;
            return this;
        }

        public Builder breakKeyword(String breakKeyword) {
            this.breakKeyword = breakKeyword;
            return this;
        }

        public Builder continueKeyword(String continueKeyword) {
            this.continueKeyword = continueKeyword;
            return this;
        }

        public Builder continueLabel(String continueLabel) {
            this.continueLabel = continueLabel;
            return this;
        }

        public Builder noOpKeyword(String noOpKeyword) {
            this.noOpKeyword = noOpKeyword;
            return this;
        }

        public Builder functionTemplate(String functionTemplate) {
            this.functionTemplate = functionTemplate;
            return this;
        }

        public Builder paramTemplate(String paramTemplate) {
            this.paramTemplate = paramTemplate;
            return this;
        }

        public Builder paramBindingTemplate(String paramBindingTemplate) {
            this.paramBindingTemplate = paramBindingTemplate;
            return this;
        }

        public Builder selfParameter(String selfParameter) {
            this.selfParameter = selfParameter;
            return this;
        }

        public Builder classLayout(ClassLayout classLayout) {
            this.classLayout = classLayout;
            return this;
        }

        public Builder classTemplate(String classTemplate) {
            this.classTemplate = classTemplate;
            return this;
        }

        public Builder baseItemTemplate(String baseItemTemplate) {
            this.baseItemTemplate = baseItemTemplate;
            return this;
        }

        public Builder baseClauseTemplate(String baseClauseTemplate) {
            this.baseClauseTemplate = baseClauseTemplate;
            return this;
        }

        public Builder singleInheritance(boolean singleInheritance) {
            this.singleInheritance = singleInheritance;
            return this;
        }

        public Builder classBodyPreamble(String classBodyPreamble) {
            this.classBodyPreamble = classBodyPreamble;
            return this;
        }

        public Builder classTerminator(String classTerminator) {
            this.classTerminator = classTerminator;
            return this;
        }

        public Builder methodTemplate(String methodTemplate) {
            this.methodTemplate = methodTemplate;
            return this;
        }

        public Builder constructorTemplate(String constructorTemplate) {
            this.constructorTemplate = constructorTemplate;
            return this;
        }

        public Builder constructorTakesSelf(boolean constructorTakesSelf) {
            this.constructorTakesSelf = constructorTakesSelf;
            return this;
        }

        public Builder structBlock(boolean structBlock) {
            this.structBlock = structBlock;
            return this;
        }

        public Builder implTemplate(String implTemplate) {
            this.implTemplate = implTemplate;
            return this;
        }

        /**
         * Builds the profile.
         *
         * @throws IllegalStateException naming every unset field and every operator or
         *                               builtin without an entry
         */
        public LanguageProfile build() {
            List<String> missing = new ArrayList<>();
            if (blockStyle == null) {
                missing.add("blockStyle");
            }
            if (indentUnit == null) {
                missing.add("indentUnit");
            }
            if (terminator == null) {
                missing.add("terminator");
            }
            if (wrapperStrategy == null) {
                missing.add("wrapperStrategy");
            }
            if (prologue == null) {
                missing.add("prologue");
            }
            if (epilogue == null) {
                missing.add("epilogue");
            }
            if (wrapperTemplate == null) {
                missing.add("wrapperTemplate");
            }
            if (entryPointHeader == null) {
                missing.add("entryPointHeader");
            }
            if (importAnchor == null) {
                missing.add("importAnchor");
            }
            if (trueLiteral == null) {
                missing.add("trueLiteral");
            }
            if (falseLiteral == null) {
                missing.add("falseLiteral");
            }
            if (nullLiteral == null) {
                missing.add("nullLiteral");
            }
            if (stringStyle == null) {
                missing.add("stringStyle");
            }
            if (interpolationEscapes == null) {
                missing.add("interpolationEscapes");
            }
            if (keepDocstrings == null) {
                missing.add("keepDocstrings");
            }
            if (variableSigil == null) {
                missing.add("variableSigil");
            }
            if (selfReference == null) {
                missing.add("selfReference");
            }
            if (selfFieldPrefix == null) {
                missing.add("selfFieldPrefix");
            }
            if (selfFieldSuffix == null) {
                missing.add("selfFieldSuffix");
            }
            if (selfMethodPrefix == null) {
                missing.add("selfMethodPrefix");
            }
            if (memberAccess == null) {
                missing.add("memberAccess");
            }
            if (subscriptTemplate == null) {
                missing.add("subscriptTemplate");
            }
            if (concatOperator == null) {
                missing.add("concatOperator");
            }
            if (andOperator == null) {
                missing.add("andOperator");
            }
            if (orOperator == null) {
                missing.add("orOperator");
            }
            if (conditionalTemplate == null) {
                missing.add("conditionalTemplate");
            }
            if (compoundAssignment == null) {
                missing.add("compoundAssignment");
            }
            if (listSyntax == null) {
                missing.add("listSyntax");
            }
            if (tupleSyntax == null) {
                missing.add("tupleSyntax");
            }
            if (dictSyntax == null) {
                missing.add("dictSyntax");
            }
            if (declarationTemplate == null) {
                missing.add("declarationTemplate");
            }
            if (assignmentTemplate == null) {
                missing.add("assignmentTemplate");
            }
            if (classFieldTemplate == null) {
                missing.add("classFieldTemplate");
            }
            if (ifTemplate == null) {
                missing.add("ifTemplate");
            }
            if (elseIfTemplate == null) {
                missing.add("elseIfTemplate");
            }
            if (elseKeyword == null) {
                missing.add("elseKeyword");
            }
            if (whileTemplate == null) {
                missing.add("whileTemplate");
            }
            if (forTemplate == null) {
                missing.add("forTemplate");
            }
            if (countedForTemplate == null) {
                missing.add("countedForTemplate");
            }
            if (countedForDownTemplate == null) {
                missing.add("countedForDownTemplate");
            }
            if (destructuringDeclarationTemplate == null) {
                missing.add("destructuringDeclarationTemplate");
            }
            if (destructuringAssignmentTemplate == null) {
                missing.add("destructuringAssignmentTemplate");
            }
            if (destructuringForTemplate == null) {
                missing.add("destructuringForTemplate");
            }
            if (returnTemplate == null) {
                missing.add("returnTemplate");
            }
            if (bareReturn == null) {
                missing.add("bareReturn");
            }
            if (breakKeyword == null) {
                missing.add("breakKeyword");
            }
            if (continueKeyword == null) {
                missing.add("continueKeyword");
            }
            if (continueLabel == null) {
                missing.add("continueLabel");
            }
            if (noOpKeyword == null) {
                missing.add("noOpKeyword");
            }
            if (functionTemplate == null) {
                missing.add("functionTemplate");
            }
            if (paramTemplate == null) {
                missing.add("paramTemplate");
            }
            if (paramBindingTemplate == null) {
                missing.add("paramBindingTemplate");
            }
            if (selfParameter == null) {
                missing.add("selfParameter");
            }
            if (classLayout == null) {
                missing.add("classLayout");
            }
            if (classTemplate == null) {
                missing.add("classTemplate");
            }
            if (baseItemTemplate == null) {
                missing.add("baseItemTemplate");
            }
            if (baseClauseTemplate == null) {
                missing.add("baseClauseTemplate");
            }
            if (singleInheritance == null) {
                missing.add("singleInheritance");
            }
            if (classBodyPreamble == null) {
                missing.add("classBodyPreamble");
            }
            if (classTerminator == null) {
                missing.add("classTerminator");
            }
            if (methodTemplate == null) {
                missing.add("methodTemplate");
            }
            if (constructorTemplate == null) {
                missing.add("constructorTemplate");
            }
            if (constructorTakesSelf == null) {
                missing.add("constructorTakesSelf");
            }
            if (structBlock == null) {
                missing.add("structBlock");
            }
            if (implTemplate == null) {
                missing.add("implTemplate");
            }
            requireAll(binaryOperators, BinaryOperator.values(), "binaryOperators", missing);
            requireAll(compareOperators, CompareOperator.values(), "compareOperators", missing);
            requireAll(unaryOperators, UnaryOperator.values(), "unaryOperators", missing);
            requireAll(builtins, Builtin.values(), "builtins", missing);
            if (!missing.isEmpty()) {
                throw new IllegalStateException("Incomplete profile for " + language.getId() + ": " + missing);
            }
            return new LanguageProfile(this);
        }

        private static <K> void requireAll(Map<K, ?> map, K[] keys, String name, List<String> missing) {
            for (K key : keys) {
                if (map.get(key) == null) {
                    missing.add(name + "." + key);
                }
            }
        }
    }
}
