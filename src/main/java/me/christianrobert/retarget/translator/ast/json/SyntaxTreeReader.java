package me.christianrobert.retarget.translator.ast.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.retarget.translator.ast.Assign;
import me.christianrobert.retarget.translator.ast.Attribute;
import me.christianrobert.retarget.translator.ast.AugAssign;
import me.christianrobert.retarget.translator.ast.BinOp;
import me.christianrobert.retarget.translator.ast.BinaryOperator;
import me.christianrobert.retarget.translator.ast.BoolOp;
import me.christianrobert.retarget.translator.ast.BooleanOperator;
import me.christianrobert.retarget.translator.ast.Break;
import me.christianrobert.retarget.translator.ast.Call;
import me.christianrobert.retarget.translator.ast.ClassDef;
import me.christianrobert.retarget.translator.ast.Compare;
import me.christianrobert.retarget.translator.ast.CompareOperator;
import me.christianrobert.retarget.translator.ast.Conditional;
import me.christianrobert.retarget.translator.ast.Constant;
import me.christianrobert.retarget.translator.ast.Continue;
import me.christianrobert.retarget.translator.ast.DictLit;
import me.christianrobert.retarget.translator.ast.ExprStmt;
import me.christianrobert.retarget.translator.ast.Expression;
import me.christianrobert.retarget.translator.ast.For;
import me.christianrobert.retarget.translator.ast.FunctionDef;
import me.christianrobert.retarget.translator.ast.If;
import me.christianrobert.retarget.translator.ast.Import;
import me.christianrobert.retarget.translator.ast.ListLit;
import me.christianrobert.retarget.translator.ast.Name;
import me.christianrobert.retarget.translator.ast.OpaqueExpression;
import me.christianrobert.retarget.translator.ast.OpaqueStatement;
import me.christianrobert.retarget.translator.ast.Pass;
import me.christianrobert.retarget.translator.ast.Program;
import me.christianrobert.retarget.translator.ast.Return;
import me.christianrobert.retarget.translator.ast.Statement;
import me.christianrobert.retarget.translator.ast.Subscript;
import me.christianrobert.retarget.translator.ast.TupleLit;
import me.christianrobert.retarget.translator.ast.UnaryOp;
import me.christianrobert.retarget.translator.ast.UnaryOperator;
import me.christianrobert.retarget.translator.ast.While;
import me.christianrobert.retarget.translator.context.ParseUnavailableException;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the node model from the JSON dump of the origin parser's tree.
 *
 * <p>The expected shape is the dictionary form of the origin's {@code ast} module:
 * every node is an object whose {@code "_type"} (or {@code "type"}) member names the
 * node class, with the remaining members named as in that module.</p>
 * <pre>
 * {"_type": "Module", "body": [
 *   {"_type": "Expr", "value": {"_type": "Call",
 *       "func": {"_type": "Name", "id": "print"},
 *       "args": [{"_type": "Constant", "value": "hi"}], "keywords": []}}
 * ]}
 * </pre>
 *
 * <h3>Mapping rules:</h3>
 * <ul>
 *   <li>Node kinds outside the node model become {@link OpaqueStatement} or
 *       {@link OpaqueExpression}, so the emitters can substitute a placeholder.</li>
 *   <li>Shapes the model cannot express faithfully (multi-target assignment, keyword
 *       arguments, slices, loop {@code else} branches) also become opaque nodes.</li>
 *   <li>Structurally broken input (not JSON, missing kind, missing required member,
 *       blank identifiers) raises {@link ParseUnavailableException}.</li>
 * </ul>
 */
@ApplicationScoped
public class SyntaxTreeReader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses a JSON document holding a {@code Module} node.
     *
     * @param json JSON text
     * @return the program tree
     * @throws ParseUnavailableException when the text is not a readable tree
     */
    public Program read(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new ParseUnavailableException("Syntax tree document is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ParseUnavailableException("Syntax tree is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return read(root);
    }

    /**
     * Parses a translation document: {@code {"source": "...", "tree": {...}}}.
     * The tree member is kept unconverted so callers can fall back to the source when
     * it is missing or unreadable.
     *
     * @throws ParseUnavailableException when the text is not a JSON object
     */
    public SourceDocument readDocument(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new ParseUnavailableException("Document is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ParseUnavailableException("Document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ParseUnavailableException("Document must be a JSON object");
        }
        JsonNode source = root.get("source");
        return new SourceDocument(source != null && source.isTextual() ? source.asText() : null, root.get("tree"));
    }

    /**
     * Converts an already-parsed JSON tree holding a {@code Module} node.
     */
    public Program read(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new ParseUnavailableException("Syntax tree is missing");
        }
        String kind = kindOf(root);
        if (!"Module".equals(kind)) {
            throw new ParseUnavailableException("Syntax tree root must be a Module, found " + kind);
        }
        try {
            return new Program(statements(root, "body"));
        } catch (IllegalArgumentException e) {
            // node constructors reject values the JSON shape checks let through
            throw new ParseUnavailableException("Syntax tree is malformed: " + e.getMessage(), e);
        }
    }

    // ========== STATEMENTS ==========

    private List<Statement> statements(JsonNode owner, String field) {
        JsonNode array = required(owner, field);
        if (!array.isArray()) {
            throw new ParseUnavailableException("Member '" + field + "' of " + kindOf(owner) + " must be a list");
        }
        List<Statement> result = new ArrayList<>();
        for (JsonNode child : array) {
            result.add(statement(child));
        }
        return result;
    }

    private Statement statement(JsonNode node) {
        String kind = kindOf(node);
        switch (kind) {
            case "FunctionDef":
                return new FunctionDef(text(node, "name"), parameters(required(node, "args")),
                        statements(node, "body"));
            case "ClassDef":
                return new ClassDef(text(node, "name"), expressions(node, "bases"), statements(node, "body"));
            case "Assign": {
                List<Expression> targets = expressions(node, "targets");
                if (targets.size() != 1) {
                    return new OpaqueStatement("Assign");
                }
                return new Assign(targets.get(0), expression(required(node, "value")));
            }
            case "AnnAssign": {
                JsonNode value = node.get("value");
                if (value == null || value.isNull()) {
                    return new OpaqueStatement(kind);
                }
                return new Assign(expression(required(node, "target")), expression(value));
            }
            case "AugAssign": {
                BinaryOperator op = BinaryOperator.fromAstName(kindOf(required(node, "op")));
                if (op == null) {
                    return new OpaqueStatement(kind);
                }
                return new AugAssign(expression(required(node, "target")), op, expression(required(node, "value")));
            }
            case "If":
                return new If(expression(required(node, "test")), statements(node, "body"),
                        optionalStatements(node, "orelse"));
            case "For":
                if (!optionalStatements(node, "orelse").isEmpty()) {
                    return new OpaqueStatement("For");
                }
                return new For(expression(required(node, "target")), expression(required(node, "iter")),
                        statements(node, "body"));
            case "While":
                if (!optionalStatements(node, "orelse").isEmpty()) {
                    return new OpaqueStatement("While");
                }
                return new While(expression(required(node, "test")), statements(node, "body"));
            case "Return": {
                JsonNode value = node.get("value");
                return value == null || value.isNull() ? new Return() : new Return(expression(value));
            }
            case "Expr":
                return new ExprStmt(expression(required(node, "value")));
            case "Pass":
                return new Pass();
            case "Break":
                return new Break();
            case "Continue":
                return new Continue();
            case "Import":
                return new Import(importedNames(node));
            case "ImportFrom": {
                JsonNode module = node.get("module");
                String name = module == null || module.isNull() ? "." : module.asText();
                return new Import(List.of(name));
            }
            default:
                return new OpaqueStatement(kind);
        }
    }

    private List<Statement> optionalStatements(JsonNode owner, String field) {
        JsonNode array = owner.get(field);
        if (array == null || array.isNull()) {
            return List.of();
        }
        return statements(owner, field);
    }

    private List<String> parameters(JsonNode args) {
        List<String> params = new ArrayList<>();
        // either the origin's "arguments" node or a plain list of names
        JsonNode list = args.isArray() ? args : args.get("args");
        if (list == null || !list.isArray()) {
            throw new ParseUnavailableException("Function arguments must hold an 'args' list");
        }
        for (JsonNode arg : list) {
            if (arg.isTextual()) {
                params.add(arg.asText());
            } else {
                params.add(text(arg, "arg"));
            }
        }
        return params;
    }

    private List<String> importedNames(JsonNode node) {
        List<String> modules = new ArrayList<>();
        for (JsonNode alias : required(node, "names")) {
            modules.add(text(alias, "name"));
        }
        return modules;
    }

    // ========== EXPRESSIONS ==========

    private List<Expression> expressions(JsonNode owner, String field) {
        JsonNode array = required(owner, field);
        if (!array.isArray()) {
            throw new ParseUnavailableException("Member '" + field + "' of " + kindOf(owner) + " must be a list");
        }
        List<Expression> result = new ArrayList<>();
        for (JsonNode child : array) {
            result.add(expression(child));
        }
        return result;
    }

    private Expression expression(JsonNode node) {
        String kind = kindOf(node);
        switch (kind) {
            case "Constant":
                return constant(node);
            case "Name":
                return new Name(text(node, "id"));
            case "Call": {
                JsonNode keywords = node.get("keywords");
                if (keywords != null && keywords.isArray() && keywords.size() > 0) {
                    return new OpaqueExpression("Call");
                }
                return new Call(expression(required(node, "func")), expressions(node, "args"));
            }
            case "BinOp": {
                BinaryOperator op = BinaryOperator.fromAstName(kindOf(required(node, "op")));
                if (op == null) {
                    return new OpaqueExpression(kind);
                }
                return new BinOp(expression(required(node, "left")), op, expression(required(node, "right")));
            }
            case "Compare":
                return compare(node);
            case "Attribute":
                return new Attribute(expression(required(node, "value")), text(node, "attr"));
            case "Subscript": {
                JsonNode slice = required(node, "slice");
                // older parsers wrap plain indexes in an Index node
                if ("Index".equals(kindOf(slice))) {
                    slice = required(slice, "value");
                }
                if ("Slice".equals(kindOf(slice)) || "ExtSlice".equals(kindOf(slice))) {
                    return new OpaqueExpression("Subscript");
                }
                return new Subscript(expression(required(node, "value")), expression(slice));
            }
            case "List":
                return new ListLit(expressions(node, "elts"));
            case "Tuple":
                return new TupleLit(expressions(node, "elts"));
            case "Dict":
                return dict(node);
            case "UnaryOp": {
                UnaryOperator op = UnaryOperator.fromAstName(kindOf(required(node, "op")));
                if (op == null) {
                    return new OpaqueExpression(kind);
                }
                return new UnaryOp(op, expression(required(node, "operand")));
            }
            case "BoolOp": {
                BooleanOperator op = BooleanOperator.fromAstName(kindOf(required(node, "op")));
                List<Expression> values = expressions(node, "values");
                if (op == null || values.size() < 2) {
                    return new OpaqueExpression(kind);
                }
                return new BoolOp(op, values);
            }
            case "IfExp":
                return new Conditional(expression(required(node, "test")), expression(required(node, "body")),
                        expression(required(node, "orelse")));
            default:
                return new OpaqueExpression(kind);
        }
    }

    private Expression constant(JsonNode node) {
        JsonNode value = node.get("value");
        if (value == null || value.isNull()) {
            return Constant.none();
        }
        if (value.isTextual()) {
            return new Constant(value.asText());
        }
        if (value.isBoolean()) {
            return new Constant(value.booleanValue());
        }
        if (value.isNumber()) {
            return new Constant(value.numberValue());
        }
        // bytes, ellipsis and complex numbers have no JSON scalar form
        return new OpaqueExpression("Constant");
    }

    private Expression compare(JsonNode node) {
        List<CompareOperator> ops = new ArrayList<>();
        for (JsonNode op : required(node, "ops")) {
            CompareOperator compareOp = CompareOperator.fromAstName(kindOf(op));
            if (compareOp == null) {
                return new OpaqueExpression("Compare");
            }
            ops.add(compareOp);
        }
        List<Expression> comparators = expressions(node, "comparators");
        if (ops.isEmpty() || ops.size() != comparators.size()) {
            throw new ParseUnavailableException("Compare node needs one comparator per operator");
        }
        return new Compare(expression(required(node, "left")), ops, comparators);
    }

    private Expression dict(JsonNode node) {
        JsonNode keys = required(node, "keys");
        JsonNode values = required(node, "values");
        if (keys.size() != values.size()) {
            throw new ParseUnavailableException("Dict node needs one value per key");
        }
        List<DictLit.Pair> pairs = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            // a null key is a ** unpacking entry
            if (keys.get(i).isNull()) {
                return new OpaqueExpression("Dict");
            }
            pairs.add(new DictLit.Pair(expression(keys.get(i)), expression(values.get(i))));
        }
        return new DictLit(pairs);
    }

    // ========== HELPERS ==========

    private static String kindOf(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ParseUnavailableException("Syntax tree node must be a JSON object");
        }
        JsonNode kind = node.has("_type") ? node.get("_type") : node.get("type");
        if (kind == null || !kind.isTextual() || kind.asText().isEmpty()) {
            throw new ParseUnavailableException("Syntax tree node has no '_type' member");
        }
        return kind.asText();
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ParseUnavailableException("Node " + kindOf(node) + " is missing member '" + field + "'");
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isTextual() || value.asText().isEmpty()) {
            throw new ParseUnavailableException("Member '" + field + "' of " + kindOf(node) + " must be a name");
        }
        return value.asText();
    }
}
