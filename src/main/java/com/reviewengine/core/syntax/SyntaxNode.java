package com.reviewengine.core.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SyntaxNode - one node of a parsed Python program.
 *
 * A node is a tagged variant: {@link #getKind()} says which construct it is and
 * the named child fields carry its sub-nodes in Python ast field order
 * (e.g. FunctionDef: args, body, decorator_list, returns). String-valued
 * attributes live in {@code identifier} (Name.id, FunctionDef.name, arg.arg,
 * Attribute.attr, ExceptHandler.name, alias.name, keyword.arg, ImportFrom.module,
 * MatchAs.name, the operator class of BinOp/UnaryOp/BoolOp/AugAssign, and the
 * repr of a Constant's value), {@code asName} (alias.asname) and {@code names}
 * (Global/Nonlocal names, Compare operators, ImportFrom level).
 *
 * Nodes are immutable once built.
 */
public final class SyntaxNode {

    private final NodeKind kind;
    private final int line;
    private final String identifier;
    private final String asName;
    private final ExprContext context;
    private final Map<String, List<SyntaxNode>> fields;
    private final List<String> names;

    private SyntaxNode(Builder builder) {
        this.kind = builder.kind;
        this.line = builder.line;
        this.identifier = builder.identifier;
        this.asName = builder.asName;
        this.context = builder.context;
        Map<String, List<SyntaxNode>> copy = new LinkedHashMap<>();
        builder.fields.forEach((name, nodes) -> copy.put(name, List.copyOf(nodes)));
        this.fields = Collections.unmodifiableMap(copy);
        this.names = List.copyOf(builder.names);
    }

    public static Builder builder(NodeKind kind, int line) {
        return new Builder(kind, line);
    }

    public NodeKind getKind()       { return kind; }
    public int getLine()            { return line; }
    public String getIdentifier()   { return identifier; }
    public String getAsName()       { return asName; }
    public ExprContext getContext() { return context; }
    public List<String> getNames()  { return names; }

    /**
     * Nodes stored under the given field name, empty when the field is absent.
     */
    public List<SyntaxNode> field(String name) {
        return fields.getOrDefault(name, List.of());
    }

    /**
     * The single node stored under the given field, or {@code null}.
     */
    public SyntaxNode single(String name) {
        List<SyntaxNode> nodes = field(name);
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    public List<SyntaxNode> getBody()    { return field("body"); }
    public List<SyntaxNode> getTargets() { return field("targets"); }
    public SyntaxNode getTarget()        { return single("target"); }
    public SyntaxNode getValue()         { return single("value"); }

    /**
     * Every parameter of a FunctionDef or Lambda, in declaration order.
     */
    public List<SyntaxNode> getParameters() {
        SyntaxNode arguments = single("args");
        if (arguments == null || arguments.getKind() != NodeKind.ARGUMENTS) {
            return List.of();
        }
        List<SyntaxNode> params = new ArrayList<>();
        params.addAll(arguments.field("posonlyargs"));
        params.addAll(arguments.field("args"));
        params.addAll(arguments.field("vararg"));
        params.addAll(arguments.field("kwonlyargs"));
        params.addAll(arguments.field("kwarg"));
        return params;
    }

    /**
     * Direct children in field order, the order Python's ast.iter_child_nodes yields.
     */
    public List<SyntaxNode> children() {
        List<SyntaxNode> children = new ArrayList<>();
        for (List<SyntaxNode> nodes : fields.values()) {
            children.addAll(nodes);
        }
        return children;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        sb.append('@').append(line);
        if (identifier != null) {
            sb.append('(').append(identifier).append(')');
        }
        return sb.toString();
    }

    public static final class Builder {

        private final NodeKind kind;
        private final int line;
        private String identifier;
        private String asName;
        private ExprContext context;
        private final Map<String, List<SyntaxNode>> fields = new LinkedHashMap<>();
        private final List<String> names = new ArrayList<>();

        private Builder(NodeKind kind, int line) {
            this.kind = kind;
            this.line = line;
        }

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder asName(String asName) {
            this.asName = asName;
            return this;
        }

        public Builder context(ExprContext context) {
            this.context = context;
            return this;
        }

        public Builder names(List<String> names) {
            this.names.addAll(names);
            return this;
        }

        /** Adds one node to a field; {@code null} declares the field but adds nothing. */
        public Builder child(String field, SyntaxNode node) {
            List<SyntaxNode> nodes = fields.computeIfAbsent(field, k -> new ArrayList<>());
            if (node != null) {
                nodes.add(node);
            }
            return this;
        }

        public Builder children(String field, List<SyntaxNode> nodes) {
            fields.computeIfAbsent(field, k -> new ArrayList<>()).addAll(nodes);
            return this;
        }

        public SyntaxNode build() {
            return new SyntaxNode(this);
        }
    }
}
