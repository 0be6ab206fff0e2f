package org.refactor.flowchart.syntax;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 表驱动的适配器，适用于 tree-sitter 一类按 kind 名称区分节点的语法树。
 * <p>
 * kind 到语句形态的映射、字段别名、调用节点类型以及高阶函数和 Promise 方法名全部是构造时传入的数据。
 */
public class KindTableAdapter implements LanguageAdapter {

    private final String language;
    private final Map<String, StatementKind> kinds;
    private final Map<String, String> fieldAliases;
    private final Set<String> callKinds;
    private final Set<String> noFallthroughSwitchKinds;
    private final Set<String> defaultCaseKinds;
    private final Set<String> constantTrueTexts;
    private final Map<String, IterationOp> iterationMethods;
    private final Map<String, PromiseLink> promiseMethods;
    private final CaseFallthrough fallthrough;
    private final String functionNameField;
    private final String functionBodyField;

    protected KindTableAdapter(Builder builder) {
        this.language = builder.language;
        this.kinds = Map.copyOf(builder.kinds);
        this.fieldAliases = Map.copyOf(builder.fieldAliases);
        this.callKinds = Set.copyOf(builder.callKinds);
        this.noFallthroughSwitchKinds = Set.copyOf(builder.noFallthroughSwitchKinds);
        this.defaultCaseKinds = Set.copyOf(builder.defaultCaseKinds);
        this.constantTrueTexts = Set.copyOf(builder.constantTrueTexts);
        this.iterationMethods = Map.copyOf(builder.iterationMethods);
        this.promiseMethods = Map.copyOf(builder.promiseMethods);
        this.fallthrough = builder.fallthrough;
        this.functionNameField = builder.functionNameField;
        this.functionBodyField = builder.functionBodyField;
    }

    public static Builder builder(String language) {
        return new Builder(language);
    }

    @Override
    public String language() {
        return language;
    }

    @Override
    public StatementKind classify(SyntaxNode node) {
        return kinds.getOrDefault(node.kind(), StatementKind.DEFAULT);
    }

    @Override
    public String functionName(SyntaxNode function) {
        return function.field(functionNameField).map(SyntaxNode::text).orElse("[anonymous]");
    }

    @Override
    public Optional<SyntaxNode> functionBody(SyntaxNode function) {
        return function.field(functionBodyField);
    }

    @Override
    public Optional<SyntaxNode> field(SyntaxNode node, String role) {
        Optional<SyntaxNode> direct = node.field(resolve(node, role));
        return direct.isPresent() ? direct : node.field(role);
    }

    @Override
    public List<SyntaxNode> fields(SyntaxNode node, String role) {
        List<SyntaxNode> direct = node.fields(resolve(node, role));
        return direct.isEmpty() ? node.fields(role) : direct;
    }

    @Override
    public boolean isConstantTrue(SyntaxNode condition) {
        return constantTrueTexts.contains(condition.text().trim());
    }

    @Override
    public CaseFallthrough fallthrough(SyntaxNode switchNode, SyntaxNode caseClause) {
        return noFallthroughSwitchKinds.contains(switchNode.kind()) ? CaseFallthrough.NONE : fallthrough;
    }

    @Override
    public boolean isDefaultCase(SyntaxNode caseClause) {
        return defaultCaseKinds.contains(caseClause.kind()) || LanguageAdapter.super.isDefaultCase(caseClause);
    }

    @Override
    public boolean isCall(SyntaxNode expression) {
        return callKinds.contains(expression.kind());
    }

    @Override
    public Optional<IterationOp> iterationOp(String methodName) {
        return Optional.ofNullable(iterationMethods.get(methodName));
    }

    @Override
    public Optional<PromiseLink> promiseLink(String methodName) {
        return Optional.ofNullable(promiseMethods.get(methodName));
    }

    // "kind.role" 优先于 "role"
    private String resolve(SyntaxNode node, String role) {
        String specific = fieldAliases.get(node.kind() + "." + role);
        if (specific != null) {
            return specific;
        }
        return fieldAliases.getOrDefault(role, role);
    }

    public static class Builder {
        private final String language;
        private final Map<String, StatementKind> kinds = new HashMap<>();
        private final Map<String, String> fieldAliases = new HashMap<>();
        private final Set<String> callKinds = new HashSet<>();
        private final Set<String> noFallthroughSwitchKinds = new HashSet<>();
        private final Set<String> defaultCaseKinds = new HashSet<>();
        private final Set<String> constantTrueTexts = new HashSet<>(List.of("true"));
        private final Map<String, IterationOp> iterationMethods = new HashMap<>();
        private final Map<String, PromiseLink> promiseMethods = new HashMap<>();
        private CaseFallthrough fallthrough = CaseFallthrough.NONE;
        private String functionNameField = "name";
        private String functionBodyField = "body";

        protected Builder(String language) {
            this.language = language;
        }

        public Builder kinds(StatementKind kind, String... kindNames) {
            for (String name : kindNames) {
                kinds.put(name, kind);
            }
            return this;
        }

        /**
         * 规范字段名到语法自身字段名的别名，可用 "kind.role" 只对某类节点生效
         */
        public Builder alias(String role, String nativeField) {
            fieldAliases.put(role, nativeField);
            return this;
        }

        public Builder callKinds(String... kindNames) {
            callKinds.addAll(Arrays.asList(kindNames));
            return this;
        }

        public Builder fallthrough(CaseFallthrough policy) {
            this.fallthrough = policy;
            return this;
        }

        /**
         * 这些 switch 类节点（如 match）的分支从不落入下一分支
         */
        public Builder noFallthrough(String... switchKinds) {
            noFallthroughSwitchKinds.addAll(Arrays.asList(switchKinds));
            return this;
        }

        public Builder defaultCaseKinds(String... caseKinds) {
            defaultCaseKinds.addAll(Arrays.asList(caseKinds));
            return this;
        }

        public Builder constantTrue(String... texts) {
            constantTrueTexts.addAll(Arrays.asList(texts));
            return this;
        }

        public Builder iteration(IterationOp op, String... methodNames) {
            for (String name : methodNames) {
                iterationMethods.put(name, op);
            }
            return this;
        }

        public Builder promise(PromiseLink link, String... methodNames) {
            for (String name : methodNames) {
                promiseMethods.put(name, link);
            }
            return this;
        }

        public Builder function(String nameField, String bodyField) {
            this.functionNameField = nameField;
            this.functionBodyField = bodyField;
            return this;
        }

        public KindTableAdapter build() {
            if (kinds.isEmpty()) {
                throw new IllegalStateException("kind table for " + language + " is empty");
            }
            return new KindTableAdapter(this);
        }
    }
}
