package org.smtlower.symbolic;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtlower.core.ConcreteValue;
import org.smtlower.core.Kind;
import org.smtlower.core.NodeRef;
import org.smtlower.expressions.Assignment;
import org.smtlower.expressions.NodeExpr;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 执行上下文：符号值在其中被创建和组合的可变会话。
 * <p>
 * 每个字段都是一个可变容器的引用。lowering 分叉子上下文时，由 {@code ForkManifest} 逐字段决定
 * 是按引用共享父上下文的容器、复制一份，还是重新分配。因此新增字段时必须同时在
 * {@code ContextField} 和 {@code ForkManifest} 中登记。
 * <p>
 * 此类不是线程安全的：同一个上下文不能被多个线程同时修改。
 */
@Getter
public final class ExecutionContext {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionContext.class);

    private final SolverConfig config;
    private final Instant startTime;
    private final SVal pathCondition;
    private final SessionMode sessionMode;
    private final AtomicBoolean queryMode;
    private final List<NamedNode> observables;
    private final AtomicInteger nodeCounter;
    private final int lambdaLevel;
    private final Set<Kind> usedKinds;
    private final Set<String> usedLabels;
    private final List<NamedInput> inputs;
    private final List<NamedInput> trackers;
    private final List<NodeRef> constraints;
    private final List<NodeRef> outputs;
    private final List<TableInfo> tables;
    private final List<Assignment> assignments;
    private final Map<ConcreteValue, NodeRef> constants;
    private final Map<NodeExpr, NodeRef> exprCache;
    private final List<ArrayInfo> arrays;
    private final Map<String, FunctionSignature> uninterpreted;
    private final Set<String> userFunctions;
    private final Map<String, List<String>> codeSegments;
    private final List<SmtFunctionDef> definitions;
    private final Map<String, String> smtOptions;
    private final List<NamedNode> assertions;
    private final Map<String, String> axioms;

    private ExecutionContext(Builder b) {
        this.config = Objects.requireNonNull(b.config, "ExecutionContext: config 不能为 null");
        this.startTime = Objects.requireNonNull(b.startTime, "ExecutionContext: startTime 不能为 null");
        this.pathCondition = Objects.requireNonNull(b.pathCondition, "ExecutionContext: pathCondition 不能为 null");
        this.sessionMode = Objects.requireNonNull(b.sessionMode, "ExecutionContext: sessionMode 不能为 null");
        this.queryMode = Objects.requireNonNull(b.queryMode, "ExecutionContext: queryMode 不能为 null");
        this.observables = Objects.requireNonNull(b.observables, "ExecutionContext: observables 不能为 null");
        this.nodeCounter = Objects.requireNonNull(b.nodeCounter, "ExecutionContext: nodeCounter 不能为 null");
        this.lambdaLevel = b.lambdaLevel;
        this.usedKinds = Objects.requireNonNull(b.usedKinds, "ExecutionContext: usedKinds 不能为 null");
        this.usedLabels = Objects.requireNonNull(b.usedLabels, "ExecutionContext: usedLabels 不能为 null");
        this.inputs = Objects.requireNonNull(b.inputs, "ExecutionContext: inputs 不能为 null");
        this.trackers = Objects.requireNonNull(b.trackers, "ExecutionContext: trackers 不能为 null");
        this.constraints = Objects.requireNonNull(b.constraints, "ExecutionContext: constraints 不能为 null");
        this.outputs = Objects.requireNonNull(b.outputs, "ExecutionContext: outputs 不能为 null");
        this.tables = Objects.requireNonNull(b.tables, "ExecutionContext: tables 不能为 null");
        this.assignments = Objects.requireNonNull(b.assignments, "ExecutionContext: assignments 不能为 null");
        this.constants = Objects.requireNonNull(b.constants, "ExecutionContext: constants 不能为 null");
        this.exprCache = Objects.requireNonNull(b.exprCache, "ExecutionContext: exprCache 不能为 null");
        this.arrays = Objects.requireNonNull(b.arrays, "ExecutionContext: arrays 不能为 null");
        this.uninterpreted = Objects.requireNonNull(b.uninterpreted, "ExecutionContext: uninterpreted 不能为 null");
        this.userFunctions = Objects.requireNonNull(b.userFunctions, "ExecutionContext: userFunctions 不能为 null");
        this.codeSegments = Objects.requireNonNull(b.codeSegments, "ExecutionContext: codeSegments 不能为 null");
        this.definitions = Objects.requireNonNull(b.definitions, "ExecutionContext: definitions 不能为 null");
        this.smtOptions = Objects.requireNonNull(b.smtOptions, "ExecutionContext: smtOptions 不能为 null");
        this.assertions = Objects.requireNonNull(b.assertions, "ExecutionContext: assertions 不能为 null");
        this.axioms = Objects.requireNonNull(b.axioms, "ExecutionContext: axioms 不能为 null");
    }

    /**
     * 创建一个顶层会话 (lambda 层级为 0)。
     */
    public static ExecutionContext newSession(SolverConfig config, SessionMode mode) {
        ExecutionContext ctx = builder()
                .config(config)
                .startTime(Instant.now())
                .pathCondition(SVal.TRUE)
                .sessionMode(mode)
                .queryMode(new AtomicBoolean(false))
                .observables(new ArrayList<>())
                .nodeCounter(new AtomicInteger(0))
                .lambdaLevel(0)
                .usedKinds(new LinkedHashSet<>())
                .usedLabels(new LinkedHashSet<>())
                .inputs(new ArrayList<>())
                .trackers(new ArrayList<>())
                .constraints(new ArrayList<>())
                .outputs(new ArrayList<>())
                .tables(new ArrayList<>())
                .assignments(new ArrayList<>())
                .constants(initialConstants())
                .exprCache(new LinkedHashMap<>())
                .arrays(new ArrayList<>())
                .uninterpreted(new LinkedHashMap<>())
                .userFunctions(new LinkedHashSet<>())
                .codeSegments(new LinkedHashMap<>())
                .definitions(new ArrayList<>())
                .smtOptions(new LinkedHashMap<>())
                .assertions(new ArrayList<>())
                .axioms(new LinkedHashMap<>())
                .build();
        logger.info("创建顶层会话: mode={}, {}", mode, config);
        return ctx;
    }

    public static ExecutionContext newSession() {
        return newSession(SolverConfig.defaults(), SessionMode.PROOF);
    }

    /**
     * 新的常量池，预置两个布尔字面量。
     */
    public static Map<ConcreteValue, NodeRef> initialConstants() {
        Map<ConcreteValue, NodeRef> m = new LinkedHashMap<>();
        m.put(ConcreteValue.FALSE, NodeRef.FALSE);
        m.put(ConcreteValue.TRUE, NodeRef.TRUE);
        return m;
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- 节点构造 ---

    private NodeRef newNode(Kind kind) {
        usedKinds.add(kind);
        return new NodeRef(kind, lambdaLevel, nodeCounter.getAndIncrement());
    }

    /**
     * 为表达式分配节点。相同的 (运算符, 操作数句柄) 只分配一次，赋值按创建顺序追加。
     */
    public NodeRef newExpr(Kind kind, NodeExpr expr) {
        NodeRef existing = exprCache.get(expr);
        if (existing != null) {
            return existing;
        }
        NodeRef node = newNode(kind);
        assignments.add(new Assignment(node, expr));
        exprCache.put(expr, node);
        logger.debug("新节点 {} = {}", node, expr);
        return node;
    }

    /**
     * 取常量对应的节点，必要时分配。布尔字面量总是映射到保留句柄。
     */
    public NodeRef constant(ConcreteValue cv) {
        NodeRef existing = constants.get(cv);
        if (existing != null) {
            return existing;
        }
        NodeRef node = newNode(cv.getKind());
        constants.put(cv, node);
        logger.debug("新常量 {} = {}", node, cv);
        return node;
    }

    // --- 输入 ---

    private SVal declareInput(List<NamedInput> target, Quantifier q, Kind kind, String name) {
        NodeRef node = newNode(kind);
        target.add(new NamedInput(q, node, name));
        logger.debug("声明输入 {} {} :: {}", q, name == null ? node : name, kind);
        return SVal.input(kind, node);
    }

    /**
     * 一个全称量化的输入；lowering 中它就是 lambda 的参数。
     */
    public SVal forall(Kind kind, String name) {
        return declareInput(inputs, Quantifier.ALL, kind, name);
    }

    public SVal freshInput(Kind kind) {
        return forall(kind, null);
    }

    public SVal exists(Kind kind, String name) {
        return declareInput(inputs, Quantifier.EX, kind, name);
    }

    /**
     * 仅用于内部记账的输入，不面向用户。
     */
    public SVal tracker(Kind kind, String name) {
        return declareInput(trackers, Quantifier.EX, kind, name);
    }

    // --- 输出和附带产物 ---

    public void output(SVal v) {
        outputs.add(v.toNode(this));
    }

    public void observe(String name, SVal v) {
        observables.add(new NamedNode(name, v.toNode(this)));
        usedLabels.add(name);
    }

    public void addCodeSegment(String function, List<String> lines) {
        codeSegments.put(function, List.copyOf(lines));
    }

    /**
     * 登记一张自动构造的查找表。
     * @return 表编号。
     */
    public int newTable(Kind indexKind, Kind resultKind, List<SVal> elements) {
        List<NodeRef> nodes = new ArrayList<>();
        for (SVal e : elements) {
            nodes.add(e.toNode(this));
        }
        int id = tables.size();
        tables.add(new TableInfo(id, indexKind, resultKind, nodes));
        return id;
    }

    /**
     * 登记一个数组。
     * @return 数组编号。
     */
    public int newArray(String name, Kind keyKind, Kind valueKind) {
        int id = arrays.size();
        arrays.add(new ArrayInfo(id, name == null ? "array_" + id : name, keyKind, valueKind));
        return id;
    }

    public void constrain(SVal condition) {
        requireBool(condition, "constrain");
        constraints.add(condition.toNode(this));
    }

    public void addAssertion(String name, SVal condition) {
        requireBool(condition, "addAssertion");
        assertions.add(new NamedNode(name, condition.toNode(this)));
        usedLabels.add(name);
    }

    public void addAxiom(String label, String text) {
        axioms.put(label, text);
        usedLabels.add(label);
    }

    public void setOption(String key, String value) {
        smtOptions.put(key, value);
    }

    /**
     * 登记未解释函数。同名函数的签名必须一致。
     * @throws IllegalArgumentException 如果同名函数已以不同签名登记。
     */
    public void registerUninterpreted(String name, FunctionSignature signature) {
        FunctionSignature previous = uninterpreted.putIfAbsent(name, signature);
        if (previous != null && !previous.equals(signature)) {
            logger.error("未解释函数 {} 的签名冲突: 已有 {}, 新的 {}", name, previous, signature);
            throw new IllegalArgumentException("未解释函数 " + name + " 的签名冲突: 已有 " + previous + ", 新的 " + signature);
        }
    }

    /**
     * 登记一个具名函数定义，等待声明时输出。
     */
    public void addDefinition(SmtFunctionDef def) {
        definitions.add(def);
        userFunctions.add(def.getName());
        logger.info("登记具名函数定义: {}", def);
    }

    private static void requireBool(SVal v, String where) {
        if (!v.getKind().isBoolean()) {
            logger.error("{}: 需要布尔值, 实际为 {}", where, v.getKind());
            throw new IllegalArgumentException(where + " 需要布尔值, 实际为: " + v.getKind());
        }
    }

    /**
     * 记录共享登记表的当前大小，用于在回放结束后截取回放期间新增的条目。
     */
    public RegistrySnapshot snapshot() {
        return new RegistrySnapshot(usedKinds.size(), usedLabels.size(), observables.size(), codeSegments.size(),
                tables.size(), arrays.size(), assertions.size(), uninterpreted.size(), userFunctions.size(),
                definitions.size(), axioms.size());
    }

    /**
     * 把共享登记表截断回快照时的大小，丢弃之后新增的条目。
     * 已有键被覆盖的情况 (代码段、SMT 选项) 无法恢复。
     */
    public void rollback(RegistrySnapshot before) {
        truncate(usedKinds, before.getUsedKinds());
        truncate(usedLabels, before.getUsedLabels());
        truncate(observables, before.getObservables());
        truncate(codeSegments.keySet(), before.getCodeSegments());
        truncate(tables, before.getTables());
        truncate(arrays, before.getArrays());
        truncate(assertions, before.getAssertions());
        truncate(uninterpreted.keySet(), before.getUninterpreted());
        truncate(userFunctions, before.getUserFunctions());
        truncate(definitions, before.getDefinitions());
        truncate(axioms.keySet(), before.getAxioms());
        logger.debug("共享登记表已回滚到 {}", before);
    }

    private static void truncate(Collection<?> registry, int size) {
        Iterator<?> it = registry.iterator();
        for (int i = 0; it.hasNext(); i++) {
            it.next();
            if (i >= size) {
                it.remove();
            }
        }
    }

    @Override
    public String toString() {
        return "ExecutionContext{mode=" + sessionMode + ", level=" + lambdaLevel
                + ", nodes=" + nodeCounter.get() + ", inputs=" + inputs.size()
                + ", assignments=" + assignments.size() + "}";
    }

    /**
     * 逐字段构造上下文。顶层会话和分叉都经过这里。
     */
    public static final class Builder {
        private SolverConfig config;
        private Instant startTime;
        private SVal pathCondition;
        private SessionMode sessionMode;
        private AtomicBoolean queryMode;
        private List<NamedNode> observables;
        private AtomicInteger nodeCounter;
        private int lambdaLevel;
        private Set<Kind> usedKinds;
        private Set<String> usedLabels;
        private List<NamedInput> inputs;
        private List<NamedInput> trackers;
        private List<NodeRef> constraints;
        private List<NodeRef> outputs;
        private List<TableInfo> tables;
        private List<Assignment> assignments;
        private Map<ConcreteValue, NodeRef> constants;
        private Map<NodeExpr, NodeRef> exprCache;
        private List<ArrayInfo> arrays;
        private Map<String, FunctionSignature> uninterpreted;
        private Set<String> userFunctions;
        private Map<String, List<String>> codeSegments;
        private List<SmtFunctionDef> definitions;
        private Map<String, String> smtOptions;
        private List<NamedNode> assertions;
        private Map<String, String> axioms;

        private Builder() {
        }

        public Builder config(SolverConfig v) { this.config = v; return this; }
        public Builder startTime(Instant v) { this.startTime = v; return this; }
        public Builder pathCondition(SVal v) { this.pathCondition = v; return this; }
        public Builder sessionMode(SessionMode v) { this.sessionMode = v; return this; }
        public Builder queryMode(AtomicBoolean v) { this.queryMode = v; return this; }
        public Builder observables(List<NamedNode> v) { this.observables = v; return this; }
        public Builder nodeCounter(AtomicInteger v) { this.nodeCounter = v; return this; }
        public Builder lambdaLevel(int v) { this.lambdaLevel = v; return this; }
        public Builder usedKinds(Set<Kind> v) { this.usedKinds = v; return this; }
        public Builder usedLabels(Set<String> v) { this.usedLabels = v; return this; }
        public Builder inputs(List<NamedInput> v) { this.inputs = v; return this; }
        public Builder trackers(List<NamedInput> v) { this.trackers = v; return this; }
        public Builder constraints(List<NodeRef> v) { this.constraints = v; return this; }
        public Builder outputs(List<NodeRef> v) { this.outputs = v; return this; }
        public Builder tables(List<TableInfo> v) { this.tables = v; return this; }
        public Builder assignments(List<Assignment> v) { this.assignments = v; return this; }
        public Builder constants(Map<ConcreteValue, NodeRef> v) { this.constants = v; return this; }
        public Builder exprCache(Map<NodeExpr, NodeRef> v) { this.exprCache = v; return this; }
        public Builder arrays(List<ArrayInfo> v) { this.arrays = v; return this; }
        public Builder uninterpreted(Map<String, FunctionSignature> v) { this.uninterpreted = v; return this; }
        public Builder userFunctions(Set<String> v) { this.userFunctions = v; return this; }
        public Builder codeSegments(Map<String, List<String>> v) { this.codeSegments = v; return this; }
        public Builder definitions(List<SmtFunctionDef> v) { this.definitions = v; return this; }
        public Builder smtOptions(Map<String, String> v) { this.smtOptions = v; return this; }
        public Builder assertions(List<NamedNode> v) { this.assertions = v; return this; }
        public Builder axioms(Map<String, String> v) { this.axioms = v; return this; }

        public ExecutionContext build() {
            return new ExecutionContext(this);
        }
    }
}
