package com.lazyduck.expression;

import com.lazyduck.exception.ColumnNotFoundException;
import com.lazyduck.exception.PlanConstructionException;
import com.lazyduck.exception.UnknownAttributeException;
import com.lazyduck.exception.UnknownCategoriesException;
import com.lazyduck.graph.GraphBuilder;
import com.lazyduck.graph.Task;
import com.lazyduck.graph.TaskGraph;
import com.lazyduck.graph.TaskKey;
import com.lazyduck.optimizer.RewriteRule;
import com.lazyduck.reduction.Count;
import com.lazyduck.reduction.DropDuplicates;
import com.lazyduck.reduction.GroupBy;
import com.lazyduck.reduction.Len;
import com.lazyduck.reduction.Max;
import com.lazyduck.reduction.Min;
import com.lazyduck.reduction.Size;
import com.lazyduck.reduction.Sum;
import com.lazyduck.reduction.Unique;
import com.lazyduck.reduction.ValueCounts;
import com.lazyduck.schema.Divisions;
import com.lazyduck.schema.Meta;
import com.lazyduck.types.CategoricalType;
import com.lazyduck.types.DataType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Abstract base class for all nodes of the lazy expression tree.
 *
 * <p>An expression is an immutable operator node: its kind, its ordered
 * operands (other expressions or literal parameters) and three derived
 * values that are computed on first use and memoized:
 * <ul>
 *   <li>{@link #name()}: content-addressed identity, {@code kind-hash(operands)}</li>
 *   <li>{@link #meta()}: zero-row description of the output</li>
 *   <li>{@link #divisions()}: partition boundaries of the output</li>
 * </ul>
 *
 * <p>Two expressions are equal exactly when their names are equal. The
 * builder methods ({@link #add}, {@link #equalTo}, {@link #get(String)} and so
 * on) construct new nodes; they never compare or evaluate anything.
 *
 * <p>Memoized values are stored in volatile fields. Concurrent first calls
 * may compute a value twice, but always compute the same value.
 */
public abstract class Expr {

    private static final Map<String, Function<Expr, Object>> PROPERTIES = new LinkedHashMap<>();

    static {
        PROPERTIES.put("name", Expr::name);
        PROPERTIES.put("kind", Expr::kind);
        PROPERTIES.put("meta", Expr::meta);
        PROPERTIES.put("divisions", Expr::divisions);
        PROPERTIES.put("npartitions", Expr::npartitions);
        PROPERTIES.put("columns", Expr::columns);
        PROPERTIES.put("ndim", Expr::ndim);
        PROPERTIES.put("knownDivisions", Expr::knownDivisions);
        PROPERTIES.put("dependencies", Expr::dependencies);
    }

    private final Signature<? extends Expr> signature;
    private final List<Object> operands;

    private volatile String name;
    private volatile Meta meta;
    private volatile List<Object> divisions;

    /**
     * Creates an expression, completing omitted trailing operands with defaults.
     *
     * @param signature the operator's declared parameters
     * @param operands the positional operands
     * @throws PlanConstructionException on too many operands or a missing required one
     */
    protected Expr(Signature<? extends Expr> signature, List<?> operands) {
        this.signature = Objects.requireNonNull(signature, "signature must not be null");
        this.operands = signature.bind(Objects.requireNonNull(operands, "operands must not be null"));
    }

    /**
     * Packs constructor arguments into an operand list.
     *
     * @param values the operands
     * @return a list that may contain nulls
     */
    protected static List<Object> operandList(Object... values) {
        return Arrays.asList(values);
    }

    // ==================== Structure ====================

    public final Signature<? extends Expr> signature() {
        return signature;
    }

    public String kind() {
        return signature.kind();
    }

    public final List<Object> operands() {
        return operands;
    }

    /**
     * Returns an operand by parameter name.
     *
     * @param parameter the declared parameter name
     * @return the operand value, possibly null
     * @throws UnknownAttributeException if no such parameter is declared
     */
    public final Object operand(String parameter) {
        int index = signature.indexOf(parameter);
        if (index < 0) {
            throw new UnknownAttributeException(kind(), parameter);
        }
        return operands.get(index);
    }

    protected final Expr exprOperand(String parameter) {
        return (Expr) operand(parameter);
    }

    /**
     * Returns the operands that are expressions, including expressions inside list operands.
     *
     * @return the child expressions in operand order
     */
    public List<Expr> dependencies() {
        List<Expr> dependencies = new ArrayList<>();
        for (Object operand : operands) {
            if (operand instanceof Expr) {
                dependencies.add((Expr) operand);
            } else if (operand instanceof List) {
                for (Object item : (List<?>) operand) {
                    if (item instanceof Expr) {
                        dependencies.add((Expr) item);
                    }
                }
            }
        }
        return dependencies;
    }

    // ==================== Derived values ====================

    /**
     * Returns the content-addressed name of this node.
     *
     * @return {@code kind-token}
     */
    public final String name() {
        String result = name;
        if (result == null) {
            result = computeName();
            name = result;
        }
        return result;
    }

    protected String computeName() {
        return kind() + "-" + Tokenizer.tokenize(kind(), operands);
    }

    /**
     * Returns the zero-row description of this node's output.
     *
     * @return the meta
     */
    public final Meta meta() {
        Meta result = meta;
        if (result == null) {
            result = Objects.requireNonNull(computeMeta(), "computeMeta returned null");
            meta = result;
        }
        return result;
    }

    protected abstract Meta computeMeta();

    /**
     * Returns the partition boundaries of this node's output.
     *
     * @return {@code npartitions + 1} boundaries, all null when unknown
     * @throws IllegalStateException if the computed boundaries decrease
     */
    public final List<Object> divisions() {
        List<Object> result = divisions;
        if (result == null) {
            result = Divisions.validate(computeDivisions(), kind());
            divisions = result;
        }
        return result;
    }

    protected abstract List<Object> computeDivisions();

    public int npartitions() {
        return divisions().size() - 1;
    }

    public boolean knownDivisions() {
        return Divisions.isKnown(divisions());
    }

    public int ndim() {
        return meta().ndim();
    }

    public List<String> columns() {
        return meta().columns();
    }

    /**
     * Two-tier attribute lookup: declared properties first, then operands by name.
     *
     * @param key the property or operand name
     * @return the value
     * @throws UnknownAttributeException if neither table has the key
     */
    public Object attribute(String key) {
        Function<Expr, Object> property = PROPERTIES.get(key);
        if (property != null) {
            return property.apply(this);
        }
        if (signature.indexOf(key) >= 0) {
            return operand(key);
        }
        throw new UnknownAttributeException(kind(), key);
    }

    // ==================== Rewriting ====================

    /**
     * Local simplification that only looks at this node and its operands.
     *
     * @return the replacement, or null when nothing applies
     */
    public Expr simplifyDown() {
        return null;
    }

    /**
     * Rewrite of {@code parent}, one of whose dependencies is this node.
     *
     * @param parent the consuming node
     * @return the replacement for the parent, or null when nothing applies
     */
    public Expr simplifyUp(Expr parent) {
        return null;
    }

    /**
     * Algebraic rules registered for this operator type.
     *
     * @return the rules, tried in order
     */
    public List<RewriteRule> rewriteRules() {
        return List.of();
    }

    /**
     * Expands this node into lower-level nodes before materialization.
     *
     * @return the replacement, or null when already low-level
     */
    public Expr lower() {
        return null;
    }

    /**
     * Merges this node with similar nodes elsewhere under {@code root}.
     *
     * <p>Not safe to call while other threads build trees that share nodes with root.
     *
     * @param root the root of the whole tree
     * @return the replacement, or null when nothing applies
     */
    public Expr combineSimilar(Expr root) {
        return null;
    }

    /**
     * Rebuilds this node from new operands.
     *
     * @param newOperands the operands
     * @return the new node
     */
    public Expr withOperands(List<Object> newOperands) {
        return signature.create(newOperands);
    }

    /**
     * Returns a copy with some operands replaced by name.
     *
     * @param substitutions new values by parameter name
     * @return the new node, or this node when every value is unchanged
     * @throws UnknownAttributeException for an undeclared parameter
     */
    public Expr withParameters(Map<String, ?> substitutions) {
        List<Object> updated = new ArrayList<>(operands);
        boolean changed = false;
        for (Map.Entry<String, ?> entry : substitutions.entrySet()) {
            int index = signature.indexOf(entry.getKey());
            if (index < 0) {
                throw new UnknownAttributeException(kind(), entry.getKey());
            }
            if (!Objects.equals(updated.get(index), entry.getValue())) {
                updated.set(index, entry.getValue());
                changed = true;
            }
        }
        return changed ? withOperands(updated) : this;
    }

    /**
     * Rebuilds this node with every dependency passed through a function.
     *
     * @param function maps an old dependency to its replacement
     * @return the new node, or this node when no dependency changed
     */
    public Expr mapDependencies(UnaryOperator<Expr> function) {
        List<Object> updated = new ArrayList<>(operands.size());
        boolean changed = false;
        for (Object operand : operands) {
            Object mapped = mapOperand(operand, function);
            changed |= mapped != operand;
            updated.add(mapped);
        }
        return changed ? withOperands(updated) : this;
    }

    private static Object mapOperand(Object operand, UnaryOperator<Expr> function) {
        if (operand instanceof Expr) {
            Expr mapped = function.apply((Expr) operand);
            return mapped.name().equals(((Expr) operand).name()) ? operand : mapped;
        }
        if (operand instanceof List && containsExpr((List<?>) operand)) {
            List<Object> items = new ArrayList<>();
            boolean changed = false;
            for (Object item : (List<?>) operand) {
                Object mapped = mapOperand(item, function);
                changed |= mapped != item;
                items.add(mapped);
            }
            return changed ? Collections.unmodifiableList(items) : operand;
        }
        return operand;
    }

    private static boolean containsExpr(List<?> items) {
        for (Object item : items) {
            if (item instanceof Expr) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces sub-expressions by name, anywhere below and including this node.
     *
     * @param byName replacements keyed by the name of the node they replace
     * @return the new tree, or this node when nothing matched
     */
    public Expr substitute(Map<String, Expr> byName) {
        Expr replacement = byName.get(name());
        if (replacement != null) {
            return replacement;
        }
        return mapDependencies(dep -> dep.substitute(byName));
    }

    /**
     * Returns every distinct node of the given type in this tree.
     *
     * @param type the node class
     * @param <T> the node type
     * @return the matching nodes, parents before children
     */
    public <T extends Expr> List<T> findAll(Class<T> type) {
        List<T> found = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Expr next = stack.pop();
            if (!seen.add(next.name())) {
                continue;
            }
            if (type.isInstance(next)) {
                found.add(type.cast(next));
            }
            List<Expr> deps = next.dependencies();
            for (int i = deps.size() - 1; i >= 0; i--) {
                stack.push(deps.get(i));
            }
        }
        return found;
    }

    // ==================== Graph ====================

    /**
     * Returns the tasks that produce this node's partitions, keyed
     * {@code (name, i)}, reading dependencies by their keys.
     *
     * @return this node's layer of the task graph
     */
    public abstract Map<TaskKey, Task> layer();

    /**
     * Returns the output keys of this node, one per partition.
     *
     * @return the keys in partition order
     */
    public List<TaskKey> keys() {
        List<TaskKey> keys = new ArrayList<>(npartitions());
        for (int i = 0; i < npartitions(); i++) {
            keys.add(new TaskKey(name(), i));
        }
        return keys;
    }

    /**
     * Materializes this tree into a task graph without optimizing it.
     *
     * @return the task graph
     */
    public TaskGraph materialize() {
        return GraphBuilder.build(this);
    }

    // ==================== Builders ====================

    public Expr add(Object other) {
        return new Binop.Add(this, other);
    }

    public Expr subtract(Object other) {
        return new Binop.Subtract(this, other);
    }

    public Expr multiply(Object other) {
        return new Binop.Multiply(this, other);
    }

    public Expr divide(Object other) {
        return new Binop.Divide(this, other);
    }

    public Expr lessThan(Object other) {
        return new Binop.LessThan(this, other);
    }

    public Expr lessThanOrEqual(Object other) {
        return new Binop.LessThanOrEqual(this, other);
    }

    public Expr greaterThan(Object other) {
        return new Binop.GreaterThan(this, other);
    }

    public Expr greaterThanOrEqual(Object other) {
        return new Binop.GreaterThanOrEqual(this, other);
    }

    /**
     * Builds an element-wise equality comparison. Use {@link #equals} for node identity.
     *
     * @param other an expression or a literal
     * @return the comparison node
     */
    public Expr equalTo(Object other) {
        return new Binop.Equal(this, other);
    }

    public Expr notEqual(Object other) {
        return new Binop.NotEqual(this, other);
    }

    public Expr and(Object other) {
        return new Binop.And(this, other);
    }

    public Expr or(Object other) {
        return new Binop.Or(this, other);
    }

    /**
     * Selects one column of a frame as a series.
     *
     * @param column the column name
     * @return the projection
     * @throws ColumnNotFoundException if the frame has no such column
     */
    public Expr get(String column) {
        requireColumns(List.of(column));
        return new Projection(this, column);
    }

    /**
     * Selects several columns of a frame.
     *
     * @param columns the column names, in output order
     * @return the projection
     * @throws ColumnNotFoundException if a column is missing
     */
    public Expr get(List<String> columns) {
        requireColumns(columns);
        return new Projection(this, List.copyOf(columns));
    }

    /**
     * Keeps the rows where the boolean predicate is true.
     *
     * @param predicate a boolean series partitioned like this node
     * @return the filter
     */
    public Expr get(Expr predicate) {
        return new Filter(this, predicate);
    }

    public Expr filter(Expr predicate) {
        return get(predicate);
    }

    private void requireColumns(List<String> requested) {
        Meta current = meta();
        if (!current.isFrame()) {
            return;
        }
        List<String> available = current.columns();
        for (String column : requested) {
            if (!available.contains(column)) {
                throw new ColumnNotFoundException(column, available);
            }
        }
    }

    public Expr head() {
        return head(5);
    }

    public Expr head(int n) {
        return new Head(this, n);
    }

    public Expr assign(String key, Object value) {
        return new Assign(this, key, value);
    }

    public Expr astype(DataType dtype) {
        return new AsType(this, dtype);
    }

    public Expr astype(Map<String, DataType> dtypes) {
        return new AsType(this, Map.copyOf(dtypes));
    }

    public Expr apply(Function<Object, Object> function, DataType outputType) {
        return new Apply(this, function, outputType);
    }

    public Expr index() {
        return new ProjectIndex(this);
    }

    public Expr mapIndex(Function<Object, Object> function, boolean monotonic) {
        return new MapIndex(this, function, monotonic);
    }

    /**
     * Selects a subset of partitions.
     *
     * @param partitions ascending partition indices
     * @return the partition selection
     */
    public Expr partitions(int... partitions) {
        List<Integer> selected = new ArrayList<>(partitions.length);
        for (int partition : partitions) {
            selected.add(partition);
        }
        return new Partitions(this, selected);
    }

    public Expr repartition(int npartitions) {
        return Repartition.toPartitions(this, npartitions);
    }

    public Expr repartitionByDivisions(List<Object> divisions) {
        return Repartition.toDivisions(this, divisions);
    }

    /**
     * Marks a series as categorical with known categories.
     *
     * @param categories the ordered categories
     * @return the conversion
     */
    public Expr setCategories(List<String> categories) {
        return new SetCategories(this, null, List.copyOf(categories));
    }

    public Expr setCategories(String column, List<String> categories) {
        requireColumns(List.of(column));
        return new SetCategories(this, column, List.copyOf(categories));
    }

    /**
     * Returns the integer codes of a categorical series.
     *
     * @return the codes expression
     * @throws UnknownCategoriesException if the categories are not known
     */
    public Expr categoryCodes() {
        knownCategories("categoryCodes");
        return new CategoryCodes(this);
    }

    /**
     * Returns the known categories of a categorical series from meta.
     *
     * @return the categories
     * @throws UnknownCategoriesException if the categories are not known
     */
    public List<String> categories() {
        return knownCategories("categories");
    }

    private List<String> knownCategories(String operation) {
        Meta current = meta();
        if (!current.isSeries() || !(current.dataType() instanceof CategoricalType)) {
            throw new PlanConstructionException(kind(), operation + " requires a categorical series");
        }
        CategoricalType type = (CategoricalType) current.dataType();
        if (!type.knownCategories()) {
            throw new UnknownCategoriesException(current.seriesName(), operation);
        }
        return type.categories();
    }

    public Expr sum() {
        return new Sum(this);
    }

    public Expr min() {
        return new Min(this);
    }

    public Expr max() {
        return new Max(this);
    }

    public Expr count() {
        return new Count(this);
    }

    public Expr mean() {
        return new Binop.Divide(sum(), count());
    }

    public Expr size() {
        return new Size(this);
    }

    /**
     * Returns the number of rows.
     *
     * @return the row count expression
     */
    public Expr length() {
        return new Len(this);
    }

    public Expr unique() {
        return new Unique(this);
    }

    public Expr unique(Object splitEvery, int splitOut) {
        return new Unique(this, splitEvery, splitOut);
    }

    public Expr dropDuplicates() {
        return new DropDuplicates(this);
    }

    public Expr dropDuplicates(Object splitEvery, int splitOut) {
        return new DropDuplicates(this, splitEvery, splitOut);
    }

    public Expr valueCounts() {
        return new ValueCounts(this);
    }

    public Expr valueCounts(Object splitEvery, int splitOut) {
        return new ValueCounts(this, splitEvery, splitOut);
    }

    /**
     * Groups the rows of this frame by a key column.
     *
     * @param by the key column
     * @return the grouping, aggregated by one of its methods
     */
    public GroupBy groupBy(String by) {
        return new GroupBy(this, by);
    }

    // ==================== Display ====================

    /**
     * Renders the tree, one node per line, shared nodes printed once.
     *
     * @return the indented tree
     */
    public String explain() {
        StringBuilder out = new StringBuilder();
        explain(out, 0, new HashSet<>());
        return out.toString();
    }

    private void explain(StringBuilder out, int depth, Set<String> seen) {
        out.append("  ".repeat(depth)).append(kind());
        List<String> literals = new ArrayList<>();
        for (int i = 0; i < operands.size(); i++) {
            Object operand = operands.get(i);
            if (!(operand instanceof Expr) && !(operand instanceof List && containsExpr((List<?>) operand))) {
                literals.add(signature.parameters().get(i) + "=" + describeOperand(operand));
            }
        }
        if (!literals.isEmpty()) {
            out.append(": ").append(String.join(", ", literals));
        }
        if (!seen.add(name())) {
            out.append(" (shared)\n");
            return;
        }
        out.append('\n');
        for (Expr dep : dependencies()) {
            dep.explain(out, depth + 1, seen);
        }
    }

    static String describeOperand(Object operand) {
        if (operand instanceof Expr) {
            return operand.toString();
        }
        if (operand instanceof Function) {
            return "<function>";
        }
        if (operand instanceof String) {
            return "'" + operand + "'";
        }
        return String.valueOf(operand);
    }

    // ==================== Identity ====================

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expr)) return false;
        return name().equals(((Expr) o).name());
    }

    @Override
    public final int hashCode() {
        return name().hashCode();
    }

    @Override
    public String toString() {
        List<String> rendered = new ArrayList<>(operands.size());
        for (Object operand : operands) {
            rendered.add(describeOperand(operand));
        }
        return kind() + "(" + String.join(", ", rendered) + ")";
    }
}
