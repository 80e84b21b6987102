package com.lazyduck.expression;

import com.lazyduck.frame.BinaryOperator;
import com.lazyduck.frame.Kernels;
import com.lazyduck.graph.PartitionFunction;
import com.lazyduck.optimizer.RewriteRule;

import java.util.List;

/**
 * Element-wise binary operator between two expressions, or an expression and
 * a literal on either side.
 *
 * <p>Each operator is a nested subclass with its own kind, so {@code a + b}
 * and {@code a - b} get distinct names.
 */
public abstract class Binop extends Elemwise {

    protected Binop(Signature<? extends Expr> signature, List<?> operands) {
        super(signature, operands);
    }

    /**
     * Returns the operator applied to each pair of values.
     *
     * @return the operator
     */
    public abstract BinaryOperator operator();

    public Object left() {
        return operand("left");
    }

    public Object right() {
        return operand("right");
    }

    @Override
    protected PartitionFunction operation() {
        BinaryOperator op = operator();
        return args -> Kernels.binary(op, args.get(0), args.get(1));
    }

    /**
     * Selects columns on both sides instead of on the result:
     * {@code (a + b)[cols]} becomes {@code a[cols] + b[cols]}.
     */
    @Override
    public Expr simplifyUp(Expr parent) {
        if (!(parent instanceof Projection) || !((Projection) parent).frame().equals(this) || !meta().isFrame()) {
            return null;
        }
        Object columns = ((Projection) parent).columnsOperand();
        return withOperands(operandList(project(left(), columns), project(right(), columns)));
    }

    private static Object project(Object side, Object columns) {
        if (side instanceof Expr && ((Expr) side).meta().isFrame()) {
            return new Projection((Expr) side, columns);
        }
        return side;
    }

    @Override
    public String toString() {
        return "(" + describeOperand(left()) + " " + operator().symbol() + " " + describeOperand(right()) + ")";
    }

    public static final class Add extends Binop {

        static final Signature<Add> SIGNATURE = Signature.builder("add", Add::new)
            .required("left")
            .required("right")
            .build();

        public Add(Object left, Object right) {
            this(operandList(left, right));
        }

        private Add(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.ADD;
        }

        private static final List<RewriteRule> RULES = List.of(
            RewriteRule.of("add-self-to-multiply", expr -> {
                Add add = (Add) expr;
                if (add.left() instanceof Expr && add.left().equals(add.right())) {
                    return new Multiply(2, add.left());
                }
                return null;
            }));

        @Override
        public List<RewriteRule> rewriteRules() {
            return RULES;
        }
    }

    public static final class Subtract extends Binop {

        static final Signature<Subtract> SIGNATURE = Signature.builder("sub", Subtract::new)
            .required("left")
            .required("right")
            .build();

        public Subtract(Object left, Object right) {
            this(operandList(left, right));
        }

        private Subtract(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.SUBTRACT;
        }
    }

    public static final class Multiply extends Binop {

        static final Signature<Multiply> SIGNATURE = Signature.builder("mul", Multiply::new)
            .required("left")
            .required("right")
            .build();

        public Multiply(Object left, Object right) {
            this(operandList(left, right));
        }

        private Multiply(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.MULTIPLY;
        }

        private static final List<RewriteRule> RULES = List.of(
            RewriteRule.of("fold-constant-factors", expr -> {
                Multiply outer = (Multiply) expr;
                if (outer.left() instanceof Number && outer.right() instanceof Multiply) {
                    Multiply inner = (Multiply) outer.right();
                    if (inner.left() instanceof Number) {
                        Object factor = BinaryOperator.MULTIPLY.apply(outer.left(), inner.left());
                        return new Multiply(factor, inner.right());
                    }
                }
                return null;
            }));

        @Override
        public List<RewriteRule> rewriteRules() {
            return RULES;
        }
    }

    public static final class Divide extends Binop {

        static final Signature<Divide> SIGNATURE = Signature.builder("div", Divide::new)
            .required("left")
            .required("right")
            .build();

        public Divide(Object left, Object right) {
            this(operandList(left, right));
        }

        private Divide(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.DIVIDE;
        }
    }

    public static final class LessThan extends Binop {

        static final Signature<LessThan> SIGNATURE = Signature.builder("lt", LessThan::new)
            .required("left")
            .required("right")
            .build();

        public LessThan(Object left, Object right) {
            this(operandList(left, right));
        }

        private LessThan(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.LESS_THAN;
        }
    }

    public static final class LessThanOrEqual extends Binop {

        static final Signature<LessThanOrEqual> SIGNATURE = Signature.builder("le", LessThanOrEqual::new)
            .required("left")
            .required("right")
            .build();

        public LessThanOrEqual(Object left, Object right) {
            this(operandList(left, right));
        }

        private LessThanOrEqual(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.LESS_THAN_OR_EQUAL;
        }
    }

    public static final class GreaterThan extends Binop {

        static final Signature<GreaterThan> SIGNATURE = Signature.builder("gt", GreaterThan::new)
            .required("left")
            .required("right")
            .build();

        public GreaterThan(Object left, Object right) {
            this(operandList(left, right));
        }

        private GreaterThan(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.GREATER_THAN;
        }
    }

    public static final class GreaterThanOrEqual extends Binop {

        static final Signature<GreaterThanOrEqual> SIGNATURE = Signature.builder("ge", GreaterThanOrEqual::new)
            .required("left")
            .required("right")
            .build();

        public GreaterThanOrEqual(Object left, Object right) {
            this(operandList(left, right));
        }

        private GreaterThanOrEqual(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.GREATER_THAN_OR_EQUAL;
        }
    }

    public static final class Equal extends Binop {

        static final Signature<Equal> SIGNATURE = Signature.builder("eq", Equal::new)
            .required("left")
            .required("right")
            .build();

        public Equal(Object left, Object right) {
            this(operandList(left, right));
        }

        private Equal(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.EQUAL;
        }
    }

    public static final class NotEqual extends Binop {

        static final Signature<NotEqual> SIGNATURE = Signature.builder("ne", NotEqual::new)
            .required("left")
            .required("right")
            .build();

        public NotEqual(Object left, Object right) {
            this(operandList(left, right));
        }

        private NotEqual(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.NOT_EQUAL;
        }
    }

    public static final class And extends Binop {

        static final Signature<And> SIGNATURE = Signature.builder("and", And::new)
            .required("left")
            .required("right")
            .build();

        public And(Object left, Object right) {
            this(operandList(left, right));
        }

        private And(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.AND;
        }
    }

    public static final class Or extends Binop {

        static final Signature<Or> SIGNATURE = Signature.builder("or", Or::new)
            .required("left")
            .required("right")
            .build();

        public Or(Object left, Object right) {
            this(operandList(left, right));
        }

        private Or(List<Object> operands) {
            super(SIGNATURE, operands);
        }

        @Override
        public BinaryOperator operator() {
            return BinaryOperator.OR;
        }
    }
}
