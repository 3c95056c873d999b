package com.nullduck.runtime;

import com.nullduck.analysis.ExpressionTypeResolver;
import com.nullduck.analysis.ResolvedExpression;
import com.nullduck.array.ValidityArray;
import com.nullduck.exception.EvaluationException;
import com.nullduck.exception.OperandKindException;
import com.nullduck.expression.ColumnReference;
import com.nullduck.expression.Expression;
import com.nullduck.expression.FillNanExpression;
import com.nullduck.expression.FillNullExpression;
import com.nullduck.expression.FillSpec;
import com.nullduck.expression.Literal;
import com.nullduck.expression.UnaryExpression;
import com.nullduck.kernel.FillKernels;
import com.nullduck.kernel.NullKernels;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Binds resolved expressions to concrete columns and runs the matching kernels.
 *
 * <p>Evaluation is the second phase of the two-phase API:
 * <pre>
 *   ResolvedExpression resolved = ExpressionTypeResolver.resolve(expr, batch.schema());
 *   ValidityArray result = evaluator.evaluate(resolved, batch);
 * </pre>
 * The result always has the type the resolver predicted. Failures here are
 * {@link EvaluationException}s and are disjoint from resolution failures:
 * <ul>
 *   <li>{@link OperandKindException}: a column is bound to something that is not a
 *       {@link ValidityArray}</li>
 *   <li>{@link com.nullduck.exception.LengthMismatchException}: two operands differ in
 *       length and neither has length 1</li>
 *   <li>{@link EvaluationException}: a bound column's type differs from the type it
 *       was resolved with</li>
 * </ul>
 *
 * <p>Independent expressions of one batch may be evaluated concurrently on a worker
 * pool sized by {@link EvaluationConfig}; each kernel call itself runs on one thread.
 * The evaluator owns that pool and must be closed.
 */
public final class ExpressionEvaluator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final EvaluationConfig config;
    private final ExecutorService workers;

    /**
     * Creates an evaluator configured from the system properties.
     */
    public ExpressionEvaluator() {
        this(EvaluationConfig.defaults());
    }

    /**
     * Creates an evaluator.
     *
     * @param config the evaluation configuration
     */
    public ExpressionEvaluator(EvaluationConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.workers = config.isSequential() ? null : newWorkerPool(config.parallelism());
        logger.debug("Created evaluator with {}", config);
    }

    public EvaluationConfig config() {
        return config;
    }

    // ========================================================================
    // Single Expression
    // ========================================================================

    /**
     * Evaluates a resolved expression over a batch.
     *
     * @param resolved the resolved expression
     * @param batch the batch providing the columns
     * @return the result, typed as {@code resolved.dataType()}
     */
    public ValidityArray evaluate(ResolvedExpression resolved, RecordBatch batch) {
        Objects.requireNonNull(batch, "batch must not be null");
        return evaluate(resolved, batch.columns());
    }

    /**
     * Evaluates a resolved expression over loosely bound columns.
     *
     * <p>Columns may differ in length here; binary kernels broadcast length-1 operands
     * and reject any other mismatch.
     *
     * @param resolved the resolved expression
     * @param columns column name to bound operand; every referenced operand must be a
     *        {@link ValidityArray}
     * @return the result, typed as {@code resolved.dataType()}
     * @throws OperandKindException if a referenced column is bound to a non-array
     */
    public ValidityArray evaluate(ResolvedExpression resolved, Map<String, ?> columns) {
        Objects.requireNonNull(resolved, "resolved must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        return evaluateNode(resolved, columns::get, "col");
    }

    /**
     * Resolves an expression against the batch's schema, then evaluates it.
     *
     * @param expr the expression
     * @param batch the batch
     * @return the result
     * @throws com.nullduck.exception.TypeResolutionException if the expression does not
     *         resolve; no kernel runs in that case
     */
    public ValidityArray evaluate(Expression expr, RecordBatch batch) {
        return evaluate(ExpressionTypeResolver.resolve(expr, batch.schema()), batch);
    }

    // ========================================================================
    // Expression Lists
    // ========================================================================

    /**
     * Resolves every expression, then evaluates them, concurrently when the
     * configured parallelism allows.
     *
     * <p>All expressions are resolved before any is evaluated, so a resolution failure
     * in any of them means no kernel runs at all.
     *
     * @param expressions the expressions
     * @param batch the input batch
     * @return a batch with one column per expression, named by its output name
     * @throws IllegalArgumentException if two expressions have the same output name
     */
    public RecordBatch evaluateAll(List<? extends Expression> expressions, RecordBatch batch) {
        Objects.requireNonNull(expressions, "expressions must not be null");
        Objects.requireNonNull(batch, "batch must not be null");

        List<ResolvedExpression> resolved = new ArrayList<>(expressions.size());
        for (Expression expr : expressions) {
            resolved.add(ExpressionTypeResolver.resolve(expr, batch.schema()));
        }

        List<ValidityArray> results = workers == null || resolved.size() < 2
            ? evaluateSequentially(resolved, batch)
            : evaluateConcurrently(resolved, batch);

        RecordBatch.Builder builder = RecordBatch.builder();
        for (int i = 0; i < resolved.size(); i++) {
            builder.column(resolved.get(i).outputName(), results.get(i));
        }
        return builder.build();
    }

    private List<ValidityArray> evaluateSequentially(List<ResolvedExpression> resolved, RecordBatch batch) {
        List<ValidityArray> results = new ArrayList<>(resolved.size());
        for (ResolvedExpression expr : resolved) {
            results.add(evaluate(expr, batch));
        }
        return results;
    }

    private List<ValidityArray> evaluateConcurrently(List<ResolvedExpression> resolved, RecordBatch batch) {
        logger.debug("Evaluating {} expressions over {} rows on {} workers",
            resolved.size(), batch.length(), config.parallelism());

        List<Future<ValidityArray>> futures = new ArrayList<>(resolved.size());
        for (ResolvedExpression expr : resolved) {
            futures.add(workers.submit(() -> evaluate(expr, batch)));
        }

        List<ValidityArray> results = new ArrayList<>(resolved.size());
        try {
            for (Future<ValidityArray> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Interrupted while evaluating expressions", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Expression evaluation failed", cause);
        }
        return results;
    }

    // ========================================================================
    // Dispatch
    // ========================================================================

    private ValidityArray evaluateNode(ResolvedExpression node, Function<String, ?> columns, String consumer) {
        Expression expr = node.expression();
        ValidityArray result;

        if (expr instanceof ColumnReference) {
            result = bindColumn((ColumnReference) expr, node, columns, consumer);
        } else if (expr instanceof Literal) {
            Literal literal = (Literal) expr;
            result = ValidityArray.scalar(literal.dataType(), literal.value());
        } else if (expr instanceof UnaryExpression) {
            UnaryExpression.Operator operator = ((UnaryExpression) expr).operator();
            ValidityArray operand = evaluateNode(node.child(0), columns, operator.functionName());
            result = evaluateUnary(operator, operand);
        } else if (expr instanceof FillNullExpression) {
            FillSpec spec = ((FillNullExpression) expr).spec();
            ValidityArray input = evaluateNode(node.child(0), columns, "fill_null");
            if (spec instanceof FillSpec.ByStrategy) {
                result = FillKernels.fillWithStrategy(input, ((FillSpec.ByStrategy) spec).strategy());
            } else {
                ValidityArray value = evaluateNode(node.child(1), columns, "fill_null");
                result = FillKernels.fillValue(input, value);
            }
        } else if (expr instanceof FillNanExpression) {
            ValidityArray input = evaluateNode(node.child(0), columns, "fill_nan");
            ValidityArray value = evaluateNode(node.child(1), columns, "fill_nan");
            result = FillKernels.fillNan(input, value);
        } else {
            throw new EvaluationException(expr.getClass().getSimpleName(), "unsupported expression " + expr);
        }

        if (!result.dataType().equals(node.dataType())) {
            throw new IllegalStateException(String.format(
                "%s produced %s but was resolved as %s", expr, result.dataType(), node.dataType()));
        }
        return result;
    }

    private static ValidityArray evaluateUnary(UnaryExpression.Operator operator, ValidityArray operand) {
        switch (operator) {
            case IS_NULL:
                return NullKernels.isNull(operand);
            case NOT_NULL:
                return NullKernels.notNull(operand);
            case IS_NAN:
                return NullKernels.isNan(operand);
            case NOT_NAN:
                return NullKernels.notNan(operand);
            default:
                throw new IllegalStateException("Unhandled operator " + operator);
        }
    }

    private static ValidityArray bindColumn(ColumnReference column, ResolvedExpression node,
                                            Function<String, ?> columns, String consumer) {
        Object bound = columns.apply(column.columnName());
        if (bound == null) {
            throw new EvaluationException(consumer,
                "column '" + column.columnName() + "' is not bound");
        }
        if (!(bound instanceof ValidityArray)) {
            throw new OperandKindException(consumer,
                "a ValidityArray for column '" + column.columnName() + "'",
                bound.getClass().getSimpleName());
        }
        ValidityArray array = (ValidityArray) bound;
        if (!array.dataType().equals(node.dataType())) {
            throw new EvaluationException(consumer, String.format(
                "column '%s' is %s but was resolved as %s",
                column.columnName(), array.dataType().typeName(), node.dataType().typeName()));
        }
        return array;
    }

    /**
     * Replaces the nulls of {@code data} with a fill operand supplied by a caller
     * outside the expression API.
     *
     * @param data the array to fill
     * @param fill the fill operand; must be a {@link ValidityArray}
     * @return the filled array
     * @throws OperandKindException if {@code fill} is not a {@link ValidityArray}
     */
    public static ValidityArray fillNull(ValidityArray data, Object fill) {
        if (!(fill instanceof ValidityArray)) {
            throw new OperandKindException("fill_null", "another ValidityArray",
                fill == null ? "null" : fill.getClass().getSimpleName());
        }
        return FillKernels.fillValue(data, (ValidityArray) fill);
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Override
    public void close() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    private static ExecutorService newWorkerPool(int parallelism) {
        int poolId = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable,
                "nullduck-eval-" + poolId + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
