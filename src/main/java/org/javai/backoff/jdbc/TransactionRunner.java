package org.javai.backoff.jdbc;

import org.javai.backoff.Outcome;
import org.javai.backoff.classify.ClassifiedException;
import org.javai.backoff.classify.ErrorClassifier;
import org.javai.backoff.retry.CancellationToken;
import org.javai.backoff.retry.RetryExecutor;
import org.javai.backoff.retry.RetryListener;
import org.javai.backoff.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.Objects;

/**
 * Runs a unit of work inside a JDBC transaction, retrying the whole transaction on
 * transient database errors.
 *
 * <p>Each attempt takes a fresh connection, disables auto-commit, runs the work and commits.
 * On failure the transaction is rolled back and the connection closed before the
 * {@link SQLException} is classified. Once the commit succeeds the attempt counts as done:
 * an error while closing the connection is logged and never causes a retry.</p>
 *
 * <p>Which SQL errors are transient is decided by a pluggable {@link ErrorClassifier};
 * the default trusts JDBC's own exception taxonomy.</p>
 *
 * <pre>{@code
 * TransactionRunner transactions = TransactionRunner.create(dataSource);
 *
 * Outcome<Long> orderId = transactions.inTransaction(connection -> {
 *     long id = insertOrder(connection, customerId, amount);
 *     debitBalance(connection, customerId, amount);
 *     return id;
 * });
 * }</pre>
 */
public final class TransactionRunner {

    private static final Logger logger = LoggerFactory.getLogger(TransactionRunner.class);

    static final RetryPolicy DEFAULT_POLICY =
            new RetryPolicy(3, Duration.ofMillis(50), Duration.ofSeconds(2), 2.0, 0.1);

    /**
     * Supplies a new connection per attempt, typically {@code dataSource::getConnection}.
     */
    @FunctionalInterface
    public interface ConnectionSource {
        Connection getConnection() throws SQLException;
    }

    /**
     * The statements to run inside one transaction.
     *
     * @param <T> the result of the transaction
     */
    @FunctionalInterface
    public interface TransactionWork<T> {
        T execute(Connection connection) throws SQLException;
    }

    private final ConnectionSource connections;
    private final RetryExecutor executor;
    private final RetryPolicy policy;
    private final ErrorClassifier sqlClassifier;

    public TransactionRunner(
            ConnectionSource connections,
            RetryExecutor executor,
            RetryPolicy policy,
            ErrorClassifier sqlClassifier
    ) {
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.sqlClassifier = Objects.requireNonNull(sqlClassifier, "sqlClassifier must not be null");
    }

    /**
     * A runner with the default policy (3 attempts, 50ms growing by 2.0 up to 2s, 10% jitter)
     * and {@link #transientSqlErrors()}.
     */
    public static TransactionRunner create(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        return new TransactionRunner(dataSource::getConnection, RetryExecutor.create(), DEFAULT_POLICY,
                transientSqlErrors());
    }

    /**
     * Treats {@link SQLTransientException} (timeouts, deadlock rollbacks, lost connections)
     * and {@link SQLRecoverableException} as retryable.
     */
    public static ErrorClassifier transientSqlErrors() {
        return error -> error instanceof SQLTransientException || error instanceof SQLRecoverableException;
    }

    public <T> Outcome<T> inTransaction(TransactionWork<T> work) {
        return inTransaction(work, CancellationToken.none(), RetryListener.none());
    }

    /**
     * Runs {@code work} in a transaction, retrying under this runner's policy.
     *
     * @param work the statements to run; must be safe to repeat after a rollback
     * @param token cancels the retry loop between attempts
     * @param onRetry notified before each retry
     * @return the work's result once committed, or the failure that ended the run
     */
    public <T> Outcome<T> inTransaction(TransactionWork<T> work, CancellationToken token, RetryListener onRetry) {
        Objects.requireNonNull(work, "work must not be null");
        return executor.run("transaction", token, policy, () -> attempt(work), onRetry);
    }

    private <T> T attempt(TransactionWork<T> work) throws SQLException, ClassifiedException {
        Connection connection = null;
        T result;
        try {
            connection = connections.getConnection();
            connection.setAutoCommit(false);
            result = executeAndCommit(connection, work);
        } catch (SQLException e) {
            closeAfterFailure(connection, e);
            if (sqlClassifier.isRetryable(e)) {
                throw ClassifiedException.retryable(e);
            }
            throw e;
        } catch (RuntimeException e) {
            closeAfterFailure(connection, e);
            throw e;
        }
        // Committed: a failing close must never run the work again
        closeAfterCommit(connection);
        return result;
    }

    private static <T> T executeAndCommit(Connection connection, TransactionWork<T> work) throws SQLException {
        try {
            T result = work.execute(connection);
            connection.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            rollback(connection, e);
            throw e;
        }
    }

    private static void rollback(Connection connection, Exception failure) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            logger.debug("Rollback failed after {}", failure.toString(), e);
            failure.addSuppressed(e);
        }
    }

    private static void closeAfterFailure(Connection connection, Exception failure) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private static void closeAfterCommit(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("Closing connection failed after commit; transaction is not retried", e);
        }
    }
}
