package org.javai.backoff.jdbc;

import org.javai.backoff.FailureReason;
import org.javai.backoff.Outcome;
import org.javai.backoff.RetryFailure;
import org.javai.backoff.classify.ClassifiedException;
import org.javai.backoff.retry.CancellationToken;
import org.javai.backoff.retry.RetryExecutor;
import org.javai.backoff.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransactionRollbackException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class TransactionRunnerTest {

    private static final RetryPolicy FAST = RetryPolicy.fixed(3, Duration.ofMillis(1));

    private List<String> calls;
    private AtomicInteger connectionsOpened;
    private boolean failRollback;
    private boolean failClose;
    private TransactionRunner runner;

    @BeforeEach
    void setUp() {
        calls = new ArrayList<>();
        connectionsOpened = new AtomicInteger();
        runner = new TransactionRunner(this::openConnection, RetryExecutor.create(), FAST,
                TransactionRunner.transientSqlErrors());
    }

    @Test
    void inTransaction_success_commitsAndCloses() {
        Outcome<Long> outcome = runner.inTransaction(connection -> 42L);

        assertThat(outcome.getOrThrow()).isEqualTo(42L);
        assertThat(calls).containsExactly("autoCommit=false", "commit", "close");
    }

    @Test
    void inTransaction_deadlockRollback_isRetriedOnFreshConnection() {
        AtomicInteger executions = new AtomicInteger();

        Outcome<String> outcome = runner.inTransaction(connection -> {
            if (executions.incrementAndGet() < 3) {
                throw new SQLTransactionRollbackException("deadlock detected", "40P01");
            }
            return "order-17";
        });

        assertThat(outcome.getOrThrow()).isEqualTo("order-17");
        assertThat(connectionsOpened.get()).isEqualTo(3);
        assertThat(calls).containsExactly(
                "autoCommit=false", "rollback", "close",
                "autoCommit=false", "rollback", "close",
                "autoCommit=false", "commit", "close");
    }

    @Test
    void inTransaction_permanentSqlError_isRolledBackAndNotRetried() {
        SQLException constraint = new SQLException("duplicate key", "23505");

        Outcome<String> outcome = runner.inTransaction(connection -> {
            throw constraint;
        });

        RetryFailure failure = outcome.failure().orElseThrow();
        assertThat(failure.reason()).isEqualTo(FailureReason.NON_RETRYABLE);
        assertThat(failure.lastError()).isSameAs(constraint);
        assertThat(calls).containsExactly("autoCommit=false", "rollback", "close");
    }

    @Test
    void inTransaction_persistentTransientError_exhausts() {
        Outcome<String> outcome = runner.inTransaction(connection -> {
            throw new SQLTransientConnectionException("connection pool timeout");
        });

        RetryFailure failure = outcome.failure().orElseThrow();
        assertThat(failure.reason()).isEqualTo(FailureReason.EXHAUSTED);
        assertThat(failure.attempts()).isEqualTo(3);
        assertThat(failure.lastError()).isInstanceOf(ClassifiedException.class);
        assertThat(failure.lastError().getCause()).isInstanceOf(SQLTransientConnectionException.class);
    }

    @Test
    void inTransaction_connectionFailure_isRetried() {
        AtomicInteger attempts = new AtomicInteger();
        TransactionRunner flaky = new TransactionRunner(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new SQLRecoverableException("connection lost");
            }
            return openConnection();
        }, RetryExecutor.create(), FAST, TransactionRunner.transientSqlErrors());

        Outcome<Integer> outcome = flaky.inTransaction(connection -> 1);

        assertThat(outcome.getOrThrow()).isEqualTo(1);
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void inTransaction_runtimeException_isRolledBack() {
        Outcome<String> outcome = runner.inTransaction(connection -> {
            throw new IllegalStateException("insufficient balance");
        });

        assertThat(outcome.failure().orElseThrow().reason()).isEqualTo(FailureReason.NON_RETRYABLE);
        assertThat(calls).containsExactly("autoCommit=false", "rollback", "close");
    }

    @Test
    void inTransaction_failedRollback_isAttachedAsSuppressed() {
        failRollback = true;
        SQLException constraint = new SQLException("duplicate key", "23505");

        Outcome<String> outcome = runner.inTransaction(connection -> {
            throw constraint;
        });

        assertThat(outcome.failure().orElseThrow().lastError()).isSameAs(constraint);
        assertThat(constraint.getSuppressed()).hasSize(1);
        assertThat(constraint.getSuppressed()[0]).hasMessage("rollback failed");
    }

    @Test
    void inTransaction_customClassifier_retriesBySqlState() {
        TransactionRunner serializable = new TransactionRunner(this::openConnection, RetryExecutor.create(), FAST,
                error -> error instanceof SQLException sql && "40001".equals(sql.getSQLState()));
        AtomicInteger executions = new AtomicInteger();

        Outcome<String> outcome = serializable.inTransaction(connection -> {
            if (executions.incrementAndGet() == 1) {
                throw new SQLException("could not serialize access", "40001");
            }
            return "done";
        });

        assertThat(outcome.getOrThrow()).isEqualTo("done");
        assertThat(executions.get()).isEqualTo(2);
    }

    @Test
    void inTransaction_listenerIsNotifiedPerRetry() {
        List<Duration> waits = new ArrayList<>();
        AtomicInteger executions = new AtomicInteger();

        runner.inTransaction(connection -> {
            if (executions.incrementAndGet() < 3) {
                throw new SQLTransactionRollbackException("deadlock");
            }
            return "ok";
        }, CancellationToken.none(), (error, wait) -> waits.add(wait));

        assertThat(waits).containsExactly(Duration.ofMillis(1), Duration.ofMillis(1));
    }

    @Test
    void inTransaction_closeFailsAfterCommit_doesNotRunWorkAgain() {
        failClose = true;
        AtomicInteger executions = new AtomicInteger();

        Outcome<String> outcome = runner.inTransaction(connection -> {
            executions.incrementAndGet();
            return "order-17";
        });

        assertThat(outcome.getOrThrow()).isEqualTo("order-17");
        assertThat(executions.get()).isEqualTo(1);
        assertThat(calls).containsExactly("autoCommit=false", "commit", "close");
    }

    @Test
    void inTransaction_closeFailsAfterRollback_isAttachedAsSuppressed() {
        failClose = true;
        SQLException constraint = new SQLException("duplicate key", "23505");

        Outcome<String> outcome = runner.inTransaction(connection -> {
            throw constraint;
        });

        assertThat(outcome.failure().orElseThrow().reason()).isEqualTo(FailureReason.NON_RETRYABLE);
        assertThat(outcome.failure().orElseThrow().attempts()).isEqualTo(1);
        assertThat(constraint.getSuppressed()).hasSize(1);
        assertThat(constraint.getSuppressed()[0]).hasMessage("socket closed");
    }

    private Connection openConnection() {
        connectionsOpened.incrementAndGet();
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class<?>[]{Connection.class},
                (proxy, method, args) -> {
                    switch (method.getName()) {
                        case "setAutoCommit":
                            calls.add("autoCommit=" + args[0]);
                            return null;
                        case "commit":
                            calls.add("commit");
                            return null;
                        case "rollback":
                            calls.add("rollback");
                            if (failRollback) {
                                throw new SQLException("rollback failed");
                            }
                            return null;
                        case "close":
                            calls.add("close");
                            if (failClose) {
                                throw new SQLRecoverableException("socket closed");
                            }
                            return null;
                        case "toString":
                            return "FakeConnection";
                        case "hashCode":
                            return System.identityHashCode(proxy);
                        case "equals":
                            return proxy == args[0];
                        default:
                            if (method.getReturnType() == boolean.class) {
                                return false;
                            }
                            if (method.getReturnType() == int.class) {
                                return 0;
                            }
                            return null;
                    }
                });
    }
}
