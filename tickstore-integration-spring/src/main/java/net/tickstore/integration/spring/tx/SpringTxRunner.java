package net.tickstore.integration.spring.tx;

import net.tickstore.adapter.jdbc.TxContext;
import net.tickstore.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * {@link TxRunner} on top of a Spring {@link PlatformTransactionManager}. The connection Spring
 * binds for the transaction is published through {@link TxContext}, so the JDBC stores run
 * unchanged. Checked exceptions thrown by the body reach the caller as-is.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        try {
            return tpl.execute(status -> {
                // REQUIRED joins the published connection; REQUIRES_NEW gets a fresh one from Spring
                Connection outer = TxContext.get();
                if (outer != null && propagation == TransactionDefinition.PROPAGATION_REQUIRED) {
                    return call(body);
                }

                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    if (outer != null) TxContext.set(outer);
                    else TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (CheckedBodyException e) {
            throw e.getCause();
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedBodyException(e);
        }
    }

    /** Carries a checked exception out of {@link TransactionTemplate}, which rolls back on it. */
    private static final class CheckedBodyException extends RuntimeException {
        CheckedBodyException(Exception cause) { super(cause); }

        @Override
        public synchronized Exception getCause() { return (Exception) super.getCause(); }
    }
}
