package net.scanorama.integration.spring.tx;

import net.scanorama.adapter.jdbc.TxContext;
import net.scanorama.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * Runs the JDBC repositories inside Spring managed transactions: the transaction's connection is
 * bound to {@link TxContext} for the duration of the body. A checked exception from the body marks
 * the transaction rollback-only and is rethrown as is.
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
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);

        Exception[] failure = new Exception[1];
        T result = tpl.execute(status -> {
            Connection outer = TxContext.get();
            Connection con = DataSourceUtils.getConnection(ds);
            try {
                TxContext.set(con);
                return body.call();
            } catch (RuntimeException re) {
                throw re;
            } catch (Exception e) {
                status.setRollbackOnly();
                failure[0] = e;
                return null;
            } finally {
                if (outer != null) TxContext.set(outer);
                else TxContext.clear();
                DataSourceUtils.releaseConnection(con, ds);
            }
        });
        if (failure[0] != null) throw failure[0];
        return result;
    }
}
