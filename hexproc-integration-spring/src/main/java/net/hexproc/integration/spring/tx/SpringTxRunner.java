package net.hexproc.integration.spring.tx;

import net.hexproc.adapter.jdbc.TxContext;
import net.hexproc.core.error.StoreUnavailableException;
import net.hexproc.core.spi.TxRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 매니저 위에서 도는 TxRunner.
 * 스프링이 잡은 물리 커넥션을 TxContext 에 꽂아 adapter-jdbc Repository 를 그대로 재사용한다.
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

        // REQUIRES_NEW 면 스프링이 바깥 트랜잭션을 정지하므로 TxContext 도 같이 바꿔 끼우고 끝나면 복원
        Connection outer = TxContext.get();
        try {
            return tpl.execute(status -> {
                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    // 검사 예외도 롤백시키고 바깥에서 원래 타입으로 풀어 던진다
                    throw new CheckedBodyException(e);
                } finally {
                    TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedBodyException e) {
            if (e.checked instanceof SQLException sql) {
                throw new StoreUnavailableException("transaction failed: " + sql.getMessage(), sql);
            }
            throw e.checked;
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("transaction failed: " + e.getMessage(), e);
        } finally {
            if (outer != null) TxContext.set(outer);
        }
    }

    private static final class CheckedBodyException extends RuntimeException {
        final Exception checked;

        CheckedBodyException(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
