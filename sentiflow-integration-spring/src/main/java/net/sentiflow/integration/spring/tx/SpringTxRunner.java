package net.sentiflow.integration.spring.tx;

import net.sentiflow.adapter.jdbc.TxContext;
import net.sentiflow.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 경계 안에서 본문을 실행하고, 그 물리 커넥션을 TxContext 로 저장소에 넘긴다.
 * 체크 예외는 템플릿을 통과시키기 위해 감쌌다가 밖에서 원래 예외로 되돌린다.
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

        Connection outer = TxContext.get();
        try {
            return tpl.execute(status -> {
                // REQUIRED 참여면 같은 커넥션, REQUIRES_NEW 면 새 커넥션이 바인딩되어 있다
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CheckedWrapper(e);
                } finally {
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (CheckedWrapper w) {
            throw w.checked;
        } finally {
            if (outer != null) TxContext.set(outer);
            else TxContext.clear();
        }
    }

    private static final class CheckedWrapper extends RuntimeException {
        final Exception checked;

        CheckedWrapper(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
