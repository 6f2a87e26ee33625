package com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * staging 적재와 병합이 공유하는 트랜잭션 설정.
 * <p>
 * 배치 적재({@code StagingBulkDispatcher})와 소스별 병합({@code StagingMergeService})은
 * 이 operator로 한 단위 작업을 감싸 all-or-nothing으로 처리합니다.
 */
@Configuration
public class R2dbcTxConfig {

    static final String TX_NAME = "dictionary-ingest";

    @Bean
    public ReactiveTransactionManager reactiveTransactionManager(ConnectionFactory cf) {
        return new R2dbcTransactionManager(cf);
    }

    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager tm) {
        return TransactionalOperator.create(tm, ingestDefinition());
    }

    /** Spring 컨텍스트 없이(테스트, 수동 구성) 같은 설정의 operator를 만듭니다. */
    public static TransactionalOperator operatorFor(ConnectionFactory cf) {
        return TransactionalOperator.create(new R2dbcTransactionManager(cf), ingestDefinition());
    }

    private static TransactionDefinition ingestDefinition() {
        DefaultTransactionDefinition def = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRED);
        def.setName(TX_NAME);
        return def;
    }
}
