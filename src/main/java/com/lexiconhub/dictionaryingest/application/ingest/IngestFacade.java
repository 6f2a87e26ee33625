package com.lexiconhub.dictionaryingest.application.ingest;

import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo.ChildTextStagingRepo;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo.CrossReferenceStagingRepo;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo.DefinitionStagingRepo;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.repo.EtymologyStagingRepo;
import org.springframework.stereotype.Component;

/**
 * staging 적재에 사용하는 Repository들을 한 곳에 모아 제공하는 파사드(Facade) 컴포넌트입니다.
 * <p>
 * 적재 서비스의 Repo 의존성을 줄이고, 배치 적재 흐름을 읽기 쉽게 구성하기 위한 용도입니다.
 */
@Component
public class IngestFacade {

    /** parsed_definition_staging */
    public final DefinitionStagingRepo definition;

    /** 별칭/동의어/예문 staging */
    public final ChildTextStagingRepo childText;

    /** parsed_cross_reference_staging */
    public final CrossReferenceStagingRepo crossReference;

    /** parsed_etymology_staging */
    public final EtymologyStagingRepo etymology;

    public IngestFacade(
            DefinitionStagingRepo definition,
            ChildTextStagingRepo childText,
            CrossReferenceStagingRepo crossReference,
            EtymologyStagingRepo etymology
    ) {
        this.definition = definition;
        this.childText = childText;
        this.crossReference = crossReference;
        this.etymology = etymology;
    }
}
