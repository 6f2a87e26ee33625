package com.lexiconhub.dictionaryingest.infrastructure.mapper;

import com.lexiconhub.dictionaryingest.application.ingest.model.CrossReference;
import com.lexiconhub.dictionaryingest.application.ingest.model.Etymology;
import com.lexiconhub.dictionaryingest.application.ingest.model.FrozenBatch;
import com.lexiconhub.dictionaryingest.application.ingest.model.FrozenItem;
import com.lexiconhub.dictionaryingest.infrastructure.input.ndjson.NormalizeUtils;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row.ChildTextStagingRow;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row.CrossReferenceStagingRow;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row.DefinitionStagingRow;
import com.lexiconhub.dictionaryingest.infrastructure.persistence.r2dbc.row.EtymologyStagingRow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 동결된 배치({@link FrozenBatch})를 staging 테이블별 행 묶음으로 변환하는 매퍼입니다.
 * <p>
 * 부모 행 하나당 {@code (batchId, seqId)}를 부여하고, 하위 행은 같은 키로 부모를 가리킵니다.
 * 입력 순서가 그대로 유지되며, 동일 입력이면 항상 동일한 출력을 만듭니다.
 */
@Component
public class BatchPayloadMapper {

    /**
     * 동결 배치를 staging 적재용 페이로드로 변환합니다.
     *
     * @param batch 동결 배치
     * @return 테이블별 행 묶음
     */
    public RelationalPayload build(FrozenBatch batch) {
        String batchId = batch.batchId();

        List<DefinitionStagingRow> definitions = new ArrayList<>(batch.size());
        List<ChildTextStagingRow> aliases = new ArrayList<>();
        List<ChildTextStagingRow> synonyms = new ArrayList<>();
        List<ChildTextStagingRow> examples = new ArrayList<>();
        List<CrossReferenceStagingRow> crossReferences = new ArrayList<>();
        List<EtymologyStagingRow> etymologies = new ArrayList<>();

        for (FrozenItem it : batch.items()) {
            int seq = it.seqId();

            definitions.add(new DefinitionStagingRow(
                    batchId,
                    seq,
                    it.dictionaryEntryId(),
                    it.parentParsedId(),
                    it.meaningTitle(),
                    NormalizeUtils.normalizedKey(it.meaningTitle()),
                    it.definition(),
                    it.rawFragment(),
                    it.senseNumber(),
                    it.domain(),
                    it.usageLabel(),
                    it.hasNonEnglishText(),
                    it.nonEnglishTextId(),
                    it.sourceCode(),
                    it.createdAt()
            ));

            for (String a : it.aliases()) aliases.add(new ChildTextStagingRow(batchId, seq, a));
            for (String s : it.synonyms()) synonyms.add(new ChildTextStagingRow(batchId, seq, s));
            for (String e : it.examples()) examples.add(new ChildTextStagingRow(batchId, seq, e));

            for (CrossReference ref : it.crossReferences()) {
                crossReferences.add(new CrossReferenceStagingRow(
                        batchId, seq, ref.targetWord(), referenceTypeOrDefault(ref.referenceType())));
            }

            for (Etymology ety : it.etymologies()) {
                etymologies.add(new EtymologyStagingRow(
                        batchId, seq, ety.text(), NormalizeUtils.norm(ety.languageCode()), ety.hasNonEnglishText()));
            }
        }

        return new RelationalPayload(batchId, definitions, aliases, synonyms, examples, crossReferences, etymologies);
    }

    private static String referenceTypeOrDefault(String type) {
        String t = NormalizeUtils.norm(type);
        return t == null ? CrossReference.DEFAULT_TYPE : t;
    }

    /**
     * 배치 하나를 staging 테이블별로 나눈 결과.
     *
     * @param batchId         배치 식별자
     * @param definitions     부모 행
     * @param aliases         별칭 행
     * @param synonyms        동의어 행
     * @param examples        예문 행
     * @param crossReferences 상호 참조 행
     * @param etymologies     어원 행
     */
    public record RelationalPayload(
            String batchId,
            List<DefinitionStagingRow> definitions,
            List<ChildTextStagingRow> aliases,
            List<ChildTextStagingRow> synonyms,
            List<ChildTextStagingRow> examples,
            List<CrossReferenceStagingRow> crossReferences,
            List<EtymologyStagingRow> etymologies
    ) {
        /** 부모/하위를 합친 전체 행 수 */
        public int totalRows() {
            return definitions.size() + aliases.size() + synonyms.size() + examples.size()
                    + crossReferences.size() + etymologies.size();
        }
    }
}
