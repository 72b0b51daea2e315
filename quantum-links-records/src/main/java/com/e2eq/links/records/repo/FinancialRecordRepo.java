package com.e2eq.links.records.repo;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.JsonCodec;
import com.e2eq.links.core.KeyValueStore;
import com.e2eq.links.records.model.FinancialRecord;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Singleton
public class FinancialRecordRepo extends KvRepository<FinancialRecord> {

    static final String SOURCE_TASK = "sourceTaskId";
    static final String SOURCE_SALE = "sourceSaleId";

    @Inject
    public FinancialRecordRepo(KeyValueStore store, JsonCodec codec) {
        super(store, codec, EntityType.FINANCIAL, FinancialRecord.class);
    }

    public List<FinancialRecord> findBySourceTask(String taskId) {
        return findBy(SOURCE_TASK, taskId);
    }

    public List<FinancialRecord> findBySourceSale(String saleId) {
        return findBy(SOURCE_SALE, saleId);
    }

    @Override
    protected Map<String, String> indexedFields(FinancialRecord record) {
        Map<String, String> fields = new LinkedHashMap<>();
        putIfPresent(fields, SOURCE_TASK, record.getSourceTaskId());
        putIfPresent(fields, SOURCE_SALE, record.getSourceSaleId());
        return fields;
    }
}
