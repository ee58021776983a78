package com.vedant.salesanalyst.repository;

import com.vedant.salesanalyst.entity.QueryHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QueryHistoryRepository extends JpaRepository<QueryHistory, Long> {

    List<QueryHistory> findBySchemaNameOrderBySavedAtDesc(String schemaName, Pageable pageable);
}
